package com.example.potholereporter.controller;

import com.example.potholereporter.model.Severity;
import com.example.potholereporter.model.api.ActionResponse;
import com.example.potholereporter.model.api.NotifyResponse;
import com.example.potholereporter.model.api.ReportActionRequest;
import com.example.potholereporter.model.api.ReportSubmissionResponse;
import com.example.potholereporter.model.report.Report;
import com.example.potholereporter.model.report.ReportStatus;
import com.example.potholereporter.security.AuthenticatedUser;
import com.example.potholereporter.security.ReportAccessPolicy;
import com.example.potholereporter.service.lifecycle.Actor;
import com.example.potholereporter.service.report.ReportFilter;
import com.example.potholereporter.service.report.ReportService;
import com.example.potholereporter.service.report.ReportSubmission;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.util.List;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@Tag(name = "Reports", description = "Pothole report submission and repair workflow")
public class ReportController {

    private static final Logger log = LoggerFactory.getLogger(ReportController.class);

    private final ReportService reportService;

    public ReportController(ReportService reportService) {
        this.reportService = reportService;
    }

    @PostMapping(value = "/api/reports", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Submit a street photo",
            description = "Detects potholes in the image, estimates area, severity and repair cost, and stores a Pending report.")
    public ResponseEntity<ReportSubmissionResponse> submit(
            @RequestPart("image") MultipartFile image,
            @RequestParam("location") String location,
            @Parameter(description = "JSON object such as {\"lat\": 18.52, \"lng\": 73.85}")
            @RequestParam("coordinates") String coordinates,
            @RequestParam(value = "distanceFactor", required = false) Double distanceFactor,
            @AuthenticationPrincipal AuthenticatedUser user) {
        if (image == null || image.isEmpty()) {
            throw new ResponseStatusException(BAD_REQUEST, "Image file is required");
        }
        byte[] content;
        try {
            content = image.getBytes();
        } catch (IOException ex) {
            throw new ResponseStatusException(BAD_REQUEST, "Failed to read uploaded image", ex);
        }
        ReportSubmission submission = new ReportSubmission(image.getOriginalFilename(), image.getContentType(),
                content, location, coordinates, distanceFactor);
        Actor actor = user != null ? user.toActor() : Actor.anonymous();
        log.debug("Received {} byte report image from {}", content.length, actor.id() != null ? actor.id() : "anonymous");
        return ResponseEntity.status(HttpStatus.CREATED).body(reportService.submit(submission, actor));
    }

    @GetMapping("/api/reports")
    @SecurityRequirement(name = "bearerAuth")
    @Operation(summary = "List reports, newest first",
            description = "Authorities see every report; citizens see only their own.")
    public List<Report> list(@RequestParam(value = "status", required = false) String status,
                             @RequestParam(value = "severity", required = false) String severity,
                             @AuthenticationPrincipal AuthenticatedUser user) {
        ReportFilter filter = new ReportFilter(
                StringUtils.hasText(status) ? ReportStatus.fromLabel(status) : null,
                StringUtils.hasText(severity) ? Severity.fromLabel(severity) : null,
                null);
        if (!user.isAuthority()) {
            filter = filter.withOwner(user.id());
        }
        return reportService.list(filter);
    }

    @GetMapping("/api/reports/{id}")
    @SecurityRequirement(name = "bearerAuth")
    @Operation(summary = "Fetch one report with its audit trail")
    public Report get(@PathVariable("id") String id, @AuthenticationPrincipal AuthenticatedUser user) {
        Report report = reportService.get(id);
        ReportAccessPolicy.checkCanRead(report, user);
        return report;
    }

    @PostMapping("/api/reports/{id}/actions")
    @PreAuthorize("hasRole('AUTHORITY')")
    @SecurityRequirement(name = "bearerAuth")
    @Operation(summary = "Apply a lifecycle action",
            description = "Known actions: notify-authority, assign-drone, dispatch-drone, inspection-done, schedule-repair, repair-done, notify-citizen. Other names are recorded without changing the status.")
    public ActionResponse applyAction(@PathVariable("id") String id,
                                      @Valid @RequestBody ReportActionRequest request,
                                      @AuthenticationPrincipal AuthenticatedUser user) {
        return reportService.applyAction(id, request.action(), request.notes(), user.toActor());
    }

    @PostMapping("/api/reports/{id}/notify")
    @PreAuthorize("hasRole('AUTHORITY')")
    @SecurityRequirement(name = "bearerAuth")
    @Operation(summary = "Send the report to the road authority by SMS and mark it Reported")
    public NotifyResponse notifyAuthority(@PathVariable("id") String id,
                                          @AuthenticationPrincipal AuthenticatedUser user) {
        return reportService.notifyAuthority(id, null, user.toActor());
    }

    @GetMapping("/api/users/{userId}/reports")
    @SecurityRequirement(name = "bearerAuth")
    @Operation(summary = "List the reports submitted by one user")
    public List<Report> listForUser(@PathVariable("userId") String userId,
                                    @AuthenticationPrincipal AuthenticatedUser user) {
        ReportAccessPolicy.checkCanListFor(userId, user);
        return reportService.listForUser(userId);
    }
}
