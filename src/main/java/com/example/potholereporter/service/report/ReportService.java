package com.example.potholereporter.service.report;

import com.example.potholereporter.config.PotholeProperties;
import com.example.potholereporter.model.AggregateResult;
import com.example.potholereporter.model.Detection;
import com.example.potholereporter.model.RepairEstimate;
import com.example.potholereporter.model.Severity;
import com.example.potholereporter.model.api.ActionResponse;
import com.example.potholereporter.model.api.NotifyResponse;
import com.example.potholereporter.model.api.ReportSubmissionResponse;
import com.example.potholereporter.model.notification.Notification;
import com.example.potholereporter.model.report.DroneStatus;
import com.example.potholereporter.model.report.GeoPoint;
import com.example.potholereporter.model.report.Report;
import com.example.potholereporter.model.report.ReportStatus;
import com.example.potholereporter.service.detection.DetectionAnnotator;
import com.example.potholereporter.service.detection.EncodedImage;
import com.example.potholereporter.service.detection.PotholeDetector;
import com.example.potholereporter.service.detection.UploadedImage;
import com.example.potholereporter.service.estimation.CostEstimator;
import com.example.potholereporter.service.estimation.GeometricEstimator;
import com.example.potholereporter.service.estimation.SeverityClassifier;
import com.example.potholereporter.service.lifecycle.Actor;
import com.example.potholereporter.service.lifecycle.LifecycleAction;
import com.example.potholereporter.service.lifecycle.ReportLifecycle;
import com.example.potholereporter.service.lifecycle.Transition;
import com.example.potholereporter.service.notification.NotificationService;
import com.example.potholereporter.service.storage.ImageStorage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Orchestrates report submission and the authority workflow on top of the
 * detection, storage, persistence and notification gateways.
 */
@Service
public class ReportService {

    private static final Logger log = LoggerFactory.getLogger(ReportService.class);

    static final int LIST_LIMIT = 1000;
    static final String ANNOTATED_PREFIX = "processed_";

    private final PotholeDetector detector;
    private final GeometricEstimator estimator;
    private final ImageStorage imageStorage;
    private final ReportStore reportStore;
    private final NotificationService notificationService;
    private final ReportLifecycle lifecycle;
    private final ObjectMapper objectMapper;
    private final String authorityPhone;

    @Autowired
    public ReportService(PotholeDetector detector,
                         GeometricEstimator estimator,
                         ImageStorage imageStorage,
                         ReportStore reportStore,
                         NotificationService notificationService,
                         ReportLifecycle lifecycle,
                         ObjectMapper objectMapper,
                         PotholeProperties properties) {
        this(detector, estimator, imageStorage, reportStore, notificationService, lifecycle, objectMapper,
                properties.sms().authorityPhone());
    }

    ReportService(PotholeDetector detector,
                  GeometricEstimator estimator,
                  ImageStorage imageStorage,
                  ReportStore reportStore,
                  NotificationService notificationService,
                  ReportLifecycle lifecycle,
                  ObjectMapper objectMapper,
                  String authorityPhone) {
        this.detector = detector;
        this.estimator = estimator;
        this.imageStorage = imageStorage;
        this.reportStore = reportStore;
        this.notificationService = notificationService;
        this.lifecycle = lifecycle;
        this.objectMapper = objectMapper;
        this.authorityPhone = authorityPhone;
    }

    public ReportSubmissionResponse submit(ReportSubmission submission, Actor actor) {
        if (submission.content().length == 0) {
            throw new IllegalArgumentException("Image file must not be empty");
        }
        if (submission.location() == null || submission.location().isBlank()) {
            throw new IllegalArgumentException("Location must not be blank");
        }
        GeoPoint coordinates = parseCoordinates(submission.coordinates());
        double distanceFactor = submission.distanceFactor() != null
                ? submission.distanceFactor()
                : GeometricEstimator.DEFAULT_DISTANCE_FACTOR;
        if (!Double.isFinite(distanceFactor) || distanceFactor <= 0d) {
            throw new IllegalArgumentException("Distance factor must be a positive number");
        }
        BufferedImage pixels = decode(submission.content());

        UploadedImage image = new UploadedImage(submission.fileName(), submission.contentType(),
                submission.content(), pixels);
        List<Detection> detections = detector.detect(image);
        AggregateResult aggregate = estimator.aggregate(detections, image.width(), distanceFactor);
        Severity severity = SeverityClassifier.classify(aggregate.totalAreaSquareMeters());
        RepairEstimate estimate = CostEstimator.estimate(severity, aggregate.totalAreaSquareMeters());

        String reportId = UUID.randomUUID().toString();
        String baseName = UUID.randomUUID().toString();
        String imageUrl = imageStorage.store(submission.content(), baseName + extensionOf(submission.fileName()),
                submission.contentType());
        String annotatedImageUrl = null;
        if (aggregate.count() > 0) {
            BufferedImage annotated = DetectionAnnotator.annotate(pixels, detections);
            EncodedImage encoded = DetectionAnnotator.encode(annotated, submission.contentType());
            annotatedImageUrl = imageStorage.store(encoded.content(),
                    ANNOTATED_PREFIX + baseName + encoded.extension(), encoded.contentType());
        }

        Actor uploader = actor != null ? actor : Actor.anonymous();
        Transition upload = lifecycle.resolve(LifecycleAction.UPLOAD, uploader, null);
        Instant createdAt = upload.entry().timestamp();
        Report report = new Report(
                reportId,
                uploader.id(),
                imageUrl,
                annotatedImageUrl,
                submission.location().trim(),
                coordinates,
                aggregate.count(),
                aggregate.totalAreaSquareMeters(),
                aggregate.meanConfidence(),
                severity,
                estimate.material(),
                estimate.bagsRequired(),
                estimate.estimatedCost(),
                ReportStatus.PENDING,
                DroneStatus.UNASSIGNED,
                List.of(upload.entry()),
                createdAt,
                createdAt);
        Report stored = reportStore.insert(report);
        log.info("Stored report {} with {} detections, severity {} and estimated cost {}",
                reportId, aggregate.count(), severity.label(), estimate.estimatedCost());
        return new ReportSubmissionResponse(stored, aggregate.detections());
    }

    public List<Report> list(ReportFilter filter) {
        return reportStore.find(filter, LIST_LIMIT);
    }

    public List<Report> listForUser(String userId) {
        return reportStore.find(ReportFilter.ownedBy(userId), LIST_LIMIT);
    }

    public Report get(String reportId) {
        return reportStore.findById(reportId).orElseThrow(() -> new ReportNotFoundException(reportId));
    }

    public ActionResponse applyAction(String reportId, String action, String notes, Actor actor) {
        Optional<LifecycleAction> known = LifecycleAction.lookup(action);
        if (known.isPresent() && known.get() == LifecycleAction.NOTIFY_AUTHORITY) {
            NotifyResponse notified = notifyAuthority(reportId, notes, actor);
            Report report = get(reportId);
            return new ActionResponse(notified.message(), notified.newStatus(), report);
        }
        if (known.isPresent() && known.get() == LifecycleAction.UPLOAD) {
            throw new IllegalArgumentException("The upload action is recorded only when a report is created");
        }

        Transition transition = lifecycle.resolve(action, actor, notes);
        Report updated = reportStore.applyTransition(reportId, transition)
                .orElseThrow(() -> new ReportNotFoundException(reportId));
        log.info("Applied action '{}' to report {}; status is now {}",
                transition.entry().action(), reportId, updated.status().label());
        String message = transition.changesStatus() ? "Status updated" : "Action recorded";
        return new ActionResponse(message, updated.status(), updated);
    }

    /**
     * Sends the authority SMS and marks the report as Reported. A failed SMS is
     * recorded as a failed notification and does not fail the call.
     */
    public NotifyResponse notifyAuthority(String reportId, String notes, Actor actor) {
        Report report = get(reportId);
        Notification notification = notificationService.send(authorityPhone, authorityMessage(report), reportId);
        Transition transition = lifecycle.resolve(LifecycleAction.NOTIFY_AUTHORITY, actor, notes);
        Report updated = reportStore.applyTransition(reportId, transition)
                .orElseThrow(() -> new ReportNotFoundException(reportId));
        return new NotifyResponse("Authorities notified", notification.id(), notification.status(), updated.status());
    }

    static String authorityMessage(Report report) {
        return String.format(Locale.ROOT,
                "New pothole reported at %s. Severity: %s, Area: %.2fm², Cost: ₹%d. ID: %s",
                report.location(), report.severity().label(), report.totalAreaSquareMeters(),
                report.estimatedCost(), report.id());
    }

    GeoPoint parseCoordinates(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("Coordinates must not be blank");
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Coordinates must be a JSON object with lat and lng", ex);
        }
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Coordinates must be a JSON object with lat and lng");
        }
        JsonNode latitude = node.has("lat") ? node.get("lat") : node.get("latitude");
        JsonNode longitude = node.has("lng") ? node.get("lng") : node.get("longitude");
        if (latitude == null || !latitude.isNumber() || longitude == null || !longitude.isNumber()) {
            throw new IllegalArgumentException("Coordinates must contain numeric lat and lng values");
        }
        return new GeoPoint(latitude.doubleValue(), longitude.doubleValue());
    }

    private static BufferedImage decode(byte[] content) {
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(content));
            if (image == null) {
                throw new IllegalArgumentException("Unsupported image format");
            }
            return image;
        } catch (IOException ex) {
            throw new IllegalArgumentException("Unable to read image", ex);
        }
    }

    private static String extensionOf(String fileName) {
        if (fileName == null) {
            return "";
        }
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return "";
        }
        String extension = fileName.substring(dot).toLowerCase(Locale.ROOT);
        return extension.matches("\\.[a-z0-9]{1,5}") ? extension : "";
    }
}
