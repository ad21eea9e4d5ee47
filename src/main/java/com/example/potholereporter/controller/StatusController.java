package com.example.potholereporter.controller;

import com.example.potholereporter.model.api.StatusResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Status")
public class StatusController {

    @GetMapping("/api")
    @Operation(summary = "Check that the service is running")
    public StatusResponse status() {
        return new StatusResponse("Pothole Reporter API", "running");
    }
}
