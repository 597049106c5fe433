package com.railwise.backend.controller;

import com.railwise.backend.model.SystemStatus;
import com.railwise.backend.service.SystemStatusService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/health")
@RequiredArgsConstructor
@Tag(name = "Health", description = "Service health")
public class HealthController {

    private final SystemStatusService systemStatusService;

    @Operation(summary = "Health Check", description = "503 when no schedules or stations are loaded.")
    @GetMapping
    public ResponseEntity<SystemStatus> health() {
        SystemStatus status = systemStatusService.getSystemStatus();
        HttpStatus code = "healthy".equals(status.getStatus()) ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(code).body(status);
    }
}
