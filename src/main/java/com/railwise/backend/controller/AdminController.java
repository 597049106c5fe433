package com.railwise.backend.controller;

import com.railwise.backend.model.RefreshSummary;
import com.railwise.backend.model.SystemStatus;
import com.railwise.backend.service.SystemStatusService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Admin", description = "Administrative operations for manual data refreshing and monitoring")
public class AdminController {

    private final SystemStatusService systemStatusService;

    @Operation(summary = "Trigger Manual Refresh", description = "Reloads schedules and stations from disk and removes stale crowd confirmations.")
    @ApiResponse(responseCode = "200", description = "Refresh completed successfully")
    @PostMapping("/refresh-data")
    public ResponseEntity<RefreshSummary> refresh() {
        log.info("🔄 ADMIN: Manual data refresh triggered");
        return ResponseEntity.ok(systemStatusService.refreshData());
    }

    @Operation(summary = "System Status", description = "Loaded data, crowd totals and component health.")
    @GetMapping("/system-status")
    public SystemStatus systemStatus() {
        return systemStatusService.getSystemStatus();
    }
}
