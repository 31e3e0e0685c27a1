package org.theridian.controllers;

import lombok.extern.slf4j.Slf4j;
import org.theridian.models.dto.DashboardStatsDTO;
import org.theridian.service.DashboardService;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/v1/dashboard")
@CrossOrigin(origins = "*")
public class DashboardController {

    private final DashboardService dashboardService;

    public DashboardController(DashboardService dashboardService) {
        this.dashboardService = dashboardService;
    }

    @GetMapping("/stats")
    public ResponseEntity<DashboardStatsDTO> getStats(Authentication authentication) {
        log.info("Dashboard stats requested by {}", authentication != null ? authentication.getName() : "anonymous");
        return ResponseEntity.ok(dashboardService.getStats());
    }
}
