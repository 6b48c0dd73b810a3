package com.foodsync.stats;

import com.foodsync.common.dto.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/stats")
@RequiredArgsConstructor
public class StatsController {

    private final DashboardStatsService dashboardStatsService;

    @GetMapping("/dashboard")
    public ApiResponse<DashboardStats> getDashboard() {
        return ApiResponse.ok(dashboardStatsService.getDashboardStats());
    }
}
