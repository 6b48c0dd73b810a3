package com.foodsync.stats;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 대시보드 집계. {@code dashboard:stats} 캐시 값.
 */
public record DashboardStats(
        PeriodStats today,
        PeriodStats week,
        PeriodStats month,
        OrdersByType ordersByType,
        List<RecentOrder> recentOrders,
        List<TopClient> topClients) {

    public record PeriodStats(long orders, BigDecimal revenue, BigDecimal avgOrderValue) {
    }

    public record OrdersByType(long pickup, long delivery) {
    }

    public record RecentOrder(Long id, Long externalId, String type, BigDecimal totalPrice,
                              String currency, LocalDateTime createdAt) {
    }

    public record TopClient(Long id, String firstName, String lastName, int orderCount) {
    }
}
