package com.foodsync.stats;

import com.foodsync.client.repository.ClientRepository;
import com.foodsync.common.cache.CacheKey;
import com.foodsync.common.cache.ResultCache;
import com.foodsync.order.entity.OrderType;
import com.foodsync.order.repository.OrderRepository;
import com.foodsync.stats.DashboardStats.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 대시보드 통계 서비스.
 *
 * <h3>집계 항목</h3>
 * <ul>
 *   <li>기간별 주문 수와 매출: 오늘, 최근 7일, 최근 30일</li>
 *   <li>주문 유형별(pickup, delivery) 건수</li>
 *   <li>최근 주문 10건, 주문 수 상위 고객 5명</li>
 * </ul>
 *
 * <p>주문이 새로 저장될 때마다 캐시된 집계가 무효화된다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class DashboardStatsService {

    private final OrderRepository orderRepository;
    private final ClientRepository clientRepository;
    private final ResultCache resultCache;
    private final Clock clock;

    public DashboardStats getDashboardStats() {
        Optional<DashboardStats> cached = resultCache.get(CacheKey.DASHBOARD_STATS, DashboardStats.class);
        if (cached.isPresent()) {
            return cached.get();
        }

        LocalDate today = LocalDate.now(clock);
        DashboardStats stats = new DashboardStats(
                periodSince(today.atStartOfDay()),
                periodSince(today.minusDays(7).atStartOfDay()),
                periodSince(today.minusDays(30).atStartOfDay()),
                new OrdersByType(orderRepository.countByType(OrderType.PICKUP),
                        orderRepository.countByType(OrderType.DELIVERY)),
                recentOrders(),
                topClients());

        resultCache.put(CacheKey.DASHBOARD_STATS, stats);
        log.debug("Dashboard stats computed: today={}", stats.today());
        return stats;
    }

    private PeriodStats periodSince(LocalDateTime from) {
        long orders = orderRepository.countByCreatedAtGreaterThanEqual(from);
        BigDecimal revenue = orderRepository.sumTotalPriceSince(from);
        if (revenue == null) {
            revenue = BigDecimal.ZERO;
        }
        BigDecimal average = orders == 0
                ? BigDecimal.ZERO
                : revenue.divide(BigDecimal.valueOf(orders), 2, RoundingMode.HALF_UP);
        return new PeriodStats(orders, revenue, average);
    }

    private List<RecentOrder> recentOrders() {
        return orderRepository.findTop10ByOrderByCreatedAtDescIdDesc().stream()
                .map(o -> new RecentOrder(o.getId(), o.getExternalId(), o.getType().getCode(),
                        o.getTotalPrice(), o.getCurrency(), o.getCreatedAt()))
                .toList();
    }

    private List<TopClient> topClients() {
        return clientRepository.findTop5ByOrderByOrderCountDescIdAsc().stream()
                .map(c -> new TopClient(c.getId(), c.getFirstName(), c.getLastName(), c.getOrderCount()))
                .toList();
    }
}
