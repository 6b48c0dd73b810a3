package com.foodsync.gloriafood;

import com.foodsync.menu.payload.MenuSnapshot;
import com.foodsync.order.payload.OrderBatch;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;

/**
 * 주문 플랫폼 POS API의 OpenFeign 클라이언트.
 *
 * <p>인증 헤더와 타임아웃은 {@link GloriaFoodFeignConfig}가 붙인다.
 * 직접 호출하지 않고 Circuit Breaker가 걸린 {@link GloriaFoodFetcher}를 거친다.</p>
 */
@FeignClient(name = "gloriafood", url = "${foodsync.gloriafood.api-url:https://pos.globalfoodsoft.com}")
public interface GloriaFoodClient {

    /** 대기 중인 주문을 꺼낸다. 한 번 꺼낸 주문은 다시 오지 않는다. */
    @PostMapping("/pos/order/pop")
    OrderBatch popOrders();

    /** 현재 메뉴 전체 스냅샷 */
    @GetMapping("/pos/menu")
    MenuSnapshot fetchMenu();
}
