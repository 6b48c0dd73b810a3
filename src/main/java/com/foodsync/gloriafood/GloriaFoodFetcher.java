package com.foodsync.gloriafood;

import com.foodsync.common.exception.BusinessException;
import com.foodsync.common.exception.ErrorCode;
import com.foodsync.menu.payload.MenuSnapshot;
import com.foodsync.order.payload.OrderBatch;
import feign.FeignException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * 플랫폼 원격 조회 - {@code gloriafood} Circuit Breaker 적용.
 *
 * <p>모든 실패는 원인 텍스트를 담은 {@code REMOTE_FETCH_FAILED}로 나간다.
 * 재시도는 없다. 실패한 풀/동기화는 보고되고, 다음 트리거가 다시 시도한다.</p>
 *
 * <h3>실패 변환 흐름</h3>
 * <pre>
 * FeignException(503)         → "Error fetching menu: 503 ..."
 * 기타 RuntimeException        → "Error fetching menu: {message}"
 * CallNotPermittedException   → "Error fetching menu: circuit breaker is open"
 * 200 + 빈 본문 (메뉴)          → "Error fetching menu: empty response"
 * 200 + 빈 본문 (주문)          → 빈 배치
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GloriaFoodFetcher {

    private final GloriaFoodClient gloriaFoodClient;

    @CircuitBreaker(name = "gloriafood", fallbackMethod = "fetchMenuFallback")
    public MenuSnapshot fetchMenu() {
        MenuSnapshot snapshot = call("fetching menu", gloriaFoodClient::fetchMenu);
        if (snapshot == null) {
            throw new BusinessException(ErrorCode.REMOTE_FETCH_FAILED, "Error fetching menu: empty response");
        }
        return snapshot;
    }

    @CircuitBreaker(name = "gloriafood", fallbackMethod = "popOrdersFallback")
    public OrderBatch popOrders() {
        OrderBatch batch = call("polling orders", gloriaFoodClient::popOrders);
        return batch != null ? batch : new OrderBatch(0, null);
    }

    private <T> T call(String action, Supplier<T> request) {
        try {
            return request.get();
        } catch (FeignException e) {
            throw new BusinessException(ErrorCode.REMOTE_FETCH_FAILED,
                    "Error " + action + ": " + e.status() + " " + e.getMessage(), e);
        } catch (BusinessException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new BusinessException(ErrorCode.REMOTE_FETCH_FAILED,
                    "Error " + action + ": " + e.getMessage(), e);
        }
    }

    // Circuit Breaker fallback: 예외를 BusinessException으로 바꿔 다시 던짐
    @SuppressWarnings("unused")
    private MenuSnapshot fetchMenuFallback(Throwable t) {
        throw translate("fetching menu", t);
    }

    @SuppressWarnings("unused")
    private OrderBatch popOrdersFallback(Throwable t) {
        throw translate("polling orders", t);
    }

    private BusinessException translate(String action, Throwable t) {
        if (t instanceof BusinessException e) {
            log.warn("Remote call failed while {}: {}", action, e.getMessage());
            return e;
        }
        if (t instanceof CallNotPermittedException) {
            log.warn("Circuit open, skipping remote call while {}", action);
            return new BusinessException(ErrorCode.REMOTE_FETCH_FAILED,
                    "Error " + action + ": circuit breaker is open", t);
        }
        log.warn("Remote call failed while {}: {}", action, t.getMessage());
        return new BusinessException(ErrorCode.REMOTE_FETCH_FAILED, "Error " + action + ": " + t.getMessage(), t);
    }
}
