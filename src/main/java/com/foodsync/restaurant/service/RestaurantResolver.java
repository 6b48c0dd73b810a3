package com.foodsync.restaurant.service;

import com.foodsync.order.payload.ExternalOrder;
import com.foodsync.restaurant.entity.Restaurant;
import com.foodsync.restaurant.repository.RestaurantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.Optional;

/**
 * 주문의 매장을 restaurant key로 찾거나 만든다.
 * 호출한 주문 트랜잭션 안에서 실행되며, 키가 없는 주문은 매장 없이 저장된다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RestaurantResolver {

    private final RestaurantRepository restaurantRepository;

    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<Restaurant> resolve(ExternalOrder order) {
        if (!StringUtils.hasText(order.restaurantKey())) {
            return Optional.empty();
        }
        return Optional.of(restaurantRepository.findByRestaurantKey(order.restaurantKey())
                .orElseGet(() -> create(order)));
    }

    private Restaurant create(ExternalOrder order) {
        Restaurant restaurant = Restaurant.builder()
                .externalId(order.restaurantId())
                .restaurantKey(order.restaurantKey())
                .name(order.restaurantName() != null ? order.restaurantName() : order.restaurantKey())
                .timezone(order.restaurantTimezone())
                .currency(order.currency())
                .build();
        Restaurant saved = restaurantRepository.save(restaurant);
        log.info("Restaurant created: key={}, id={}", saved.getRestaurantKey(), saved.getId());
        return saved;
    }
}
