package com.foodsync.menu.service;

import com.foodsync.menu.entity.Menu;
import com.foodsync.menu.payload.MenuSnapshot;
import com.foodsync.menu.repository.MenuRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * 메뉴 행을 짧은 별도 트랜잭션으로 만든다. 재구성이 그 행에 락을 잡을 수 있어야 하기 때문.
 * 동시 삽입에서 진 쪽은 {@code DataIntegrityViolationException}을 받고 호출 측이 다시 조회한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MenuRegistrar {

    private final MenuRepository menuRepository;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Long ensureMenu(MenuSnapshot snapshot) {
        return menuRepository.findByExternalId(snapshot.id())
                .map(Menu::getId)
                .orElseGet(() -> {
                    Menu menu = menuRepository.saveAndFlush(Menu.builder()
                            .externalId(snapshot.id())
                            .restaurantExternalId(snapshot.restaurantId())
                            .currency(snapshot.currency())
                            .active(snapshot.active())
                            .build());
                    log.info("Menu created: externalId={}, id={}", snapshot.id(), menu.getId());
                    return menu.getId();
                });
    }
}
