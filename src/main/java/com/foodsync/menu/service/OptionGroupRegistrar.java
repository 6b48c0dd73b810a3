package com.foodsync.menu.service;

import com.foodsync.menu.entity.MenuOption;
import com.foodsync.menu.entity.OptionGroup;
import com.foodsync.menu.payload.MenuSnapshot.OptionGroupPayload;
import com.foodsync.menu.payload.MenuSnapshot.OptionPayload;
import com.foodsync.menu.repository.MenuOptionRepository;
import com.foodsync.menu.repository.OptionGroupRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * 새 옵션 그룹을 옵션과 함께 저장하고 바로 커밋한다 ({@code REQUIRES_NEW}).
 *
 * <p>옵션 그룹은 메뉴 간에 공유되고 동기화로 삭제되지 않는다.
 * 재구성이 실패해 롤백되어도 여기서 만든 그룹은 남고, 다음 동기화가 재사용한다.</p>
 *
 * <p>같은 외부 id를 동시에 넣으면 유니크 키 위반이 나고, 호출 측이 다시 조회해서 이긴 행을 쓴다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OptionGroupRegistrar {

    private final OptionGroupRepository optionGroupRepository;
    private final MenuOptionRepository menuOptionRepository;

    public record Registration(Long groupId, boolean created, int optionCount) {
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Registration createIfAbsent(OptionGroupPayload payload) {
        Optional<OptionGroup> existing = optionGroupRepository.findByExternalId(payload.id());
        if (existing.isPresent()) {
            return new Registration(existing.get().getId(), false, 0);
        }

        OptionGroup group = optionGroupRepository.saveAndFlush(OptionGroup.builder()
                .externalId(payload.id())
                .name(payload.name())
                .required(payload.required())
                .allowQuantity(payload.allowQuantity())
                .forceMin(payload.forceMin())
                .forceMax(payload.forceMax())
                .build());

        List<OptionPayload> options = payload.optionsOrEmpty();
        for (int i = 0; i < options.size(); i++) {
            OptionPayload option = options.get(i);
            menuOptionRepository.save(MenuOption.builder()
                    .optionGroup(group)
                    .externalId(option.id())
                    .name(option.name())
                    .price(option.price())
                    .defaultOption(option.isDefault())
                    .kitchenInternalName(option.kitchenInternalName())
                    .sortOrder(i)
                    .build());
        }
        log.debug("Option group created: externalId={}, options={}", payload.id(), options.size());
        return new Registration(group.getId(), true, options.size());
    }
}
