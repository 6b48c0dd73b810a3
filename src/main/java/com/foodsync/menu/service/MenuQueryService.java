package com.foodsync.menu.service;

import com.foodsync.common.cache.CacheKey;
import com.foodsync.common.cache.ResultCache;
import com.foodsync.common.exception.BusinessException;
import com.foodsync.common.exception.ErrorCode;
import com.foodsync.menu.dto.MenuTreeResponse;
import com.foodsync.menu.dto.MenuTreeResponse.*;
import com.foodsync.menu.entity.*;
import com.foodsync.menu.repository.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 전체 메뉴 트리 조회. {@code menu:full} 캐시에 보관한다.
 *
 * <p>단계마다 쿼리 한 번씩 실행하고 메모리에서 부모 id로 묶는다 (N+1 없음).</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class MenuQueryService {

    private final MenuRepository menuRepository;
    private final MenuCategoryRepository categoryRepository;
    private final MenuItemRepository itemRepository;
    private final MenuItemSizeRepository sizeRepository;
    private final ItemOptionGroupRepository itemOptionGroupRepository;
    private final MenuOptionRepository optionRepository;
    private final MenuItemAttributes attributes;
    private final ResultCache resultCache;

    public MenuTreeResponse getFullMenu() {
        Optional<MenuTreeResponse> cached = resultCache.get(CacheKey.MENU_TREE, MenuTreeResponse.class);
        if (cached.isPresent()) {
            return cached.get();
        }

        Menu menu = menuRepository.findFirstByOrderByIdAsc()
                .orElseThrow(() -> new BusinessException(ErrorCode.MENU_NOT_FOUND));
        MenuTreeResponse tree = buildTree(menu);
        resultCache.put(CacheKey.MENU_TREE, tree);
        log.debug("Menu tree rebuilt from store: menuId={}, categories={}", menu.getId(), tree.categories().size());
        return tree;
    }

    private MenuTreeResponse buildTree(Menu menu) {
        Long menuId = menu.getId();

        Map<Long, List<MenuItem>> itemsByCategory = itemRepository.findByMenuId(menuId).stream()
                .collect(Collectors.groupingBy(i -> i.getCategory().getId(), LinkedHashMap::new, Collectors.toList()));
        Map<Long, List<MenuItemSize>> sizesByItem = sizeRepository.findByMenuId(menuId).stream()
                .collect(Collectors.groupingBy(s -> s.getItem().getId(), LinkedHashMap::new, Collectors.toList()));

        List<ItemOptionGroup> links = itemOptionGroupRepository.findByMenuId(menuId);
        Map<Long, List<OptionGroup>> groupsByItem = new HashMap<>();
        Map<Long, List<OptionGroup>> groupsBySize = new HashMap<>();
        for (ItemOptionGroup link : links) {
            if (link.getItem() != null) {
                groupsByItem.computeIfAbsent(link.getItem().getId(), k -> new ArrayList<>()).add(link.getOptionGroup());
            } else if (link.getSize() != null) {
                groupsBySize.computeIfAbsent(link.getSize().getId(), k -> new ArrayList<>()).add(link.getOptionGroup());
            }
        }

        Set<Long> groupIds = links.stream().map(l -> l.getOptionGroup().getId()).collect(Collectors.toSet());
        Map<Long, List<OptionView>> optionsByGroup = groupIds.isEmpty()
                ? Map.of()
                : optionRepository.findByOptionGroupIds(groupIds).stream()
                        .collect(Collectors.groupingBy(o -> o.getOptionGroup().getId(),
                                Collectors.mapping(this::toOptionView, Collectors.toList())));

        List<CategoryView> categories = categoryRepository.findByMenuIdOrderBySortOrderAsc(menuId).stream()
                .map(category -> new CategoryView(category.getId(), category.getExternalId(), category.getName(),
                        category.getDescription(), category.isActive(), category.getSortOrder(),
                        itemsByCategory.getOrDefault(category.getId(), List.of()).stream()
                                .map(item -> toItemView(item,
                                        sizesByItem.getOrDefault(item.getId(), List.of()),
                                        groupsByItem.getOrDefault(item.getId(), List.of()),
                                        groupsBySize, optionsByGroup))
                                .toList()))
                .toList();

        return new MenuTreeResponse(menu.getId(), menu.getExternalId(), menu.getRestaurantExternalId(),
                menu.getCurrency(), menu.isActive(), menu.getSyncedAt(), categories);
    }

    private ItemView toItemView(MenuItem item, List<MenuItemSize> sizes, List<OptionGroup> groups,
                                Map<Long, List<OptionGroup>> groupsBySize,
                                Map<Long, List<OptionView>> optionsByGroup) {
        List<SizeView> sizeViews = sizes.stream()
                .map(size -> new SizeView(size.getId(), size.getExternalId(), size.getName(), size.getPrice(),
                        size.isDefaultSize(), size.getSortOrder(),
                        toGroupViews(groupsBySize.getOrDefault(size.getId(), List.of()), optionsByGroup)))
                .toList();

        return new ItemView(item.getId(), item.getExternalId(), item.getName(), item.getDescription(),
                item.getPrice(), item.isActive(), item.getSortOrder(), item.getKitchenInternalName(),
                attributes.decodeOrEmpty(item.getTags()),
                attributes.decodeOrEmpty(item.getOrderTypes()),
                attributes.decodeOrEmpty(item.getAllergens()),
                attributes.decodeOrEmpty(item.getNutritionalValues()),
                attributes.decode(item.getExtrasResidual()),
                sizeViews,
                toGroupViews(groups, optionsByGroup));
    }

    private List<GroupView> toGroupViews(List<OptionGroup> groups, Map<Long, List<OptionView>> optionsByGroup) {
        return groups.stream()
                .map(group -> new GroupView(group.getId(), group.getExternalId(), group.getName(),
                        group.isRequired(), group.isAllowQuantity(), group.getForceMin(), group.getForceMax(),
                        optionsByGroup.getOrDefault(group.getId(), List.of())))
                .toList();
    }

    private OptionView toOptionView(MenuOption option) {
        return new OptionView(option.getId(), option.getExternalId(), option.getName(), option.getPrice(),
                option.isDefaultOption(), option.getKitchenInternalName(), option.getSortOrder());
    }
}
