package com.foodsync.menu.service;

import com.foodsync.common.cache.CacheKey;
import com.foodsync.common.cache.ResultCache;
import com.foodsync.common.exception.BusinessException;
import com.foodsync.common.exception.ErrorCode;
import com.foodsync.menu.entity.*;
import com.foodsync.menu.payload.ItemExtras;
import com.foodsync.menu.payload.MenuSnapshot;
import com.foodsync.menu.payload.MenuSnapshot.CategoryPayload;
import com.foodsync.menu.payload.MenuSnapshot.ItemPayload;
import com.foodsync.menu.payload.MenuSnapshot.OptionGroupPayload;
import com.foodsync.menu.payload.MenuSnapshot.SizePayload;
import com.foodsync.menu.repository.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;

/**
 * 메뉴 재구성기 (Menu Rebuilder) - 메뉴 하나의 하위 트리를 스냅샷 내용으로 교체한다.
 *
 * <h3>★ 원자적 교체</h3>
 * <p>메뉴 행에 쓰기 락({@code SELECT ... FOR UPDATE})을 잡은 단일 트랜잭션에서 실행된다.</p>
 * <pre>
 * 1. findByIdForUpdate(menuId)   → 같은 메뉴의 두 번째 동기화는 여기서 대기
 * 2. clearSubtree()              → 링크, 사이즈, 아이템, 카테고리 삭제
 * 3. 스냅샷 순회하며 새 트리 저장
 * 4. 커밋 → 새 트리 공개 + 메뉴 캐시 무효화
 *    실패 → 롤백, 조회 측은 계속 이전 트리를 봄
 * </pre>
 *
 * <h3>깊이 우선 작업 목록</h3>
 * <p>재귀 대신 {@link Deque} 작업 목록으로 스냅샷을 깊이 우선 순회한다.
 * 중첩이 깊어져도 호출 스택은 늘지 않고, 노드마다 기한을 확인한다.</p>
 *
 * <h3>옵션 그룹</h3>
 * <p>외부 id로 식별한다. 처음 보는 그룹은 옵션과 함께 {@link OptionGroupRegistrar}로 만들고,
 * 이미 있는 그룹은 자기 속성만 갱신한다. 같은 (아이템, 사이즈, 그룹) 링크는 한 번만 저장한다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MenuRebuilder {

    private final MenuRepository menuRepository;
    private final MenuCategoryRepository categoryRepository;
    private final MenuItemRepository itemRepository;
    private final MenuItemSizeRepository sizeRepository;
    private final OptionGroupRepository optionGroupRepository;
    private final ItemOptionGroupRepository itemOptionGroupRepository;
    private final OptionGroupRegistrar optionGroupRegistrar;
    private final MenuItemAttributes attributes;
    private final ResultCache resultCache;

    private interface Node {
    }

    private record CategoryNode(CategoryPayload payload, int sortOrder) implements Node {
    }

    private record ItemNode(MenuCategory category, ItemPayload payload, int sortOrder) implements Node {
    }

    private record SizeNode(MenuItem item, SizePayload payload, int sortOrder) implements Node {
    }

    /** 카테고리 단위 그룹이면 item, size 둘 다 null */
    private record GroupNode(OptionGroupPayload payload, MenuItem item, MenuItemSize size) implements Node {
    }

    private record LinkKey(Long itemId, Long sizeId, Long groupId) {
    }

    /** 재구성 한 번의 집계와 링크 중복 제거 */
    private static final class Tally {
        private int categories;
        private int items;
        private int sizes;
        private int optionGroups;
        private int options;
        private final Set<LinkKey> links = new HashSet<>();

        MenuSyncResult toResult() {
            return new MenuSyncResult(categories, items, sizes, optionGroups, options);
        }
    }

    /**
     * 하위 트리 교체.
     *
     * @param menuId   락을 잡을 메뉴 행 id
     * @param snapshot 플랫폼에서 받은 메뉴 스냅샷
     * @param run      단계와 기한을 가진 현재 동기화 실행
     * @throws BusinessException 기한 초과 {@code SYNC_TIMEOUT}, 그룹 id 누락 {@code INVALID_MENU_SNAPSHOT}
     */
    @Transactional(timeout = 300) // 바깥 한도, 실제 기한은 SyncRun
    public MenuSyncResult rebuild(Long menuId, MenuSnapshot snapshot, SyncRun run) {
        Menu menu = menuRepository.findByIdForUpdate(menuId)
                .orElseThrow(() -> new BusinessException(ErrorCode.PERSISTENCE_FAILED,
                        "Menu row disappeared before rebuild: " + menuId));
        menu.refresh(snapshot.currency(), snapshot.active());

        run.advance(SyncPhase.REBUILDING);
        clearSubtree(menuId);

        Tally tally = new Tally();
        Deque<Node> worklist = new ArrayDeque<>();
        List<CategoryPayload> categories = snapshot.categoriesOrEmpty();
        for (int i = categories.size() - 1; i >= 0; i--) {
            worklist.push(new CategoryNode(categories.get(i), i));
        }

        while (!worklist.isEmpty()) {
            checkDeadline(run);
            Node node = worklist.pop();
            if (node instanceof CategoryNode categoryNode) {
                visitCategory(menu, categoryNode, worklist, tally);
            } else if (node instanceof ItemNode itemNode) {
                visitItem(itemNode, worklist, tally);
            } else if (node instanceof SizeNode sizeNode) {
                visitSize(sizeNode, worklist, tally);
            } else if (node instanceof GroupNode groupNode) {
                visitGroup(groupNode, tally);
            }
        }

        run.advance(SyncPhase.FINALIZING);
        menu.markSynced();
        resultCache.invalidate(CacheKey.MENU_TREE);

        MenuSyncResult result = tally.toResult();
        log.info("Menu rebuilt: menuId={}, externalId={}, result={}", menuId, snapshot.id(), result);
        return result;
    }

    private void clearSubtree(Long menuId) {
        int links = itemOptionGroupRepository.deleteByMenuId(menuId);
        int sizes = sizeRepository.deleteByMenuId(menuId);
        int items = itemRepository.deleteByMenuId(menuId);
        int categories = categoryRepository.deleteByMenuId(menuId);
        log.debug("Menu subtree cleared: menuId={}, categories={}, items={}, sizes={}, links={}",
                menuId, categories, items, sizes, links);
    }

    private void checkDeadline(SyncRun run) {
        if (Thread.currentThread().isInterrupted()) {
            throw new BusinessException(ErrorCode.SYNC_TIMEOUT, "Menu rebuild interrupted");
        }
        if (run.isExpired()) {
            throw new BusinessException(ErrorCode.SYNC_TIMEOUT,
                    "Menu rebuild exceeded its deadline " + run.getDeadline());
        }
    }

    private void visitCategory(Menu menu, CategoryNode node, Deque<Node> worklist, Tally tally) {
        CategoryPayload payload = node.payload();
        MenuCategory category = categoryRepository.save(MenuCategory.builder()
                .menu(menu)
                .externalId(payload.id())
                .name(payload.name())
                .description(payload.description())
                .active(payload.active())
                .sortOrder(node.sortOrder())
                .build());
        tally.categories++;

        // 카테고리 그룹은 아이템 다음에 처리, 링크 없음
        List<Node> children = new ArrayList<>();
        List<ItemPayload> items = payload.items() != null ? payload.items() : List.of();
        for (int i = 0; i < items.size(); i++) {
            children.add(new ItemNode(category, items.get(i), i));
        }
        groupsOf(payload.groups()).forEach(group -> children.add(new GroupNode(group, null, null)));
        pushAll(worklist, children);
    }

    private void visitItem(ItemNode node, Deque<Node> worklist, Tally tally) {
        ItemPayload payload = node.payload();
        ItemExtras extras = payload.extras();
        MenuItem item = itemRepository.save(MenuItem.builder()
                .category(node.category())
                .externalId(payload.id())
                .name(payload.name())
                .description(payload.description())
                .price(payload.price())
                .active(payload.active())
                .sortOrder(node.sortOrder())
                .kitchenInternalName(extras != null ? extras.getKitchenInternalName() : null)
                .orderTypes(extras != null ? attributes.encode(extras.getOrderTypes()) : null)
                .tags(attributes.encode(payload.tags()))
                .allergens(extras != null ? attributes.encode(extras.getAllergens()) : null)
                .nutritionalValues(extras != null ? attributes.encode(extras.getNutritionalValues()) : null)
                .extrasResidual(attributes.encodeResidual(extras))
                .build());
        tally.items++;

        List<Node> children = new ArrayList<>();
        List<SizePayload> sizes = payload.sizes() != null ? payload.sizes() : List.of();
        for (int i = 0; i < sizes.size(); i++) {
            children.add(new SizeNode(item, sizes.get(i), i));
        }
        groupsOf(payload.groups()).forEach(group -> children.add(new GroupNode(group, item, null)));
        pushAll(worklist, children);
    }

    private void visitSize(SizeNode node, Deque<Node> worklist, Tally tally) {
        SizePayload payload = node.payload();
        MenuItemSize size = sizeRepository.save(MenuItemSize.builder()
                .item(node.item())
                .externalId(payload.id())
                .name(payload.name())
                .price(payload.price())
                .defaultSize(payload.isDefault())
                .sortOrder(node.sortOrder())
                .build());
        tally.sizes++;

        List<Node> children = new ArrayList<>();
        groupsOf(payload.groups()).forEach(group -> children.add(new GroupNode(group, null, size)));
        pushAll(worklist, children);
    }

    private void visitGroup(GroupNode node, Tally tally) {
        OptionGroup group = resolveGroup(node.payload(), tally);
        if (node.item() == null && node.size() == null) {
            return;
        }

        LinkKey key = new LinkKey(
                node.item() != null ? node.item().getId() : null,
                node.size() != null ? node.size().getId() : null,
                group.getId());
        if (!tally.links.add(key)) {
            return;
        }
        itemOptionGroupRepository.save(node.item() != null
                ? ItemOptionGroup.forItem(node.item(), group)
                : ItemOptionGroup.forSize(node.size(), group));
    }

    private OptionGroup resolveGroup(OptionGroupPayload payload, Tally tally) {
        if (payload.id() == null) {
            throw new BusinessException(ErrorCode.INVALID_MENU_SNAPSHOT,
                    "Option group without id: " + payload.name());
        }

        Optional<OptionGroup> known = optionGroupRepository.findByExternalId(payload.id());
        if (known.isPresent()) {
            return updated(known.get(), payload);
        }

        try {
            OptionGroupRegistrar.Registration registration = optionGroupRegistrar.createIfAbsent(payload);
            if (registration.created()) {
                tally.optionGroups++;
                tally.options += registration.optionCount();
                return optionGroupRepository.getReferenceById(registration.groupId());
            }
        } catch (DataIntegrityViolationException race) {
            log.info("Option group created concurrently, reusing it: externalId={}", payload.id());
        }

        OptionGroup winner = optionGroupRepository.findByExternalId(payload.id())
                .orElseThrow(() -> new BusinessException(ErrorCode.PERSISTENCE_FAILED,
                        "Option group vanished after concurrent insert: " + payload.id()));
        return updated(winner, payload);
    }

    private OptionGroup updated(OptionGroup group, OptionGroupPayload payload) {
        group.update(payload.name(), payload.required(), payload.allowQuantity(),
                payload.forceMin(), payload.forceMax());
        return group;
    }

    private static List<OptionGroupPayload> groupsOf(List<OptionGroupPayload> groups) {
        return groups != null ? groups : List.of();
    }

    /** 역순으로 넣어서 스냅샷 순서대로 꺼내지게 한다 */
    private static void pushAll(Deque<Node> worklist, List<Node> children) {
        for (int i = children.size() - 1; i >= 0; i--) {
            worklist.push(children.get(i));
        }
    }
}
