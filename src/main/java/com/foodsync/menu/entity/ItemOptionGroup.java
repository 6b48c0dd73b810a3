package com.foodsync.menu.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * 옵션 그룹 링크. 아이템 또는 사이즈 중 정확히 하나에 걸린다.
 */
@Entity
@Table(name = "menu_item_option_groups",
        uniqueConstraints = @UniqueConstraint(name = "uk_item_size_group",
                columnNames = {"item_id", "size_id", "option_group_id"}))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ItemOptionGroup {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "item_id")
    private MenuItem item;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "size_id")
    private MenuItemSize size;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "option_group_id", nullable = false)
    private OptionGroup optionGroup;

    public static ItemOptionGroup forItem(MenuItem item, OptionGroup group) {
        ItemOptionGroup link = new ItemOptionGroup();
        link.item = item;
        link.optionGroup = group;
        return link;
    }

    public static ItemOptionGroup forSize(MenuItemSize size, OptionGroup group) {
        ItemOptionGroup link = new ItemOptionGroup();
        link.size = size;
        link.optionGroup = group;
        return link;
    }
}
