package com.foodsync.menu.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

@Entity
@Table(name = "menu_item_sizes", indexes = @Index(name = "idx_sizes_item", columnList = "item_id"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class MenuItemSize {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "item_id", nullable = false)
    private MenuItem item;

    private Long externalId;

    private String name;

    private BigDecimal price;

    private boolean defaultSize;

    private int sortOrder;

    @Builder
    public MenuItemSize(MenuItem item, Long externalId, String name, BigDecimal price,
                        boolean defaultSize, int sortOrder) {
        this.item = item;
        this.externalId = externalId;
        this.name = name;
        this.price = price != null ? price : BigDecimal.ZERO;
        this.defaultSize = defaultSize;
        this.sortOrder = sortOrder;
    }
}
