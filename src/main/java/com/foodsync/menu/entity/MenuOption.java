package com.foodsync.menu.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

@Entity
@Table(name = "menu_options", indexes = @Index(name = "idx_options_group", columnList = "option_group_id"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class MenuOption {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "option_group_id", nullable = false)
    private OptionGroup optionGroup;

    private Long externalId;

    private String name;

    private BigDecimal price;

    private boolean defaultOption;

    private String kitchenInternalName;

    private int sortOrder;

    @Builder
    public MenuOption(OptionGroup optionGroup, Long externalId, String name, BigDecimal price,
                      boolean defaultOption, String kitchenInternalName, int sortOrder) {
        this.optionGroup = optionGroup;
        this.externalId = externalId;
        this.name = name;
        this.price = price != null ? price : BigDecimal.ZERO;
        this.defaultOption = defaultOption;
        this.kitchenInternalName = kitchenInternalName;
        this.sortOrder = sortOrder;
    }
}
