package com.foodsync.menu.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "menu_categories", indexes = @Index(name = "idx_categories_menu", columnList = "menu_id"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class MenuCategory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "menu_id", nullable = false)
    private Menu menu;

    private Long externalId;

    private String name;

    @Column(length = 1000)
    private String description;

    private boolean active;

    private int sortOrder;

    @Builder
    public MenuCategory(Menu menu, Long externalId, String name, String description,
                        boolean active, int sortOrder) {
        this.menu = menu;
        this.externalId = externalId;
        this.name = name;
        this.description = description;
        this.active = active;
        this.sortOrder = sortOrder;
    }
}
