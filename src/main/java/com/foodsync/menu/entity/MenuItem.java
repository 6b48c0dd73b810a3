package com.foodsync.menu.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

/**
 * 메뉴 아이템. 주문 유형, 태그, 알레르기, 영양 정보는 JSON 텍스트로 저장한다
 * ({@code MenuItemAttributes} 참고).
 */
@Entity
@Table(name = "menu_items", indexes = {
        @Index(name = "idx_items_category", columnList = "category_id"),
        @Index(name = "idx_items_external", columnList = "external_id")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class MenuItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "category_id", nullable = false)
    private MenuCategory category;

    private Long externalId;

    private String name;

    @Column(length = 2000)
    private String description;

    private BigDecimal price;

    private boolean active;

    private int sortOrder; // 스냅샷 안의 위치

    private String kitchenInternalName;

    @Column(columnDefinition = "TEXT")
    private String orderTypes;

    @Column(columnDefinition = "TEXT")
    private String tags;

    @Column(columnDefinition = "TEXT")
    private String allergens;

    @Column(columnDefinition = "TEXT")
    private String nutritionalValues;

    @Column(columnDefinition = "TEXT")
    private String extrasResidual; // 전용 컬럼이 없는 extras 키들

    @Builder
    public MenuItem(MenuCategory category, Long externalId, String name, String description,
                    BigDecimal price, boolean active, int sortOrder, String kitchenInternalName,
                    String orderTypes, String tags, String allergens, String nutritionalValues,
                    String extrasResidual) {
        this.category = category;
        this.externalId = externalId;
        this.name = name;
        this.description = description;
        this.price = price != null ? price : BigDecimal.ZERO;
        this.active = active;
        this.sortOrder = sortOrder;
        this.kitchenInternalName = kitchenInternalName;
        this.orderTypes = orderTypes;
        this.tags = tags;
        this.allergens = allergens;
        this.nutritionalValues = nutritionalValues;
        this.extrasResidual = extrasResidual;
    }
}
