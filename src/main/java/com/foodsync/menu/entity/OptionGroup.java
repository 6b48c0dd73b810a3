package com.foodsync.menu.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * 옵션 그룹 (소스, 토핑 등).
 *
 * <p>식별자는 플랫폼 외부 id 하나뿐이라, 여러 아이템과 사이즈가 공유하는 그룹도 한 번만 저장된다.
 * 동기화가 그룹을 삭제하는 일은 없다.</p>
 */
@Entity
@Table(name = "menu_option_groups")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OptionGroup {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private Long externalId;

    private String name;

    private boolean required;

    private boolean allowQuantity;

    private int forceMin;

    private int forceMax;

    @Builder
    public OptionGroup(Long externalId, String name, boolean required, boolean allowQuantity,
                       int forceMin, int forceMax) {
        this.externalId = externalId;
        this.name = name;
        this.required = required;
        this.allowQuantity = allowQuantity;
        this.forceMin = forceMin;
        this.forceMax = forceMax;
    }

    public void update(String name, boolean required, boolean allowQuantity, int forceMin, int forceMax) {
        this.name = name;
        this.required = required;
        this.allowQuantity = allowQuantity;
        this.forceMin = forceMin;
        this.forceMax = forceMax;
    }
}
