package com.foodsync.menu.repository;

import com.foodsync.menu.entity.ItemOptionGroup;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface ItemOptionGroupRepository extends JpaRepository<ItemOptionGroup, Long> {

    /** 메뉴 하나의 아이템/사이즈 링크, 그룹 fetch join */
    @Query("SELECT l FROM ItemOptionGroup l JOIN FETCH l.optionGroup " +
            "LEFT JOIN l.item i LEFT JOIN i.category ic " +
            "LEFT JOIN l.size s LEFT JOIN s.item si LEFT JOIN si.category sc " +
            "WHERE ic.menu.id = :menuId OR sc.menu.id = :menuId ORDER BY l.id")
    List<ItemOptionGroup> findByMenuId(@Param("menuId") Long menuId);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM ItemOptionGroup l WHERE " +
            "l.item.id IN (SELECT i.id FROM MenuItem i WHERE i.category.menu.id = :menuId) " +
            "OR l.size.id IN (SELECT s.id FROM MenuItemSize s WHERE s.item.category.menu.id = :menuId)")
    int deleteByMenuId(@Param("menuId") Long menuId);
}
