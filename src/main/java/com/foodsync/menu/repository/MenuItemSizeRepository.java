package com.foodsync.menu.repository;

import com.foodsync.menu.entity.MenuItemSize;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface MenuItemSizeRepository extends JpaRepository<MenuItemSize, Long> {

    @Query("SELECT s FROM MenuItemSize s WHERE s.item.category.menu.id = :menuId ORDER BY s.sortOrder, s.id")
    List<MenuItemSize> findByMenuId(@Param("menuId") Long menuId);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM MenuItemSize s WHERE s.item.id IN " +
            "(SELECT i.id FROM MenuItem i WHERE i.category.menu.id = :menuId)")
    int deleteByMenuId(@Param("menuId") Long menuId);
}
