package com.foodsync.menu.repository;

import com.foodsync.menu.entity.MenuItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface MenuItemRepository extends JpaRepository<MenuItem, Long> {

    @Query("SELECT i FROM MenuItem i WHERE i.category.menu.id = :menuId ORDER BY i.sortOrder, i.id")
    List<MenuItem> findByMenuId(@Param("menuId") Long menuId);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM MenuItem i WHERE i.category.id IN " +
            "(SELECT c.id FROM MenuCategory c WHERE c.menu.id = :menuId)")
    int deleteByMenuId(@Param("menuId") Long menuId);
}
