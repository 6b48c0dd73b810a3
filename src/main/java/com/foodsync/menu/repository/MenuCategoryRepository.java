package com.foodsync.menu.repository;

import com.foodsync.menu.entity.MenuCategory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface MenuCategoryRepository extends JpaRepository<MenuCategory, Long> {

    List<MenuCategory> findByMenuIdOrderBySortOrderAsc(Long menuId);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM MenuCategory c WHERE c.menu.id = :menuId")
    int deleteByMenuId(@Param("menuId") Long menuId);
}
