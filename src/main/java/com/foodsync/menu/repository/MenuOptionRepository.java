package com.foodsync.menu.repository;

import com.foodsync.menu.entity.MenuOption;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface MenuOptionRepository extends JpaRepository<MenuOption, Long> {

    @Query("SELECT o FROM MenuOption o WHERE o.optionGroup.id IN :groupIds ORDER BY o.sortOrder, o.id")
    List<MenuOption> findByOptionGroupIds(@Param("groupIds") Collection<Long> groupIds);
}
