package com.foodsync.menu.repository;

import com.foodsync.menu.entity.OptionGroup;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface OptionGroupRepository extends JpaRepository<OptionGroup, Long> {

    Optional<OptionGroup> findByExternalId(Long externalId);
}
