package com.foodsync.menu.repository;

import com.foodsync.menu.entity.Menu;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface MenuRepository extends JpaRepository<Menu, Long> {

    Optional<Menu> findByExternalId(Long externalId);

    /**
     * 메뉴 행 {@code SELECT ... FOR UPDATE}.
     * 재구성 트랜잭션 내내 유지되므로 같은 메뉴의 동기화 두 개는 차례로 실행된다.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT m FROM Menu m WHERE m.id = :id")
    Optional<Menu> findByIdForUpdate(@Param("id") Long id);

    Optional<Menu> findFirstByOrderByIdAsc();
}
