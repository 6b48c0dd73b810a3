package com.foodsync.client.repository;

import com.foodsync.client.entity.Client;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ClientRepository extends JpaRepository<Client, Long> {

    Optional<Client> findByExternalId(Long externalId);

    List<Client> findTop5ByOrderByOrderCountDescIdAsc();
}
