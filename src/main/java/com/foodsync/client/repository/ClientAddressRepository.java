package com.foodsync.client.repository;

import com.foodsync.client.entity.ClientAddress;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ClientAddressRepository extends JpaRepository<ClientAddress, Long> {

    boolean existsByClientIdAndFullAddress(Long clientId, String fullAddress);
}
