package com.foodsync.client.service;

import com.foodsync.client.entity.Client;
import com.foodsync.client.entity.ClientAddress;
import com.foodsync.client.repository.ClientAddressRepository;
import com.foodsync.client.repository.ClientRepository;
import com.foodsync.order.payload.ExternalOrder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * 고객 식별 서비스 - 들어온 주문의 고객을 찾거나 만든다.
 *
 * <p>고객 식별자는 {@code client_id}, 없으면 {@code user_id}.
 * 둘 다 없는 주문은 익명이라 고객 행을 만들지 않는다.</p>
 *
 * <h3>기존 고객 병합 규칙</h3>
 * <ul>
 *   <li>이름, 이메일, 전화, 마케팅 동의: 페이로드에 있을 때만 덮어씀</li>
 *   <li>주문 수: 항상 교체 (없으면 0)</li>
 *   <li>신규 고객의 주문 수: 양수면 그대로, 아니면 1</li>
 * </ul>
 *
 * <p>배달 주문의 주소는 (고객, 전체 주소) 기준으로 중복 없이 저장한다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClientResolver {

    private final ClientRepository clientRepository;
    private final ClientAddressRepository clientAddressRepository;

    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<Client> resolve(ExternalOrder order) {
        Long externalId = order.clientExternalId();
        if (externalId == null) {
            return Optional.empty();
        }

        Client client = clientRepository.findByExternalId(externalId)
                .map(existing -> update(existing, order))
                .orElseGet(() -> create(externalId, order));

        if (order.isDelivery() && order.clientAddressParts() != null) {
            saveAddress(client, order);
        }
        return Optional.of(client);
    }

    private Client update(Client client, ExternalOrder order) {
        int orderCount = order.clientOrderCount() != null ? order.clientOrderCount() : 0;
        client.merge(order.clientFirstName(), order.clientLastName(), order.clientEmail(),
                order.clientPhone(), orderCount, order.clientMarketingConsent());
        return client;
    }

    private Client create(Long externalId, ExternalOrder order) {
        Integer count = order.clientOrderCount();
        Client client = Client.builder()
                .externalId(externalId)
                .firstName(order.clientFirstName())
                .lastName(order.clientLastName())
                .email(order.clientEmail())
                .phone(order.clientPhone())
                .orderCount(count != null && count > 0 ? count : 1)
                .marketingConsent(Boolean.TRUE.equals(order.clientMarketingConsent()))
                .build();
        Client saved = clientRepository.save(client);
        log.info("Client created: externalId={}, id={}", externalId, saved.getId());
        return saved;
    }

    private void saveAddress(Client client, ExternalOrder order) {
        ExternalOrder.AddressParts parts = order.clientAddressParts();
        String fullAddress = parts.fullAddress() != null ? parts.fullAddress() : order.clientAddress();
        if (fullAddress == null) {
            return; // 주소 블록에도 client_address에도 없음
        }
        if (client.getId() != null
                && clientAddressRepository.existsByClientIdAndFullAddress(client.getId(), fullAddress)) {
            return;
        }

        clientAddressRepository.save(ClientAddress.builder()
                .client(client)
                .fullAddress(fullAddress)
                .street(parts.street())
                .city(parts.city())
                .zipcode(parts.zipcode())
                .bloc(parts.bloc())
                .floor(parts.floor())
                .apartment(parts.apartment())
                .intercom(parts.intercom())
                .latitude(order.latitude())
                .longitude(order.longitude())
                .deliveryZone(order.deliveryZoneName())
                .build());
    }
}
