package com.foodsync.client.service;

import com.foodsync.client.entity.Client;
import com.foodsync.client.entity.ClientAddress;
import com.foodsync.client.repository.ClientAddressRepository;
import com.foodsync.client.repository.ClientRepository;
import com.foodsync.order.payload.ExternalOrder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ClientResolverTest {

    @Mock
    private ClientRepository clientRepository;
    @Mock
    private ClientAddressRepository clientAddressRepository;

    @InjectMocks
    private ClientResolver clientResolver;

    private static ExternalOrder order(String type, Long clientId, Long userId, String firstName,
                                       String email, Integer orderCount, Boolean consent,
                                       ExternalOrder.AddressParts parts) {
        return new ExternalOrder(
                1L, "accepted", type, null, "rk-1", null, null, null, 0L, "EUR",
                BigDecimal.TEN, null, null, null, null, null, null, null, null, null, null, null,
                null, null, null, null,
                clientId, userId, firstName, null, email, null, "Calle Mayor 1, Madrid", parts,
                orderCount, consent, "40.41", "-3.70", "Centro", null, null);
    }

    private static ExternalOrder.AddressParts parts(String fullAddress) {
        return new ExternalOrder.AddressParts("Calle Mayor", null, "2", "B", null, null,
                "28013", "Madrid", fullAddress);
    }

    @Test
    @DisplayName("client_id와 user_id가 모두 없으면 익명 주문")
    void resolve_NoIdentity_Anonymous() {
        Optional<Client> client = clientResolver.resolve(order("pickup", null, null, "Ana", null, null, null, null));

        assertThat(client).isEmpty();
        verifyNoInteractions(clientRepository, clientAddressRepository);
    }

    @Test
    @DisplayName("client_id가 없으면 user_id로 신규 고객 생성, 주문 수 기본값 1")
    void resolve_UserIdFallback_CreatesClient() {
        // Given
        given(clientRepository.findByExternalId(500L)).willReturn(Optional.empty());
        given(clientRepository.save(any(Client.class))).willAnswer(inv -> inv.getArgument(0));

        // When
        Client client = clientResolver.resolve(order("pickup", null, 500L, "Ana", "ana@example.com",
                null, null, null)).orElseThrow();

        // Then
        assertThat(client.getExternalId()).isEqualTo(500L);
        assertThat(client.getOrderCount()).isEqualTo(1);
        assertThat(client.isMarketingConsent()).isFalse();
        verifyNoInteractions(clientAddressRepository);
    }

    @Test
    @DisplayName("기존 고객 갱신 시 비어 있는 필드는 기존 값 유지")
    void resolve_ExistingClient_MergesNonDestructively() {
        // Given
        Client stored = Client.builder()
                .externalId(77L).firstName("Ana").lastName("Lopez")
                .email("ana@example.com").phone("+34600000000")
                .orderCount(3).marketingConsent(true)
                .build();
        given(clientRepository.findByExternalId(77L)).willReturn(Optional.of(stored));

        // When
        Client client = clientResolver.resolve(order("pickup", 77L, null, "Anita", null, 4, null, null))
                .orElseThrow();

        // Then
        assertThat(client.getFirstName()).isEqualTo("Anita");
        assertThat(client.getLastName()).isEqualTo("Lopez");
        assertThat(client.getEmail()).isEqualTo("ana@example.com");
        assertThat(client.getPhone()).isEqualTo("+34600000000");
        assertThat(client.getOrderCount()).isEqualTo(4);
        assertThat(client.isMarketingConsent()).isTrue();
        verify(clientRepository, never()).save(any());
    }

    @Test
    @DisplayName("기존 고객 갱신 시 주문 수가 없으면 0")
    void resolve_ExistingClientWithoutCount_ResetsToZero() {
        Client stored = Client.builder().externalId(77L).orderCount(3).build();
        given(clientRepository.findByExternalId(77L)).willReturn(Optional.of(stored));

        Client client = clientResolver.resolve(order("pickup", 77L, null, null, null, null, false, null))
                .orElseThrow();

        assertThat(client.getOrderCount()).isZero();
        assertThat(client.isMarketingConsent()).isFalse();
    }

    @Test
    @DisplayName("배달 주문은 주소를 저장, full_address가 없으면 client_address 사용")
    void resolve_DeliveryOrder_SavesAddress() {
        // Given
        Client stored = Client.builder().externalId(77L).orderCount(3).build();
        ReflectionTestUtils.setField(stored, "id", 5L);
        given(clientRepository.findByExternalId(77L)).willReturn(Optional.of(stored));
        given(clientAddressRepository.existsByClientIdAndFullAddress(5L, "Calle Mayor 1, Madrid"))
                .willReturn(false);

        // When
        clientResolver.resolve(order("delivery", 77L, null, null, null, 4, null, parts(null)));

        // Then
        ArgumentCaptor<ClientAddress> captor = ArgumentCaptor.forClass(ClientAddress.class);
        verify(clientAddressRepository).save(captor.capture());
        assertThat(captor.getValue().getFullAddress()).isEqualTo("Calle Mayor 1, Madrid");
        assertThat(captor.getValue().getZipcode()).isEqualTo("28013");
        assertThat(captor.getValue().getDeliveryZone()).isEqualTo("Centro");
    }

    @Test
    @DisplayName("같은 고객의 같은 주소는 다시 저장하지 않음")
    void resolve_KnownAddress_NotDuplicated() {
        Client stored = Client.builder().externalId(77L).orderCount(3).build();
        ReflectionTestUtils.setField(stored, "id", 5L);
        given(clientRepository.findByExternalId(77L)).willReturn(Optional.of(stored));
        given(clientAddressRepository.existsByClientIdAndFullAddress(5L, "Calle Mayor 1, 2B"))
                .willReturn(true);

        clientResolver.resolve(order("delivery", 77L, null, null, null, 4, null, parts("Calle Mayor 1, 2B")));

        verify(clientAddressRepository, never()).save(any());
    }
}
