package com.foodsync.client.entity;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;

@Entity
@Table(name = "client_addresses",
        uniqueConstraints = @UniqueConstraint(name = "uk_client_address",
                columnNames = {"client_id", "full_address"}))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class ClientAddress {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "client_id", nullable = false)
    private Client client;

    @Column(name = "full_address", length = 500)
    private String fullAddress;

    private String street;
    private String city;
    private String zipcode;
    private String bloc;
    private String floor;
    private String apartment;
    private String intercom;
    private String latitude;
    private String longitude;
    private String deliveryZone;

    @CreatedDate
    private LocalDateTime createdAt;

    @Builder
    public ClientAddress(Client client, String fullAddress, String street, String city,
                         String zipcode, String bloc, String floor, String apartment,
                         String intercom, String latitude, String longitude, String deliveryZone) {
        this.client = client;
        this.fullAddress = fullAddress;
        this.street = street;
        this.city = city;
        this.zipcode = zipcode;
        this.bloc = bloc;
        this.floor = floor;
        this.apartment = apartment;
        this.intercom = intercom;
        this.latitude = latitude;
        this.longitude = longitude;
        this.deliveryZone = deliveryZone;
    }
}
