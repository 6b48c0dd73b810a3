package com.foodsync.order.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "billing_details")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BillingDetails {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @OneToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "order_id", nullable = false, unique = true)
    @Setter(AccessLevel.PACKAGE)
    private Order order;

    /** {@code personal} 또는 {@code company} */
    private String type;
    private String companyName;
    private String cui;
    private String regCom;
    private String personName;
    private String personType;
    private String documentType;
    private String documentNumber;
    private String address;
    private String city;
    private String region;
    private String sector;
    private String countryCode;

    @Builder
    public BillingDetails(String type, String companyName, String cui, String regCom,
                          String personName, String personType, String documentType,
                          String documentNumber, String address, String city, String region,
                          String sector, String countryCode) {
        this.type = type;
        this.companyName = companyName;
        this.cui = cui;
        this.regCom = regCom;
        this.personName = personName;
        this.personType = personType;
        this.documentType = documentType;
        this.documentNumber = documentNumber;
        this.address = address;
        this.city = city;
        this.region = region;
        this.sector = sector;
        this.countryCode = countryCode;
    }
}
