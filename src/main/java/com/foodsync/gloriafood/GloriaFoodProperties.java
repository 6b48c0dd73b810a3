package com.foodsync.gloriafood;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * 주문 플랫폼 접속 정보 ({@code foodsync.gloriafood.*}).
 *
 * @param apiUrl         POS API 기본 URL
 * @param secretKey      호출 시 {@code Authorization} 헤더로 전송
 * @param masterKey      푸시된 주문 배치의 {@code Authorization} 기대값
 * @param apiVersion     {@code Glf-Api-Version} 헤더 값
 * @param connectTimeout 연결 타임아웃
 * @param readTimeout    응답 타임아웃
 */
@ConfigurationProperties(prefix = "foodsync.gloriafood")
public record GloriaFoodProperties(
        @DefaultValue("https://pos.globalfoodsoft.com") String apiUrl,
        String secretKey,
        String masterKey,
        @DefaultValue("2") String apiVersion,
        @DefaultValue("3s") Duration connectTimeout,
        @DefaultValue("10s") Duration readTimeout) {
}
