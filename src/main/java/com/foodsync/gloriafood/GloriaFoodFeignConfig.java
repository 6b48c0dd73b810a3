package com.foodsync.gloriafood;

import feign.Request;
import feign.RequestInterceptor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;

import java.util.concurrent.TimeUnit;

/**
 * POS 호출의 타임아웃과 인증 헤더 설정.
 * 여기서는 재시도하지 않는다. 실패 처리는 호출 측 몫.
 */
@Configuration
public class GloriaFoodFeignConfig {

    static final String API_VERSION_HEADER = "Glf-Api-Version";

    @Bean
    public Request.Options feignRequestOptions(GloriaFoodProperties properties) {
        return new Request.Options(
                properties.connectTimeout().toMillis(), TimeUnit.MILLISECONDS,
                properties.readTimeout().toMillis(), TimeUnit.MILLISECONDS,
                true); // 리다이렉트 따라감
    }

    @Bean
    public RequestInterceptor gloriaFoodHeaders(GloriaFoodProperties properties) {
        return template -> template
                .header(HttpHeaders.AUTHORIZATION, properties.secretKey())
                .header(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .header(API_VERSION_HEADER, properties.apiVersion());
    }
}
