package com.foodsync.common.security;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SecurityConfig {

    @Bean
    public FilterRegistrationBean<ApiTokenFilter> apiTokenFilter(
            @Value("${foodsync.api.auth-token:}") String apiToken) {
        FilterRegistrationBean<ApiTokenFilter> registration =
                new FilterRegistrationBean<>(new ApiTokenFilter(apiToken));
        registration.addUrlPatterns("/api/*");
        registration.setName("apiTokenFilter");
        return registration;
    }
}
