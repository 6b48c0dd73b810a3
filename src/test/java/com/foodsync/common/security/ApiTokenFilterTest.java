package com.foodsync.common.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.assertThat;

class ApiTokenFilterTest {

    private final ApiTokenFilter filter = new ApiTokenFilter("secret-token");

    @Test
    @DisplayName("올바른 Bearer 토큰이면 통과")
    void doFilter_ValidToken_PassesThrough() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/menu");
        request.addHeader("Authorization", "Bearer secret-token");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertThat(chain.getRequest()).isSameAs(request);
        assertThat(response.getStatus()).isEqualTo(200);
    }

    @Test
    @DisplayName("토큰이 없거나 틀리면 401")
    void doFilter_MissingOrWrongToken_Unauthorized() throws Exception {
        for (String header : new String[]{null, "Bearer wrong", "secret-token"}) {
            MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/stats/dashboard");
            if (header != null) {
                request.addHeader("Authorization", header);
            }
            MockHttpServletResponse response = new MockHttpServletResponse();
            MockFilterChain chain = new MockFilterChain();

            filter.doFilter(request, response, chain);

            assertThat(chain.getRequest()).isNull();
            assertThat(response.getStatus()).isEqualTo(401);
            assertThat(response.getContentAsString()).contains("\"success\":false");
        }
    }

    @Test
    @DisplayName("토큰이 설정되지 않았으면 모든 요청 거부")
    void doFilter_NoConfiguredToken_RejectsEverything() throws Exception {
        ApiTokenFilter unconfigured = new ApiTokenFilter("");
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/menu");
        request.addHeader("Authorization", "Bearer ");
        MockHttpServletResponse response = new MockHttpServletResponse();

        unconfigured.doFilter(request, response, new MockFilterChain());

        assertThat(response.getStatus()).isEqualTo(401);
    }
}
