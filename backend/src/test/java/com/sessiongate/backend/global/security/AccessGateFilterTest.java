package com.sessiongate.backend.global.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.sessiongate.backend.modules.auth.application.SessionManager;
import com.sessiongate.backend.modules.auth.domain.AuthErrorKind;
import com.sessiongate.backend.modules.auth.domain.AuthResult;
import com.sessiongate.backend.modules.auth.domain.UserIdentity;
import com.sessiongate.backend.support.TestAuthProperties;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.Cookie;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

class AccessGateFilterTest {

    private SessionManager sessionManager;
    private AccessGateFilter filter;

    @BeforeEach
    void setUp() {
        sessionManager = mock(SessionManager.class);
        AccessGate gate = new AccessGate(new RoutePolicy(TestAuthProperties.defaults()), sessionManager,
                TestAuthProperties.defaults());
        filter = new AccessGateFilter(gate, new GateResponses(TestAuthProperties.defaults()),
                new AuthCookies(TestAuthProperties.defaults()), new ObjectMapper().findAndRegisterModules());
    }

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void allowedRequestContinuesWithIdentityAttached() throws Exception {
        UserIdentity alice = identity("alice", false);
        when(sessionManager.resolveIdentity("good")).thenReturn(AuthResult.success(alice));
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/users/info");
        request.setCookies(new Cookie(AuthCookies.ACCESS_TOKEN_COOKIE, "good"));
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertThat(chain.getRequest()).isSameAs(request);
        assertThat(request.getAttribute(AccessGateFilter.IDENTITY_ATTRIBUTE)).isEqualTo(alice);
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        assertThat(authentication.getPrincipal()).isEqualTo(new AuthenticatedUser(alice.id(), "alice", false));
        assertThat(authentication.getAuthorities()).extracting(GrantedAuthority::getAuthority)
                .containsExactly("ROLE_USER");
    }

    @Test
    void superuserGetsTheAdminRole() throws Exception {
        when(sessionManager.resolveIdentity("root")).thenReturn(AuthResult.success(identity("root", true)));
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/admin/sessions");
        request.addHeader(HttpHeaders.AUTHORIZATION, "Bearer root");
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(chain.getRequest()).isNotNull();
        assertThat(SecurityContextHolder.getContext().getAuthentication().getAuthorities())
                .extracting(GrantedAuthority::getAuthority)
                .containsExactlyInAnyOrder("ROLE_USER", "ROLE_ADMIN");
    }

    @Test
    void cookieTokenWinsOverBearerHeader() throws Exception {
        when(sessionManager.resolveIdentity("from-cookie")).thenReturn(AuthResult.success(identity("alice", false)));
        when(sessionManager.resolveIdentity("from-header"))
                .thenReturn(AuthResult.failure(AuthErrorKind.SESSION_NOT_FOUND));
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/users/info");
        request.setCookies(new Cookie(AuthCookies.ACCESS_TOKEN_COOKIE, "from-cookie"));
        request.addHeader(HttpHeaders.AUTHORIZATION, "Bearer from-header");
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(chain.getRequest()).isNotNull();
    }

    @Test
    void missingTokenRedirectsToLoginAndClearsCookies() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/users/info");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertThat(chain.getRequest()).isNull();
        assertThat(response.getStatus()).isEqualTo(307);
        assertThat(response.getHeader(HttpHeaders.LOCATION)).isEqualTo("/login");
        for (String name : new String[] {AuthCookies.ACCESS_TOKEN_COOKIE, AuthCookies.REFRESH_TOKEN_COOKIE}) {
            Cookie cleared = response.getCookie(name);
            assertThat(cleared).as(name).isNotNull();
            assertThat(cleared.getValue()).as(name).isEmpty();
            assertThat(cleared.getMaxAge()).as(name).isZero();
        }
    }

    @Test
    void expiredTokenRedirectsToRefreshKeepingCookies() throws Exception {
        when(sessionManager.resolveIdentity("expired")).thenReturn(AuthResult.failure(AuthErrorKind.EXPIRED_SIGNATURE));
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/users/info");
        request.setQueryString("tab=1");
        request.setCookies(new Cookie(AuthCookies.ACCESS_TOKEN_COOKIE, "expired"));
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        assertThat(response.getStatus()).isEqualTo(307);
        assertThat(response.getHeader(HttpHeaders.LOCATION))
                .isEqualTo("/auth/refresh?redirect_url=http%3A%2F%2Flocalhost%2Fusers%2Finfo%3Ftab%3D1");
        assertThat(response.getHeaders(HttpHeaders.SET_COOKIE)).isEmpty();
    }

    @Test
    void nonAdminGetsAProblemBody() throws Exception {
        when(sessionManager.resolveIdentity("user")).thenReturn(AuthResult.success(identity("alice", false)));
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/admin/sessions");
        request.addHeader(HttpHeaders.AUTHORIZATION, "Bearer user");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertThat(chain.getRequest()).isNull();
        assertThat(response.getStatus()).isEqualTo(403);
        assertThat(response.getContentAsString()).contains("\"code\":\"FORBIDDEN\"");
        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
    }

    @Test
    void storeOutageIsAnOpaqueServerError() throws Exception {
        when(sessionManager.resolveIdentity("token")).thenReturn(AuthResult.failure(AuthErrorKind.STORE_UNAVAILABLE));
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/users/info");
        request.addHeader(HttpHeaders.AUTHORIZATION, "Bearer token");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        assertThat(response.getStatus()).isEqualTo(500);
        assertThat(response.getContentAsString()).contains("INTERNAL_ERROR");
    }

    @Test
    void loginPageWithLiveSessionRedirectsHome() throws Exception {
        when(sessionManager.resolveIdentity("good")).thenReturn(AuthResult.success(identity("alice", false)));
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/login");
        request.setCookies(new Cookie(AuthCookies.ACCESS_TOKEN_COOKIE, "good"));
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        assertThat(response.getStatus()).isEqualTo(307);
        assertThat(response.getHeader(HttpHeaders.LOCATION)).isEqualTo("/");
    }

    private static UserIdentity identity(String username, boolean superuser) {
        OffsetDateTime now = OffsetDateTime.parse("2025-03-01T09:00:00Z");
        return new UserIdentity(UUID.randomUUID(), username, username + "@example.com", false, superuser, false, now, now);
    }
}
