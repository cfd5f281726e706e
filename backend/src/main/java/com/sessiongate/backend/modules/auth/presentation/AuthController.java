package com.sessiongate.backend.modules.auth.presentation;

import java.net.URI;
import java.net.URISyntaxException;

import com.sessiongate.backend.global.config.AuthProperties;
import com.sessiongate.backend.global.security.AuthCookies;
import com.sessiongate.backend.global.security.AuthenticatedUser;
import com.sessiongate.backend.modules.auth.application.SessionManager;
import com.sessiongate.backend.modules.auth.application.UserAccountService;
import com.sessiongate.backend.modules.auth.domain.AuthErrorKind;
import com.sessiongate.backend.modules.auth.domain.AuthResult;
import com.sessiongate.backend.modules.auth.domain.TokenPair;
import com.sessiongate.backend.modules.auth.domain.UserIdentity;
import com.sessiongate.backend.modules.auth.presentation.dto.LoginRequest;
import com.sessiongate.backend.modules.auth.presentation.dto.MessageResponse;
import com.sessiongate.backend.modules.auth.presentation.dto.RefreshRequest;
import com.sessiongate.backend.modules.auth.presentation.dto.RegisterRequest;
import com.sessiongate.backend.modules.auth.presentation.dto.RegisterResponse;
import com.sessiongate.backend.modules.auth.presentation.dto.TokenPairResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
public class AuthController {

    private final UserAccountService userAccountService;
    private final SessionManager sessionManager;
    private final AuthCookies authCookies;
    private final AuthProperties.Routes routes;

    public AuthController(
            UserAccountService userAccountService,
            SessionManager sessionManager,
            AuthCookies authCookies,
            AuthProperties properties
    ) {
        this.userAccountService = userAccountService;
        this.sessionManager = sessionManager;
        this.authCookies = authCookies;
        this.routes = properties.routes();
    }

    @Operation(summary = "회원가입", description = "새 계정을 비활성/일반 사용자로 등록한다.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "등록 성공"),
            @ApiResponse(responseCode = "409", description = "username 또는 email 중복"),
            @ApiResponse(responseCode = "422", description = "입력값 검증 실패")
    })
    @PostMapping("/register")
    public ResponseEntity<RegisterResponse> register(@Valid @RequestBody RegisterRequest request) {
        UserIdentity user = userAccountService
                .register(request.username(), request.email(), request.password())
                .orElseThrow();
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new RegisterResponse(user.id(), user.username(), "User " + user.username() + " created"));
    }

    @Operation(summary = "로그인", description = "토큰 쌍을 본문과 쿠키로 발급한다. 이전 세션은 무효화된다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "로그인 성공"),
            @ApiResponse(responseCode = "401", description = "자격 증명 불일치")
    })
    @PostMapping("/login")
    public ResponseEntity<TokenPairResponse> login(@Valid @RequestBody LoginRequest request,
                                                   HttpServletResponse response) {
        TokenPair tokens = sessionManager.login(request.username(), request.password()).orElseThrow();
        authCookies.write(response, tokens);
        return ResponseEntity.ok(TokenPairResponse.from(tokens));
    }

    @Operation(summary = "토큰 갱신", description = "본문 또는 refresh_token 쿠키의 리프레시 토큰으로 새 토큰 쌍을 발급한다.")
    @PostMapping("/refresh")
    public ResponseEntity<TokenPairResponse> refresh(@RequestBody(required = false) RefreshRequest body,
                                                     HttpServletRequest request,
                                                     HttpServletResponse response) {
        String refreshToken = body != null && StringUtils.hasText(body.refreshToken())
                ? body.refreshToken()
                : AuthCookies.read(request, AuthCookies.REFRESH_TOKEN_COOKIE)
                        .orElseThrow(AuthErrorKind.TOKEN_MISSING::toProblem);
        TokenPair tokens = sessionManager.refresh(refreshToken).orElseThrow();
        authCookies.write(response, tokens);
        return ResponseEntity.ok(TokenPairResponse.from(tokens));
    }

    /**
     * Browser flow behind the gate's expired-token redirect: refreshes from the cookie
     * and sends the client back where it came from, or to login when that fails.
     */
    @Operation(summary = "토큰 갱신 후 리다이렉트", description = "만료된 access token 으로 접근한 브라우저를 원래 주소로 돌려보낸다.")
    @GetMapping("/refresh")
    public ResponseEntity<Void> refreshAndRedirect(
            @RequestParam(name = "redirect_url", required = false) String redirectUrl,
            HttpServletRequest request,
            HttpServletResponse response) {
        AuthResult<TokenPair> result = AuthCookies.read(request, AuthCookies.REFRESH_TOKEN_COOKIE)
                .map(sessionManager::refresh)
                .orElseGet(() -> AuthResult.failure(AuthErrorKind.TOKEN_MISSING));

        if (result.isFailure()) {
            if (result.error() == AuthErrorKind.STORE_UNAVAILABLE) {
                throw result.error().toProblem();
            }
            authCookies.clear(response);
            return redirect(routes.login());
        }
        authCookies.write(response, result.value());
        return redirect(safeRedirectTarget(redirectUrl, request));
    }

    @Operation(summary = "로그아웃", description = "현재 사용자의 세션을 종료하고 쿠키를 지운다.")
    @RequestMapping(path = "/logout", method = {RequestMethod.GET, RequestMethod.POST})
    public ResponseEntity<MessageResponse> logout(@AuthenticationPrincipal AuthenticatedUser principal,
                                                  HttpServletResponse response) {
        sessionManager.logout(principal.userId()).orElseThrow();
        authCookies.clear(response);
        return ResponseEntity.ok(new MessageResponse("Logged out"));
    }

    private static ResponseEntity<Void> redirect(String location) {
        return ResponseEntity.status(HttpStatus.TEMPORARY_REDIRECT).location(URI.create(location)).build();
    }

    /**
     * Accepts same-origin targets only: a relative path, or an absolute URL on this host.
     */
    String safeRedirectTarget(String redirectUrl, HttpServletRequest request) {
        if (!StringUtils.hasText(redirectUrl)) {
            return routes.home();
        }
        try {
            URI target = new URI(redirectUrl);
            if (!target.isAbsolute()) {
                String path = target.getRawPath();
                boolean relativePath = target.getRawAuthority() == null && path != null
                        && path.startsWith("/") && !path.startsWith("//");
                return relativePath ? redirectUrl : routes.home();
            }
            boolean http = "http".equalsIgnoreCase(target.getScheme()) || "https".equalsIgnoreCase(target.getScheme());
            return http && request.getServerName().equalsIgnoreCase(target.getHost()) ? redirectUrl : routes.home();
        } catch (URISyntaxException ex) {
            return routes.home();
        }
    }
}
