package com.sessiongate.backend.modules.auth.infrastructure.jwt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import com.sessiongate.backend.support.TestAuthProperties;

import io.jsonwebtoken.Jwts;

import org.junit.jupiter.api.Test;

class JwtKeyProviderTest {

    @Test
    void plainSecretIsUsedAsUtf8Bytes() {
        JwtKeyProvider provider = new JwtKeyProvider(TestAuthProperties.defaults());

        assertThat(provider.getAlgorithm()).isEqualTo(Jwts.SIG.HS256);
        assertThat(provider.getSecretKey().getEncoded())
                .isEqualTo(TestAuthProperties.SECRET.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void base64SecretIsDecoded() {
        byte[] raw = new byte[48];
        for (int i = 0; i < raw.length; i++) {
            raw[i] = (byte) i;
        }
        String encoded = Base64.getEncoder().encodeToString(raw);

        JwtKeyProvider provider = new JwtKeyProvider(TestAuthProperties.withSecret(encoded, "hs384"));

        assertThat(provider.getAlgorithm()).isEqualTo(Jwts.SIG.HS384);
        assertThat(provider.getSecretKey().getEncoded()).isEqualTo(raw);
    }

    @Test
    void secretShorterThanTheAlgorithmNeedsIsRejected() {
        assertThatThrownBy(() -> new JwtKeyProvider(TestAuthProperties.withSecret("too-short-secret", "HS256")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("32 bytes");
    }

    @Test
    void unknownAlgorithmIsRejected() {
        assertThatThrownBy(() -> new JwtKeyProvider(TestAuthProperties.withSecret(TestAuthProperties.SECRET, "RS256")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("RS256");
    }
}
