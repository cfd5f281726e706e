package com.sessiongate.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Locale;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import com.sessiongate.backend.global.config.AuthProperties;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.MacAlgorithm;

import org.springframework.stereotype.Component;

/**
 * JWT 서명 키와 HMAC 알고리즘 래퍼.
 * 시크릿은 Base64 로 해석되면 디코딩된 바이트를, 아니면 UTF-8 바이트를 그대로 쓴다.
 */
@Component
public class JwtKeyProvider {

    private final MacAlgorithm algorithm;
    private final SecretKey secretKey;

    public JwtKeyProvider(AuthProperties properties) {
        this.algorithm = resolveAlgorithm(properties.algorithm());
        byte[] keyBytes = decodeSecret(properties.secret());
        int requiredBytes = algorithm.getKeyBitLength() / Byte.SIZE;
        if (keyBytes.length < requiredBytes) {
            throw new IllegalStateException("app.auth.secret must be at least " + requiredBytes
                    + " bytes for " + algorithm.getId());
        }
        this.secretKey = new SecretKeySpec(keyBytes, jcaName(algorithm));
    }

    public MacAlgorithm getAlgorithm() {
        return algorithm;
    }

    public SecretKey getSecretKey() {
        return secretKey;
    }

    static MacAlgorithm resolveAlgorithm(String name) {
        return switch (name.trim().toUpperCase(Locale.ROOT)) {
            case "HS256" -> Jwts.SIG.HS256;
            case "HS384" -> Jwts.SIG.HS384;
            case "HS512" -> Jwts.SIG.HS512;
            default -> throw new IllegalStateException("Unsupported app.auth.algorithm: " + name);
        };
    }

    private static byte[] decodeSecret(String secret) {
        try {
            return Base64.getDecoder().decode(secret);
        } catch (IllegalArgumentException ex) {
            return secret.getBytes(StandardCharsets.UTF_8);
        }
    }

    private static String jcaName(MacAlgorithm algorithm) {
        return "HmacSHA" + algorithm.getId().substring(2);
    }
}
