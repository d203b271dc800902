package com.orbit.pipeline.core.spi;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * 캐시 값의 안정 해시 함수.
 *
 * <p>같은 내용이면 같은 해시를 반환해야 합니다. 결과는 변경 감지에만 쓰이므로
 * 16자리 16진수 접두어로 충분합니다.</p>
 *
 * @param <V> 값 타입
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ContentHasher<V> {

    /**
     * 값의 해시 계산.
     *
     * @param value 값
     * @return 해시 문자열
     */
    String hash(V value);

    /**
     * {@code String.valueOf(value)}의 SHA-256 앞 16자리를 사용하는 기본 해시.
     *
     * @param <V> 값 타입
     * @return ContentHasher
     */
    static <V> ContentHasher<V> sha256OfString() {
        return value -> sha256Prefix(String.valueOf(value));
    }

    /**
     * 문자열의 SHA-256 16진수 앞 16자리.
     *
     * @param text 입력
     * @return 16자리 16진수
     */
    static String sha256Prefix(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(text.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
