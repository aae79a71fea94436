package com.flagship.member_payments.gateway;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;

/**
 * HMAC-SHA256 helpers for gateway signatures.
 *
 * Pure functions of (payload, secret, signature). Comparison is constant-time.
 */
public final class HmacSignatures {

    private static final String ALGORITHM = "HmacSHA256";

    private HmacSignatures() {
    }

    /**
     * Lower-case hex HMAC-SHA256 of the payload.
     */
    public static String hmacSha256Hex(String secret, String payload) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }

    /**
     * True when {@code signature} is the HMAC of {@code payload} under {@code secret}.
     * Null or blank inputs never match.
     */
    public static boolean matches(String secret, String payload, String signature) {
        if (secret == null || secret.isEmpty() || payload == null || signature == null || signature.isBlank()) {
            return false;
        }
        byte[] expected = hmacSha256Hex(secret, payload).getBytes(StandardCharsets.UTF_8);
        byte[] provided = signature.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expected, provided);
    }
}
