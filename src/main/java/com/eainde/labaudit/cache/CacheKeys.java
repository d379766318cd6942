package com.eainde.labaudit.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Content-addressed cache keys. Keys depend only on the bytes of the image and the
 * protocol text, never on file names, upload order or time.
 */
public final class CacheKeys {

    public static final String VISION_PREFIX = "vision_";
    public static final String AUDIT_PREFIX = "audit_";

    private CacheKeys() {
    }

    public static String visionKey(byte[] imageBytes) {
        return VISION_PREFIX + digest(imageBytes);
    }

    public static String auditKey(byte[] imageBytes, String protocolText) {
        return AUDIT_PREFIX + digest(imageBytes) + "_" + digest(protocolText);
    }

    public static String digest(String text) {
        return digest(text.getBytes(StandardCharsets.UTF_8));
    }

    /** Lower-case hex SHA-256. */
    public static String digest(byte[] content) {
        try {
            MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(sha256.digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available in this JVM", e);
        }
    }
}
