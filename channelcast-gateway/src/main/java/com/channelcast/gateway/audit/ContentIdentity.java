package com.channelcast.gateway.audit;

import com.channelcast.gateway.ledger.DeliveryRecord;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Decides which ledger records carry "the same content".
 * <p>
 * {@link Mode#EXACT} keys on content type plus a SHA-256 of the full text.
 * {@link Mode#PREFIX} keys on content type plus the first N characters, which
 * also merges posts that differ only after the prefix.
 */
public final class ContentIdentity {

    public static final int DEFAULT_PREFIX_LENGTH = 100;
    static final String UNKNOWN_TYPE = "unknown";

    public enum Mode {
        EXACT, PREFIX
    }

    private final Mode mode;
    private final int prefixLength;

    private ContentIdentity(Mode mode, int prefixLength) {
        if (prefixLength <= 0) {
            throw new IllegalArgumentException("prefixLength must be > 0, got " + prefixLength);
        }
        this.mode = mode;
        this.prefixLength = prefixLength;
    }

    public static ContentIdentity exact() {
        return new ContentIdentity(Mode.EXACT, DEFAULT_PREFIX_LENGTH);
    }

    public static ContentIdentity prefix(int length) {
        return new ContentIdentity(Mode.PREFIX, length);
    }

    /**
     * @param mode {@code "exact"} or {@code "prefix"}; anything else means exact
     */
    public static ContentIdentity fromConfig(String mode, int prefixLength) {
        if (mode != null && "prefix".equals(mode.trim().toLowerCase(Locale.ROOT))) {
            return prefix(prefixLength > 0 ? prefixLength : DEFAULT_PREFIX_LENGTH);
        }
        return exact();
    }

    public String keyOf(DeliveryRecord record) {
        String type = typeOf(record);
        String content = record.content() != null ? record.content() : "";
        if (mode == Mode.PREFIX) {
            return type + ":" + content.substring(0, Math.min(prefixLength, content.length()));
        }
        return type + ":" + sha256(content);
    }

    public Mode mode() {
        return mode;
    }

    static String typeOf(DeliveryRecord record) {
        String type = record.contentType();
        return type == null || type.isBlank() ? UNKNOWN_TYPE : type;
    }

    private static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
