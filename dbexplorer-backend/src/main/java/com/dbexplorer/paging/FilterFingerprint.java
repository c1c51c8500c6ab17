package com.dbexplorer.paging;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Stable 64-bit digest of whatever defines a listing (table, columns, filter, order, page size).
 * Two listings share a fingerprint only if they were built from the same parts.
 */
public final class FilterFingerprint {

    private FilterFingerprint() {
    }

    public static long of(Object... parts) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        for (Object part : parts) {
            String text = part == null ? "\u0001null" : part.toString();
            digest.update(text.getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
        }
        return ByteBuffer.wrap(digest.digest()).getLong();
    }
}
