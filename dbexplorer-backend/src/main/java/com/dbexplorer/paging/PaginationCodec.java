package com.dbexplorer.paging;

import com.dbexplorer.error.InvalidCursorException;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * Encodes paging positions into short opaque tokens that fit in a button payload.
 *
 * <p>Layout before URL-safe Base64: version (1 byte), page (4), flags (1), fingerprint (8) and the
 * first 4 bytes of an HMAC-SHA256 over the preceding bytes. The HMAC key is generated per process,
 * so tokens issued by an earlier run are rejected like any forged one.
 */
@Component
public class PaginationCodec {
    private static final byte VERSION = 1;
    private static final int PAYLOAD_BYTES = 1 + 4 + 1 + 8;
    private static final int TAG_BYTES = 4;
    private static final int FLAG_TOTAL_KNOWN = 0x01;
    private static final String MAC_ALGORITHM = "HmacSHA256";

    private final SecretKeySpec key;

    public PaginationCodec() {
        byte[] secret = new byte[32];
        new SecureRandom().nextBytes(secret);
        this.key = new SecretKeySpec(secret, MAC_ALGORITHM);
    }

    public String encode(int page, long fingerprint) {
        return encode(page, fingerprint, false);
    }

    /**
     * Create a token.
     *
     * @param page zero-based page index
     * @param fingerprint fingerprint of the listing
     * @param totalKnown whether the listing size was known when the token was issued
     * @return URL-safe token without padding
     */
    public String encode(int page, long fingerprint, boolean totalKnown) {
        if (page < 0) {
            throw new IllegalArgumentException("Page must not be negative: " + page);
        }
        ByteBuffer buf = ByteBuffer.allocate(PAYLOAD_BYTES + TAG_BYTES);
        buf.put(VERSION);
        buf.putInt(page);
        buf.put((byte) (totalKnown ? FLAG_TOTAL_KNOWN : 0));
        buf.putLong(fingerprint);
        byte[] bytes = buf.array();
        System.arraycopy(tag(bytes), 0, bytes, PAYLOAD_BYTES, TAG_BYTES);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    public String encode(QueryCursor cursor) {
        return encode(cursor.getPage(), cursor.getFingerprint(), cursor.isTotalKnown());
    }

    /**
     * Read a token back.
     *
     * @param token token from {@link #encode}
     * @return cursor
     * @throws InvalidCursorException when the token is malformed, modified or foreign
     */
    public QueryCursor decode(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidCursorException("Empty cursor");
        }
        byte[] bytes;
        try {
            bytes = Base64.getUrlDecoder().decode(token.trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidCursorException("Cursor is not valid base64");
        }
        if (bytes.length != PAYLOAD_BYTES + TAG_BYTES) {
            throw new InvalidCursorException("Cursor has the wrong length");
        }
        byte[] expected = tag(bytes);
        byte[] actual = Arrays.copyOfRange(bytes, PAYLOAD_BYTES, PAYLOAD_BYTES + TAG_BYTES);
        if (!MessageDigest.isEqual(expected, actual)) {
            throw new InvalidCursorException("Cursor signature mismatch");
        }

        ByteBuffer buf = ByteBuffer.wrap(bytes, 0, PAYLOAD_BYTES);
        byte version = buf.get();
        int page = buf.getInt();
        int flags = buf.get() & 0xFF;
        long fingerprint = buf.getLong();
        if (version != VERSION) {
            throw new InvalidCursorException("Unsupported cursor version " + version);
        }
        if (page < 0 || (flags & ~FLAG_TOTAL_KNOWN) != 0) {
            throw new InvalidCursorException("Cursor content is out of range");
        }
        return new QueryCursor(page, fingerprint, (flags & FLAG_TOTAL_KNOWN) != 0);
    }

    /**
     * Read a token issued for a specific listing.
     *
     * @throws InvalidCursorException also when the token belongs to a different listing
     */
    public QueryCursor decode(String token, long expectedFingerprint) {
        QueryCursor cursor = decode(token);
        if (cursor.getFingerprint() != expectedFingerprint) {
            throw new InvalidCursorException("Cursor was issued for a different query");
        }
        return cursor;
    }

    private byte[] tag(byte[] bytes) {
        try {
            Mac mac = Mac.getInstance(MAC_ALGORITHM);
            mac.init(key);
            mac.update(bytes, 0, PAYLOAD_BYTES);
            return Arrays.copyOf(mac.doFinal(), TAG_BYTES);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Cannot compute cursor signature", e);
        }
    }
}
