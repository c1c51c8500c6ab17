package com.dbexplorer.paging;

import com.dbexplorer.error.InvalidCursorException;
import org.junit.jupiter.api.Test;

import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PaginationCodecTest {

    private final PaginationCodec codec = new PaginationCodec();

    @Test
    void decodesWhatItEncodes() {
        long fp = FilterFingerprint.of("domain", "weight", 10);

        QueryCursor cursor = codec.decode(codec.encode(3, fp));

        assertThat(cursor.getPage()).isEqualTo(3);
        assertThat(cursor.getFingerprint()).isEqualTo(fp);
        assertThat(cursor.isTotalKnown()).isFalse();
    }

    @Test
    void preservesTotalKnownFlag() {
        QueryCursor original = new QueryCursor(Integer.MAX_VALUE, Long.MIN_VALUE, true);

        assertThat(codec.decode(codec.encode(original))).isEqualTo(original);
    }

    @Test
    void tokenIsShortAndUrlSafe() {
        String token = codec.encode(12, 42L);

        assertThat(token).hasSize(24).matches("[A-Za-z0-9_-]+");
    }

    @Test
    void rejectsTokenFromAnotherFingerprint() {
        String token = codec.encode(1, FilterFingerprint.of("tables", "public", 10));

        assertThatThrownBy(() -> codec.decode(token, FilterFingerprint.of("tables", "public", 20)))
                .isInstanceOf(InvalidCursorException.class);
    }

    @Test
    void rejectsTokenFromAnotherProcess() {
        String token = new PaginationCodec().encode(1, 7L);

        assertThatThrownBy(() -> codec.decode(token)).isInstanceOf(InvalidCursorException.class);
    }

    @Test
    void rejectsModifiedToken() {
        byte[] bytes = Base64.getUrlDecoder().decode(codec.encode(1, 7L));
        bytes[4] ^= 0x01;
        String tampered = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);

        assertThatThrownBy(() -> codec.decode(tampered)).isInstanceOf(InvalidCursorException.class);
    }

    @Test
    void rejectsGarbage() {
        assertThatThrownBy(() -> codec.decode("")).isInstanceOf(InvalidCursorException.class);
        assertThatThrownBy(() -> codec.decode("not a cursor!")).isInstanceOf(InvalidCursorException.class);
        assertThatThrownBy(() -> codec.decode("AAAA")).isInstanceOf(InvalidCursorException.class);
    }

    @Test
    void refusesNegativePage() {
        assertThatThrownBy(() -> codec.encode(-1, 0L)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fingerprintDependsOnEveryPart() {
        assertThat(FilterFingerprint.of("a", "b")).isEqualTo(FilterFingerprint.of("a", "b"));
        assertThat(FilterFingerprint.of("a", "b")).isNotEqualTo(FilterFingerprint.of("ab"));
        assertThat(FilterFingerprint.of("a", null)).isNotEqualTo(FilterFingerprint.of("a", "null"));
    }
}
