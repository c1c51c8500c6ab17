package com.dbexplorer.bot;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class GuidedSessionStoreTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-05T12:00:00Z"));
    private final GuidedSessionStore store = new GuidedSessionStore(30, clock);

    @AfterEach
    void tearDown() {
        store.shutdown();
    }

    @Test
    void startReplacesPreviousSession() {
        GuidedSession first = store.start(1L);
        first.setTable("notes");

        GuidedSession second = store.start(1L);

        assertThat(second).isNotSameAs(first);
        assertThat(store.get(1L)).containsSame(second);
        assertThat(second.getStep()).isEqualTo(GuidedStep.PICK_TABLE);
    }

    @Test
    void sessionsArePerUser() {
        store.start(1L);

        assertThat(store.get(2L)).isEmpty();
        assertThat(store.get(1L)).isPresent();
    }

    @Test
    void idleSessionExpires() {
        store.start(1L);

        clock.advance(Duration.ofMinutes(31));

        assertThat(store.get(1L)).isEmpty();
    }

    @Test
    void useKeepsSessionAlive() {
        store.start(1L);

        clock.advance(Duration.ofMinutes(20));
        assertThat(store.get(1L)).isPresent();
        clock.advance(Duration.ofMinutes(20));

        assertThat(store.get(1L)).isPresent();
    }

    @Test
    void cleanupDropsOnlyExpired() {
        store.start(1L);
        clock.advance(Duration.ofMinutes(25));
        store.start(2L);
        clock.advance(Duration.ofMinutes(10));

        store.cleanupExpiredSessions();

        assertThat(store.get(1L)).isEmpty();
        assertThat(store.get(2L)).isPresent();
    }

    @Test
    void removeForgetsSession() {
        store.start(1L);

        store.remove(1L);

        assertThat(store.get(1L)).isEmpty();
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        private MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
