package warden.core.model.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SessionRecord")
class SessionRecordTest {

    private static final Instant CREATED = Instant.parse("2024-01-01T00:00:00Z");
    private static final String TOKEN = "3f1c2a9e-8b7d-4c6e-9f10-1a2b3c4d5e6f";

    @Nested
    @DisplayName("validation")
    class ValidationTests {

        @Test
        @DisplayName("should reject blank token")
        void shouldRejectBlankToken() {
            assertThrows(IllegalArgumentException.class, () -> new SessionRecord(" ", "7", CREATED, null));
        }

        @Test
        @DisplayName("should reject null principal id")
        void shouldRejectNullPrincipalId() {
            assertThrows(IllegalArgumentException.class, () -> new SessionRecord(TOKEN, null, CREATED, null));
        }

        @Test
        @DisplayName("should treat null duration as no expiry")
        void shouldTreatNullDurationAsNoExpiry() {
            var record = new SessionRecord(TOKEN, "7", CREATED, null);

            assertEquals(Duration.ZERO, record.duration());
            assertFalse(record.expires());
            assertNull(record.expiresAt());
        }
    }

    @Nested
    @DisplayName("isExpiredAt")
    class ExpiryTests {

        @Test
        @DisplayName("should never expire with zero or negative duration")
        void shouldNeverExpireWithNonPositiveDuration() {
            var zero = new SessionRecord(TOKEN, "7", CREATED, Duration.ZERO);
            var negative = new SessionRecord(TOKEN, "7", CREATED, Duration.ofSeconds(-5));
            var muchLater = CREATED.plus(Duration.ofDays(3650));

            assertFalse(zero.isExpiredAt(muchLater));
            assertFalse(negative.isExpiredAt(muchLater));
        }

        @Test
        @DisplayName("should be live until the expiry instant and expired after it")
        void shouldExpireStrictlyAfterDuration() {
            var record = new SessionRecord(TOKEN, "7", CREATED, Duration.ofSeconds(60));

            assertEquals(CREATED.plusSeconds(60), record.expiresAt());
            assertFalse(record.isExpiredAt(CREATED.plusSeconds(59)));
            assertFalse(record.isExpiredAt(CREATED.plusSeconds(60)));
            assertTrue(record.isExpiredAt(CREATED.plusSeconds(61)));
        }
    }
}
