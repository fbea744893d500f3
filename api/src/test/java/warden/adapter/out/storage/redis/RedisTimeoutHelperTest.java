package warden.adapter.out.storage.redis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.adapter.out.storage.redis.RedisTimeoutHelper.RedisTimeoutException;

@DisplayName("RedisTimeoutHelper")
class RedisTimeoutHelperTest {

    private static final String REPOSITORY_NAME = "TestRepository";
    private static final String OPERATION_NAME = "testOperation";

    private final RedisTimeoutHelper helper = new RedisTimeoutHelper(Duration.ofMillis(50), REPOSITORY_NAME);

    @Test
    @DisplayName("should return result when operation completes within timeout")
    void shouldReturnResultWithinTimeout() {
        var result = helper.withTimeout(Uni.createFrom().item("success"), OPERATION_NAME)
                .await()
                .indefinitely();

        assertEquals("success", result);
    }

    @Test
    @DisplayName("should throw RedisTimeoutException when operation times out")
    void shouldThrowOnTimeout() {
        var operation = Uni.createFrom().<String>nothing();

        var exception = assertThrows(
                RedisTimeoutException.class,
                () -> helper.withTimeout(operation, OPERATION_NAME).await().indefinitely());

        assertEquals(OPERATION_NAME, exception.getOperation());
        assertEquals(REPOSITORY_NAME, exception.getRepository());
        assertTrue(exception.getMessage().contains(OPERATION_NAME));
    }

    @Test
    @DisplayName("should propagate other failures unchanged")
    void shouldPropagateOtherFailures() {
        var operation = Uni.createFrom().<String>failure(new IllegalStateException("connection refused"));

        var exception = assertThrows(
                IllegalStateException.class,
                () -> helper.withTimeout(operation, OPERATION_NAME).await().indefinitely());

        assertEquals("connection refused", exception.getMessage());
    }
}
