package com.ryuqq.router.adapter.inmemory.registry;

import com.ryuqq.router.core.handler.Handler;
import com.ryuqq.router.core.model.Payload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link InMemoryHandlerRegistry}.
 *
 * @author Router Team
 * @since 1.0.0
 */
@DisplayName("InMemoryHandlerRegistry Tests")
class InMemoryHandlerRegistryTest {

    private InMemoryHandlerRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new InMemoryHandlerRegistry();
    }

    @Test
    @DisplayName("lookup returns the registered handler")
    void lookupReturnsRegisteredHandler() {
        // Given
        Handler handler = Handler.of((context, body) -> body);

        // When
        registry.register("Do", handler);

        // Then
        assertThat(registry.lookup("Do")).containsSame(handler);
    }

    @Test
    @DisplayName("lookup of an unknown name returns empty")
    void lookupUnknownReturnsEmpty() {
        assertThat(registry.lookup("Missing")).isEmpty();
    }

    @Test
    @DisplayName("re-registration replaces the previous handler")
    void reRegistrationReplaces() {
        // Given
        Handler first = Handler.of((context, body) -> Payload.of("first"));
        Handler second = Handler.of((context, body) -> Payload.of("second"));

        // When
        registry.register("Do", first);
        registry.register("Do", second);

        // Then
        assertThat(registry.lookup("Do")).containsSame(second);
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("names are matched exactly without normalization")
    void namesMatchExactly() {
        // Given
        registry.register("Do", Handler.of((context, body) -> body));

        // Then
        assertThat(registry.lookup("do")).isEmpty();
        assertThat(registry.lookup("Do ")).isEmpty();
        assertThat(registry.lookup(" Do")).isEmpty();
    }

    @Test
    @DisplayName("empty string is a legal key")
    void emptyStringIsLegalKey() {
        // Given
        Handler handler = Handler.of((context, body) -> body);

        // When
        registry.register("", handler);

        // Then
        assertThat(registry.lookup("")).containsSame(handler);
        assertThat(registry.procedures()).containsExactly("");
    }

    @Test
    @DisplayName("procedures returns an immutable snapshot")
    void proceduresIsSnapshot() {
        // Given
        registry.register("A", Handler.of((context, body) -> body));
        registry.register("B", Handler.of((context, body) -> body));

        // When
        var snapshot = registry.procedures();
        registry.register("C", Handler.of((context, body) -> body));

        // Then
        assertThat(snapshot).containsExactlyInAnyOrder("A", "B");
        assertThatThrownBy(() -> snapshot.add("D")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("null arguments are rejected")
    void nullArgumentsRejected() {
        Handler handler = Handler.of((context, body) -> body);

        assertThatThrownBy(() -> registry.register(null, handler))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("procedure cannot be null");
        assertThatThrownBy(() -> registry.register("Do", null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("handler cannot be null");
        assertThatThrownBy(() -> registry.lookup(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("clear removes all bindings")
    void clearRemovesAll() {
        // Given
        registry.register("Do", Handler.of((context, body) -> body));

        // When
        registry.clear();

        // Then
        assertThat(registry.size()).isZero();
        assertThat(registry.lookup("Do")).isEmpty();
    }

    @Test
    @DisplayName("separate registries do not share bindings")
    void registriesAreIndependent() {
        // Given
        InMemoryHandlerRegistry other = new InMemoryHandlerRegistry();

        // When
        registry.register("Do", Handler.of((context, body) -> body));

        // Then
        assertThat(other.lookup("Do")).isEmpty();
    }

    @Test
    @DisplayName("concurrent registration of distinct names keeps every binding")
    void concurrentRegistration() throws Exception {
        // Given
        int threadCount = 8;
        int perThread = 100;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        // When
        for (int t = 0; t < threadCount; t++) {
            int threadIndex = t;
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    registry.register("proc-" + threadIndex + "-" + i, Handler.of((context, body) -> body));
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        executor.shutdown();

        // Then
        assertThat(registry.size()).isEqualTo(threadCount * perThread);
    }
}
