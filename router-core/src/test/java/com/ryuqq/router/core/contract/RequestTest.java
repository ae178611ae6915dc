package com.ryuqq.router.core.contract;

import com.ryuqq.router.core.model.Payload;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Request Record 테스트.
 *
 * @author Router Team
 * @since 1.0.0
 */
class RequestTest {

    @Test
    void constructor_ValidValues_CreatesRequest() {
        // Given
        Payload body = Payload.of("{\"key\":\"value\"}");

        // When
        Request request = new Request("Do", body);

        // Then
        assertEquals("Do", request.procedure());
        assertEquals(body, request.body());
    }

    @Test
    void constructor_NullProcedure_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new Request(null, Payload.empty())
        );
        assertTrue(exception.getMessage().contains("procedure cannot be null"));
    }

    @Test
    void constructor_NullBody_NormalizesToEmptyPayload() {
        // When
        Request request = new Request("Do", null);

        // Then
        assertNotNull(request.body());
        assertTrue(request.body().isEmpty());
    }

    @Test
    void constructor_EmptyProcedure_IsAllowed() {
        // When
        Request request = Request.of("");

        // Then
        assertEquals("", request.procedure());
    }

    @Test
    void constructor_ProcedureWithWhitespace_IsNotTrimmed() {
        // When
        Request request = Request.of(" Do ");

        // Then
        assertEquals(" Do ", request.procedure());
    }

    @Test
    void equals_SameValues_ReturnsTrue() {
        // Given
        Request request1 = Request.of("Do", Payload.of("{}"));
        Request request2 = Request.of("Do", Payload.of("{}"));

        // When & Then
        assertEquals(request1, request2);
        assertEquals(request1.hashCode(), request2.hashCode());
    }
}
