package com.datasetsearch.query;

import com.datasetsearch.error.ErrorCode;
import com.datasetsearch.error.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SearchRequestTest {

    @Test
    @DisplayName("缺省 offset 为0，length 为100")
    void testDefaults() {
        SearchRequest request = SearchRequest.of("user/reviews", "default", "train", "  dog  ", null, null);

        assertEquals("dog", request.query());
        assertEquals(0, request.offset());
        assertEquals(100, request.length());
        assertEquals("user/reviews", request.key().dataset());
    }

    @Test
    void testBoundaryValuesAccepted() {
        assertEquals(1, SearchRequest.of("d", "c", "s", "q", 0, 1).length());
        assertEquals(100, SearchRequest.of("d", "c", "s", "q", 5000, 100).length());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1, 101, 1000})
    @DisplayName("length 不在 1..100 时拒绝")
    void testLengthOutOfRange(int length) {
        ValidationException exception = assertThrows(ValidationException.class,
            () -> SearchRequest.of("d", "c", "s", "dog", 0, length));

        assertEquals("length", exception.getParameter());
        assertEquals(ErrorCode.BAD_REQUEST, exception.getErrorCode());
        assertFalse(exception.isRetryable());
    }

    @Test
    void testNegativeOffsetRejected() {
        ValidationException exception = assertThrows(ValidationException.class,
            () -> SearchRequest.of("d", "c", "s", "dog", -1, 10));

        assertEquals("offset", exception.getParameter());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "\t\n"})
    void testBlankQueryRejected(String query) {
        ValidationException exception = assertThrows(ValidationException.class,
            () -> SearchRequest.of("d", "c", "s", query, 0, 10));

        assertEquals("query", exception.getParameter());
    }

    @Test
    void testNullQueryRejected() {
        assertThrows(ValidationException.class, () -> SearchRequest.of("d", "c", "s", null, 0, 10));
    }

    @Test
    void testOverlongQueryRejected() {
        String query = "a".repeat(1025);

        ValidationException exception = assertThrows(ValidationException.class,
            () -> SearchRequest.of("d", "c", "s", query, 0, 10));

        assertEquals("query", exception.getParameter());
    }

    @Test
    void testMissingSplitIdentityRejected() {
        assertEquals("dataset", assertThrows(ValidationException.class,
            () -> SearchRequest.of(null, "c", "s", "q", 0, 10)).getParameter());
        assertEquals("config", assertThrows(ValidationException.class,
            () -> SearchRequest.of("d", " ", "s", "q", 0, 10)).getParameter());
        assertEquals("split", assertThrows(ValidationException.class,
            () -> SearchRequest.of("d", "c", "", "q", 0, 10)).getParameter());
    }
}
