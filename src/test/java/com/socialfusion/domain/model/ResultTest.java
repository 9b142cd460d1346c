package com.socialfusion.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResultTest {

    @Test
    void shouldExposeSuccessValue() {
        Result<Integer, String> result = Result.success(42);

        assertTrue(result.isSuccess());
        assertFalse(result.isFailure());
        assertEquals(42, result.getOrThrow());
        assertNull(result.errorOrNull());
    }

    @Test
    void shouldRefuseValueOfFailure() {
        Result<Integer, String> result = Result.failure("boom");

        assertTrue(result.isFailure());
        assertEquals("boom", result.errorOrNull());
        IllegalStateException error = assertThrows(IllegalStateException.class, result::getOrThrow);
        assertTrue(error.getMessage().contains("boom"));
    }
}
