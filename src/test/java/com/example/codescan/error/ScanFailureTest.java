package com.example.codescan.error;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScanFailureTest {

    @Test
    void geometryExceptionCarriesKindIntoFailure() {
        ScanFailure f = ScanFailure.from(new GeometryUnavailableException("layout pending"));
        assertEquals(ScanFailureKind.GEOMETRY_UNAVAILABLE, f.kind());
        assertTrue(f.recoverable());
        assertTrue(f.message().contains("layout pending"));
    }

    @Test
    void missingMessageFallsBackToCode() {
        ScanFailure f = ScanFailure.of(ScanFailureKind.CALLBACK_FAILURE, null);
        assertEquals("callback-failure", f.message());
        assertFalse(f.recoverable());
    }
}
