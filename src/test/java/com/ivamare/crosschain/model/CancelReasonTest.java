package com.ivamare.crosschain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CancelReason")
class CancelReasonTest {

    @Test
    @DisplayName("should map only timeout to TIMEOUT")
    void shouldParseReason() {
        assertEquals(CancelReason.TIMEOUT, CancelReason.fromValue("timeout"));
        assertEquals(CancelReason.TIMEOUT, CancelReason.fromValue(" TIMEOUT "));
        assertEquals(CancelReason.USER, CancelReason.fromValue("user"));
        assertEquals(CancelReason.USER, CancelReason.fromValue("changed my mind"));
        assertEquals(CancelReason.USER, CancelReason.fromValue(null));
    }

    @Test
    @DisplayName("should carry reason-specific messages")
    void shouldCarryMessages() {
        assertEquals("Operation canceled by user", CancelReason.USER.canceledMessage());
        assertEquals("Cancellation failed: rpc down", CancelReason.USER.stopFailedMessage("rpc down"));
        assertEquals("Operation timed out and was canceled", CancelReason.TIMEOUT.canceledMessage());
        assertEquals("Operation timed out and could not be canceled", CancelReason.TIMEOUT.stopFailedMessage("rpc down"));
    }
}
