package com.ivamare.crosschain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OperationStatus")
class OperationStatusTest {

    @Test
    @DisplayName("should treat COMPLETED and FAILED as terminal")
    void shouldTreatCompletedAndFailedAsTerminal() {
        assertTrue(OperationStatus.COMPLETED.isTerminal());
        assertTrue(OperationStatus.FAILED.isTerminal());
    }

    @Test
    @DisplayName("should treat PENDING, ACTION_REQUIRED and UNKNOWN as non-terminal")
    void shouldTreatOthersAsNonTerminal() {
        assertFalse(OperationStatus.PENDING.isTerminal());
        assertFalse(OperationStatus.ACTION_REQUIRED.isTerminal());
        assertFalse(OperationStatus.UNKNOWN.isTerminal());
    }
}
