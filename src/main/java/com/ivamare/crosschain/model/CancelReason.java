package com.ivamare.crosschain.model;

/**
 * Why an operation is being canceled.
 */
public enum CancelReason {
    USER("Operation canceled by user", "Cancellation failed: "),
    TIMEOUT("Operation timed out and was canceled", "Operation timed out and could not be canceled");

    private final String canceledMessage;
    private final String stopFailedMessage;

    CancelReason(String canceledMessage, String stopFailedMessage) {
        this.canceledMessage = canceledMessage;
        this.stopFailedMessage = stopFailedMessage;
    }

    /**
     * Message recorded when the engine stopped (or had nothing to stop).
     */
    public String canceledMessage() {
        return canceledMessage;
    }

    /**
     * Message recorded when the engine's stop call failed.
     */
    public String stopFailedMessage(String cause) {
        return this == USER ? stopFailedMessage + cause : stopFailedMessage;
    }

    /**
     * Parse a free-form reason; only "timeout" (any case) maps to TIMEOUT.
     */
    public static CancelReason fromValue(String value) {
        return value != null && value.trim().equalsIgnoreCase("timeout") ? TIMEOUT : USER;
    }
}
