package com.ivamare.crosschain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OperationIntent")
class OperationIntentTest {

    private static final ChainAsset ETH = ChainAsset.nativeAsset(1L, "ETH");
    private static final ChainAsset POL = ChainAsset.nativeAsset(137L, "POL");

    @Test
    @DisplayName("should default the recipient to the user address")
    void shouldDefaultRecipient() {
        assertEquals("0xuser", OperationIntent.of(ETH, POL, "1", "0xuser", null).effectiveRecipient());
        assertEquals("0xother", OperationIntent.of(ETH, POL, "1", "0xuser", "0xother").effectiveRecipient());
    }

    @Test
    @DisplayName("should copy the options map")
    void shouldCopyOptions() {
        Map<String, Object> options = new HashMap<>();
        options.put("order", "FASTEST");
        OperationIntent intent = new OperationIntent(ETH, POL, "1", "0xuser", null, 50, "m3s", options);

        options.put("order", "CHEAPEST");

        assertEquals("FASTEST", intent.options().get("order"));
        assertThrows(UnsupportedOperationException.class, () -> intent.options().put("x", 1));
    }

    @Test
    @DisplayName("should recognize native assets")
    void shouldRecognizeNativeAssets() {
        assertTrue(ETH.isNative());
        assertFalse(new ChainAsset(1L, "0xA0b8", "USDC", 6, null).isNative());
    }
}
