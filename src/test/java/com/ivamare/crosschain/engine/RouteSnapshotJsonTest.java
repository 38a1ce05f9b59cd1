package com.ivamare.crosschain.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.crosschain.model.OperationStatus;
import com.ivamare.crosschain.tracking.StatusDeriver;
import com.ivamare.crosschain.tracking.TransactionLocator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RouteSnapshot JSON binding")
class RouteSnapshotJsonTest {

    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
    private final StatusDeriver deriver = new StatusDeriver();
    private final TransactionLocator locator = new TransactionLocator();

    private RouteSnapshot load(String name) throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/fixtures/" + name)) {
            assertNotNull(in, "missing fixture " + name);
            return mapper.readValue(in, RouteSnapshot.class);
        }
    }

    @Test
    @DisplayName("should bind a completed engine route and ignore unknown fields")
    void shouldBindCompletedRoute() throws IOException {
        RouteSnapshot route = load("route-completed.json");

        assertEquals("0x4a1b7c2e-route-completed", route.id());
        assertEquals(1L, route.fromChainId());
        assertEquals(137L, route.toChainId());
        assertEquals(1, route.steps().size());
        assertEquals(3, route.firstStep().processes().size());

        assertEquals(OperationStatus.COMPLETED, deriver.derive(route));
        assertEquals("0x1111111111111111111111111111111111111111111111111111111111111111",
            locator.sourceTx(route).hash());
        assertEquals("0x3333333333333333333333333333333333333333333333333333333333333333",
            locator.destinationTx(route).hash());
        assertEquals("998215000", locator.receivedAmount(route));
    }

    @Test
    @DisplayName("should bind the transaction payload of an action-required step")
    void shouldBindActionRequiredRoute() throws IOException {
        RouteSnapshot route = load("route-action-required.json");

        assertEquals(OperationStatus.ACTION_REQUIRED, deriver.derive(route));
        StepSnapshot step = deriver.findActionRequiredStep(route).orElseThrow();
        ProcessSnapshot pending = step.processes().get(1);
        assertTrue(pending.hasTxRequest());
        assertEquals("0x5c7BCd6E7De5423a257D81B442095A1a6ced35C5", pending.txRequest().get("to"));
        assertFalse(locator.destinationTx(route).hasHash());
    }

    @Test
    @DisplayName("should bind process errors of a failed route")
    void shouldBindFailedRoute() throws IOException {
        RouteSnapshot route = load("route-failed.json");

        assertEquals(OperationStatus.FAILED, deriver.derive(route));
        StepSnapshot failed = deriver.findFailedStep(route).orElseThrow();
        assertEquals("Transaction was reverted: slippage exceeded", locator.failureMessage(failed));
    }
}
