package com.ivamare.crosschain.api.impl;

import com.ivamare.crosschain.confirmation.ConfirmationCoordinator;
import com.ivamare.crosschain.engine.ExecutionEngine;
import com.ivamare.crosschain.engine.RouteSnapshot;
import com.ivamare.crosschain.engine.RouteUpdateListener;
import com.ivamare.crosschain.exception.CrossChainException;
import com.ivamare.crosschain.model.ChainAsset;
import com.ivamare.crosschain.model.ChainInfo;
import com.ivamare.crosschain.model.FailureCode;
import com.ivamare.crosschain.model.GasEstimate;
import com.ivamare.crosschain.model.OperationIntent;
import com.ivamare.crosschain.model.OperationQuote;
import com.ivamare.crosschain.model.OperationResult;
import com.ivamare.crosschain.model.OperationStatus;
import com.ivamare.crosschain.model.QuoteEstimate;
import com.ivamare.crosschain.support.MutableClock;
import com.ivamare.crosschain.tracking.InMemoryOperationRegistry;
import com.ivamare.crosschain.tracking.OperationCanceller;
import com.ivamare.crosschain.tracking.RouteUpdateObserver;
import com.ivamare.crosschain.tracking.StatusDeriver;
import com.ivamare.crosschain.tracking.TimeoutSweeper;
import com.ivamare.crosschain.tracking.TransactionLocator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;

import static com.ivamare.crosschain.support.Routes.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("DefaultCrossChainOperations")
class DefaultCrossChainOperationsTest {

    private static final String OPERATION_ID = "0x5f3c-route";

    private MutableClock clock;
    private InMemoryOperationRegistry registry;
    private ExecutionEngine engine;
    private DefaultCrossChainOperations operations;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        registry = new InMemoryOperationRegistry(clock);
        engine = mock(ExecutionEngine.class);
        when(engine.isExecutionReady()).thenReturn(true);
        when(engine.getActiveExecution(anyString())).thenReturn(Optional.empty());

        ConfirmationCoordinator coordinator = new ConfirmationCoordinator(
            registry, engine, null, false, null, mock(ScheduledExecutorService.class));
        RouteUpdateObserver observer = new RouteUpdateObserver(
            registry, new StatusDeriver(), new TransactionLocator(), coordinator);
        OperationCanceller canceller = new OperationCanceller(registry, engine);
        TimeoutSweeper sweeper = new TimeoutSweeper(registry, canceller, clock,
            Duration.ofMinutes(30), Duration.ofMinutes(1));
        operations = new DefaultCrossChainOperations(engine, registry, observer, canceller, sweeper);
    }

    private OperationQuote quote() {
        RouteSnapshot route = route(OPERATION_ID, notStarted("s1"));
        QuoteEstimate estimate = new QuoteEstimate("1000000", "990000", "985000", "stargate", 180, "1.25");
        return new OperationQuote("quote-1", intent(), estimate, null, route, List.of());
    }

    private RouteUpdateListener submittedListener() {
        ArgumentCaptor<RouteUpdateListener> listener = ArgumentCaptor.forClass(RouteUpdateListener.class);
        verify(engine).submitForExecution(any(), listener.capture());
        return listener.getValue();
    }

    @Nested
    @DisplayName("getOperationQuote")
    class QuoteTests {

        @Test
        @DisplayName("should delegate a valid intent to the engine")
        void shouldDelegateToEngine() {
            OperationQuote quote = quote();
            when(engine.getQuotes(any())).thenReturn(List.of(quote));

            List<OperationQuote> quotes = operations.getOperationQuote(intent());

            assertEquals(List.of(quote), quotes);
        }

        @Test
        @DisplayName("should reject incomplete intents")
        void shouldRejectIncompleteIntents() {
            OperationIntent noAmount = OperationIntent.of(
                ChainAsset.nativeAsset(ETHEREUM, "ETH"), ChainAsset.nativeAsset(POLYGON, "POL"), " ", "0xuser", null);

            assertThrows(IllegalArgumentException.class, () -> operations.getOperationQuote(null));
            assertThrows(IllegalArgumentException.class, () -> operations.getOperationQuote(noAmount));
            verifyNoInteractions(engine);
        }

        @Test
        @DisplayName("should wrap engine failures")
        void shouldWrapEngineFailures() {
            when(engine.getQuotes(any())).thenThrow(new IllegalStateException("no route found"));

            CrossChainException ex = assertThrows(CrossChainException.class,
                () -> operations.getOperationQuote(intent()));
            assertEquals("Failed to get quotes: no route found", ex.getMessage());
        }
    }

    @Nested
    @DisplayName("chain discovery")
    class DiscoveryTests {

        @Test
        @DisplayName("should list the engine's supported chains")
        void shouldListSupportedChains() {
            List<ChainInfo> chains = List.of(
                new ChainInfo(ETHEREUM, "Ethereum", "ETH"),
                new ChainInfo(POLYGON, "Polygon", "POL"));
            when(engine.getSupportedChains()).thenReturn(chains);

            assertEquals(chains, operations.getSupportedChains());
        }

        @Test
        @DisplayName("should wrap chain lookup failures")
        void shouldWrapChainLookupFailures() {
            when(engine.getSupportedChains()).thenThrow(new IllegalStateException("service unavailable"));

            CrossChainException ex = assertThrows(CrossChainException.class, () -> operations.getSupportedChains());
            assertEquals("Failed to get supported chains: service unavailable", ex.getMessage());
        }

        @Test
        @DisplayName("should list tokens for a chain")
        void shouldListSupportedTokens() {
            ChainAsset usdc = new ChainAsset(POLYGON, "0x3c499c542cEF5E3811e1192ce70d8cC03d5c3359", "USDC", 6, "USD Coin");
            when(engine.getSupportedTokens(POLYGON)).thenReturn(List.of(usdc));

            assertEquals(List.of(usdc), operations.getSupportedTokens(POLYGON));
        }

        @Test
        @DisplayName("should wrap token lookup failures with the chain ID")
        void shouldWrapTokenLookupFailures() {
            when(engine.getSupportedTokens(anyLong())).thenThrow(new IllegalStateException("unsupported chain"));

            CrossChainException ex = assertThrows(CrossChainException.class,
                () -> operations.getSupportedTokens(999L));
            assertEquals("Failed to get tokens for chain 999: unsupported chain", ex.getMessage());
        }

        @Test
        @DisplayName("should return the engine's gas recommendation")
        void shouldReturnGasRecommendation() {
            when(engine.getGasOnDestination(any())).thenReturn(new GasEstimate("1500000000000000", "1.05"));

            GasEstimate gas = operations.getGasOnDestination(intent());

            assertEquals("1500000000000000", gas.amount());
            assertEquals("1.05", gas.usdValue());
        }

        @Test
        @DisplayName("should fall back to zero gas when the engine fails or has no recommendation")
        void shouldFallBackToZeroGas() {
            when(engine.getGasOnDestination(any()))
                .thenReturn(null)
                .thenThrow(new IllegalStateException("timeout"));

            assertEquals(GasEstimate.none(), operations.getGasOnDestination(intent()));
            assertEquals(new GasEstimate("0", "0"), operations.getGasOnDestination(intent()));
        }

        @Test
        @DisplayName("should reject an incomplete intent for gas lookups")
        void shouldRejectIncompleteIntentForGas() {
            assertThrows(IllegalArgumentException.class, () -> operations.getGasOnDestination(null));
            verify(engine, never()).getGasOnDestination(any());
        }
    }

    @Nested
    @DisplayName("executeOperation")
    class ExecuteTests {

        @Test
        @DisplayName("should register and submit the route")
        void shouldRegisterAndSubmit() {
            OperationResult result = operations.executeOperation(quote());

            assertEquals(OPERATION_ID, result.operationId());
            assertEquals(OperationStatus.PENDING, result.status());
            assertEquals("Execution initiated", result.statusMessage());
            assertEquals(ETHEREUM, result.sourceTx().chainId());
            assertEquals(POLYGON, result.destinationTx().chainId());
            verify(engine).submitForExecution(eq(quote().route()), any());
        }

        @Test
        @DisplayName("should track progress reported through the submitted listener")
        void shouldTrackProgressThroughListener() {
            operations.executeOperation(quote());

            submittedListener().onRouteUpdate(completed(OPERATION_ID));

            OperationResult result = operations.getOperationStatus(OPERATION_ID);
            assertEquals(OperationStatus.COMPLETED, result.status());
            assertEquals("987654", result.receivedAmount());
        }

        @Test
        @DisplayName("should return UNKNOWN when the engine has no signer")
        void shouldReturnUnknownWhenEngineNotReady() {
            when(engine.isExecutionReady()).thenReturn(false);

            OperationResult result = operations.executeOperation(quote());

            assertEquals(OperationStatus.UNKNOWN, result.status());
            assertEquals("Execution provider required for transaction execution", result.statusMessage());
            verify(engine, never()).submitForExecution(any(), any());
        }

        @Test
        @DisplayName("should fail a quote without a route")
        void shouldFailQuoteWithoutRoute() {
            OperationQuote quote = new OperationQuote("quote-1", intent(), null, null, null, List.of());

            OperationResult result = operations.executeOperation(quote);

            assertEquals(OperationStatus.FAILED, result.status());
            assertEquals(FailureCode.SUBMISSION_FAILED, result.errorCode());
        }

        @Test
        @DisplayName("should fail a duplicate submission without resubmitting")
        void shouldFailDuplicate() {
            operations.executeOperation(quote());

            OperationResult result = operations.executeOperation(quote());

            assertEquals(OperationStatus.FAILED, result.status());
            verify(engine, times(1)).submitForExecution(any(), any());
            assertEquals(OperationStatus.PENDING, operations.getOperationStatus(OPERATION_ID).status());
        }

        @Test
        @DisplayName("should fail the operation when submission throws")
        void shouldFailWhenSubmitThrows() {
            doThrow(new IllegalStateException("insufficient gas")).when(engine).submitForExecution(any(), any());

            OperationResult result = operations.executeOperation(quote());

            assertEquals(OperationStatus.FAILED, result.status());
            assertEquals(FailureCode.SUBMISSION_FAILED, result.errorCode());
            assertEquals("insufficient gas", result.error());
            assertEquals("Operation failed: insufficient gas", result.statusMessage());
        }
    }

    @Nested
    @DisplayName("status, cancel and resume")
    class LifecycleTests {

        @Test
        @DisplayName("should report untracked operations as UNKNOWN")
        void shouldReportUntrackedAsUnknown() {
            assertEquals(OperationStatus.UNKNOWN, operations.getOperationStatus("missing").status());
            assertEquals(OperationStatus.UNKNOWN, operations.cancelOperation("missing").status());
            assertEquals(OperationStatus.UNKNOWN, operations.resumeOperation("missing").status());
        }

        @Test
        @DisplayName("should let cancellation win over later progress")
        void shouldLetCancellationWin() {
            operations.executeOperation(quote());
            RouteUpdateListener listener = submittedListener();

            OperationResult canceled = operations.cancelOperation(OPERATION_ID);
            listener.onRouteUpdate(completed(OPERATION_ID));

            assertEquals(OperationStatus.FAILED, canceled.status());
            assertEquals("Operation canceled by user", canceled.statusMessage());
            assertEquals(canceled, operations.getOperationStatus(OPERATION_ID));
        }

        @Test
        @DisplayName("should map a free-form timeout reason")
        void shouldMapTimeoutReason() {
            operations.executeOperation(quote());

            OperationResult result = operations.cancelOperation(OPERATION_ID, "Timeout");

            assertEquals(FailureCode.TIMED_OUT, result.errorCode());
        }

        @Test
        @DisplayName("should resume the active execution")
        void shouldResumeActiveExecution() {
            operations.executeOperation(quote());
            RouteSnapshot active = awaitingConfirmation(OPERATION_ID);
            when(engine.getActiveExecution(OPERATION_ID)).thenReturn(Optional.of(active));

            OperationResult result = operations.resumeOperation(OPERATION_ID);

            verify(engine).resumeExecution(eq(active), any());
            assertEquals(OperationStatus.PENDING, result.status());
            assertEquals("Resumption initiated", result.statusMessage());
        }

        @Test
        @DisplayName("should return the current result when nothing is active")
        void shouldReturnCurrentWhenNothingActive() {
            operations.executeOperation(quote());

            OperationResult result = operations.resumeOperation(OPERATION_ID);

            assertEquals(OperationStatus.PENDING, result.status());
            verify(engine, never()).resumeExecution(any(), any());
        }

        @Test
        @DisplayName("should fail the operation when resume throws")
        void shouldFailWhenResumeThrows() {
            operations.executeOperation(quote());
            when(engine.getActiveExecution(OPERATION_ID)).thenReturn(Optional.of(inProgress(OPERATION_ID)));
            doThrow(new IllegalStateException("nonce too low")).when(engine).resumeExecution(any(), any());

            OperationResult result = operations.resumeOperation(OPERATION_ID);

            assertEquals(OperationStatus.FAILED, result.status());
            assertEquals(FailureCode.RESUME_FAILED, result.errorCode());
            assertEquals("Failed to resume: nonce too low", result.statusMessage());
        }

        @Test
        @DisplayName("should not call the engine when resuming a terminal operation")
        void shouldNotResumeTerminalOperation() {
            operations.executeOperation(quote());
            operations.cancelOperation(OPERATION_ID);
            clearInvocations(engine);

            OperationResult result = operations.resumeOperation(OPERATION_ID);

            assertEquals(OperationStatus.FAILED, result.status());
            verifyNoInteractions(engine);
        }

        @Test
        @DisplayName("should time out stale pending operations on demand")
        void shouldTimeOutOnDemand() {
            operations.executeOperation(quote());
            clock.advance(Duration.ofMinutes(45));

            assertEquals(1, operations.checkForTimedOutOperations());
            assertEquals("Operation timed out and was canceled",
                operations.getOperationStatus(OPERATION_ID).statusMessage());
        }

        @Test
        @DisplayName("should notify status listeners")
        void shouldNotifyStatusListeners() {
            List<OperationResult> received = new ArrayList<>();
            operations.addStatusListener(received::add);
            operations.executeOperation(quote());

            submittedListener().onRouteUpdate(inProgress(OPERATION_ID));

            assertFalse(received.isEmpty());
            assertEquals("Operation in progress...", received.get(received.size() - 1).statusMessage());
        }
    }
}
