package com.ivamare.crosschain.tracking;

import com.ivamare.crosschain.engine.RouteSnapshot;
import com.ivamare.crosschain.exception.OperationFailureException;
import com.ivamare.crosschain.model.FailureCode;
import com.ivamare.crosschain.model.OperationIntent;
import com.ivamare.crosschain.model.OperationResult;
import com.ivamare.crosschain.model.OperationStatus;
import com.ivamare.crosschain.model.TransactionDetails;

import java.time.Instant;

/**
 * Mutable tracking record for one operation.
 *
 * <p>Instances are owned by the {@link OperationRegistry}. Mutation only happens inside
 * {@link OperationRegistry#update}, under the operation's lock; everything handed out
 * by the registry's read methods is a detached copy.
 */
public class OperationTracking {

    private final String operationId;
    private final Instant startTime;
    private final OperationIntent intent;

    private OperationStatus status = OperationStatus.PENDING;
    private RouteSnapshot latestRoute;
    private TransactionDetails sourceTx;
    private TransactionDetails destinationTx;
    private String receivedAmount;
    private FailureCode errorCode;
    private String error;
    private String statusMessage;
    private boolean awaitingConfirmationDetails;
    private boolean confirmationInFlight;
    private String confirmedStepId;
    private Instant lastUpdatedAt;

    public OperationTracking(String operationId, OperationIntent intent, Instant startTime) {
        this.operationId = operationId;
        this.intent = intent;
        this.startTime = startTime;
        this.lastUpdatedAt = startTime;
        if (intent != null) {
            this.sourceTx = TransactionDetails.onChain(intent.sourceAsset().chainId());
            this.destinationTx = TransactionDetails.onChain(intent.destinationAsset().chainId());
        }
    }

    private OperationTracking(OperationTracking other) {
        this.operationId = other.operationId;
        this.startTime = other.startTime;
        this.intent = other.intent;
        this.status = other.status;
        this.latestRoute = other.latestRoute;
        this.sourceTx = other.sourceTx;
        this.destinationTx = other.destinationTx;
        this.receivedAmount = other.receivedAmount;
        this.errorCode = other.errorCode;
        this.error = other.error;
        this.statusMessage = other.statusMessage;
        this.awaitingConfirmationDetails = other.awaitingConfirmationDetails;
        this.confirmationInFlight = other.confirmationInFlight;
        this.confirmedStepId = other.confirmedStepId;
        this.lastUpdatedAt = other.lastUpdatedAt;
    }

    /**
     * Detached copy, safe to read outside the operation's lock.
     */
    public OperationTracking copy() {
        return new OperationTracking(this);
    }

    /**
     * Mark the operation FAILED with the given reason.
     */
    public void fail(OperationFailureException failure) {
        this.status = OperationStatus.FAILED;
        this.errorCode = failure.getCode();
        this.error = failure.getMessage();
        this.statusMessage = failure.statusMessage();
        this.awaitingConfirmationDetails = false;
        this.confirmationInFlight = false;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Public projection of this record.
     */
    public OperationResult toResult() {
        return new OperationResult(
            operationId,
            status,
            sourceTx,
            destinationTx,
            receivedAmount,
            errorCode,
            error,
            statusMessage
        );
    }

    // Getters and setters

    public String getOperationId() {
        return operationId;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public OperationIntent getIntent() {
        return intent;
    }

    public OperationStatus getStatus() {
        return status;
    }

    public void setStatus(OperationStatus status) {
        this.status = status;
    }

    public RouteSnapshot getLatestRoute() {
        return latestRoute;
    }

    public void setLatestRoute(RouteSnapshot latestRoute) {
        this.latestRoute = latestRoute;
    }

    public TransactionDetails getSourceTx() {
        return sourceTx;
    }

    public void setSourceTx(TransactionDetails sourceTx) {
        this.sourceTx = sourceTx;
    }

    public TransactionDetails getDestinationTx() {
        return destinationTx;
    }

    public void setDestinationTx(TransactionDetails destinationTx) {
        this.destinationTx = destinationTx;
    }

    public String getReceivedAmount() {
        return receivedAmount;
    }

    public void setReceivedAmount(String receivedAmount) {
        this.receivedAmount = receivedAmount;
    }

    public FailureCode getErrorCode() {
        return errorCode;
    }

    public String getError() {
        return error;
    }

    public String getStatusMessage() {
        return statusMessage;
    }

    public void setStatusMessage(String statusMessage) {
        this.statusMessage = statusMessage;
    }

    public boolean isAwaitingConfirmationDetails() {
        return awaitingConfirmationDetails;
    }

    public void setAwaitingConfirmationDetails(boolean awaitingConfirmationDetails) {
        this.awaitingConfirmationDetails = awaitingConfirmationDetails;
    }

    public boolean isConfirmationInFlight() {
        return confirmationInFlight;
    }

    public void setConfirmationInFlight(boolean confirmationInFlight) {
        this.confirmationInFlight = confirmationInFlight;
    }

    /**
     * Step whose confirmation was already requested or granted; later updates for the same
     * step are not assessed again.
     */
    public String getConfirmedStepId() {
        return confirmedStepId;
    }

    public void setConfirmedStepId(String confirmedStepId) {
        this.confirmedStepId = confirmedStepId;
    }

    public Instant getLastUpdatedAt() {
        return lastUpdatedAt;
    }

    void setLastUpdatedAt(Instant lastUpdatedAt) {
        this.lastUpdatedAt = lastUpdatedAt;
    }
}
