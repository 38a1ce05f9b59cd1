package com.ivamare.crosschain.confirmation;

import com.ivamare.crosschain.engine.RouteSnapshot;
import com.ivamare.crosschain.engine.RouteUpdateListener;

/**
 * Confirmation work decided under the operation's lock, carried out after it is released.
 *
 * @param operationId Operation ID
 * @param stage AUTO_CONFIRM or AWAITING_CONFIRMATION
 * @param route Route snapshot the decision was based on
 * @param request Request for the handler (null for AUTO_CONFIRM)
 * @param listener Listener to hand back to the engine on resume
 */
public record PendingConfirmation(
    String operationId,
    ConfirmationStage stage,
    RouteSnapshot route,
    ConfirmationRequest request,
    RouteUpdateListener listener
) {
}
