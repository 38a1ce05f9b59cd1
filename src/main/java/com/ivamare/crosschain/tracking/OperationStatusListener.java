package com.ivamare.crosschain.tracking;

import com.ivamare.crosschain.model.OperationResult;

/**
 * Notified after an operation's public view changes.
 *
 * <p>Called outside the operation's lock, on whichever thread applied the change.
 */
@FunctionalInterface
public interface OperationStatusListener {

    void onStatusChanged(OperationResult result);
}
