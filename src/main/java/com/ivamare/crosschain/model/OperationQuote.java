package com.ivamare.crosschain.model;

import com.ivamare.crosschain.engine.RouteSnapshot;

import java.time.Instant;
import java.util.List;

/**
 * A priced route for an intent, ready to be executed.
 *
 * @param id Quote identifier
 * @param intent Intent this quote satisfies
 * @param estimate Engine estimate
 * @param expiresAt When the engine stops honouring the quote (nullable)
 * @param route Route to submit for execution
 * @param warnings Notices from the engine
 */
public record OperationQuote(
    String id,
    OperationIntent intent,
    QuoteEstimate estimate,
    Instant expiresAt,
    RouteSnapshot route,
    List<String> warnings
) {

    public OperationQuote {
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }
}
