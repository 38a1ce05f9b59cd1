package com.ivamare.crosschain.engine;

/**
 * Callback the engine invokes with the latest route every time execution state changes.
 */
@FunctionalInterface
public interface RouteUpdateListener {

    void onRouteUpdate(RouteSnapshot route);
}
