package org.adseller.server.deals;

import io.vertx.core.Future;

/**
 * Shared avails of the seller's products.
 */
public interface InventoryLedger {

    /**
     * Atomically reserves the volume if it is available. Completes with false when it is not.
     */
    Future<Boolean> reserve(String productId, long volume);

    /**
     * Returns previously reserved volume to the avails.
     */
    Future<Void> release(String productId, long volume);
}
