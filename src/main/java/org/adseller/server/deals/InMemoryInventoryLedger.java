package org.adseller.server.deals;

import io.vertx.core.Future;
import org.apache.commons.collections4.MapUtils;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link InventoryLedger} keeping avails per product in memory. Products without registered avails have none.
 */
public class InMemoryInventoryLedger implements InventoryLedger {

    private final Map<String, Long> availsByProduct = new ConcurrentHashMap<>();

    public InMemoryInventoryLedger(Map<String, Long> initialAvails) {
        MapUtils.emptyIfNull(initialAvails).forEach(this::setAvails);
    }

    public void setAvails(String productId, long avails) {
        if (avails < 0) {
            throw new IllegalArgumentException("Avails must be non-negative, but was " + avails);
        }
        availsByProduct.put(productId, avails);
    }

    public long getAvails(String productId) {
        return availsByProduct.getOrDefault(productId, 0L);
    }

    @Override
    public Future<Boolean> reserve(String productId, long volume) {
        if (volume < 0) {
            return Future.failedFuture(new IllegalArgumentException("Volume must be non-negative, but was " + volume));
        }

        final AtomicBoolean reserved = new AtomicBoolean();
        availsByProduct.computeIfPresent(productId, (ignored, avails) -> {
            if (avails >= volume) {
                reserved.set(true);
                return avails - volume;
            }
            return avails;
        });
        return Future.succeededFuture(reserved.get());
    }

    @Override
    public Future<Void> release(String productId, long volume) {
        if (volume < 0) {
            return Future.failedFuture(new IllegalArgumentException("Volume must be non-negative, but was " + volume));
        }

        availsByProduct.merge(productId, volume, Long::sum);
        return Future.succeededFuture();
    }
}
