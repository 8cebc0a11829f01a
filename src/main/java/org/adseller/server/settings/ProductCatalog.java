package org.adseller.server.settings;

import io.vertx.core.Future;
import org.adseller.server.audience.model.AudienceCapability;
import org.adseller.server.execution.timeout.Timeout;
import org.adseller.server.settings.model.Product;

import java.util.List;

/**
 * Defines the contract of the seller's product catalog.
 * <p>
 * Prices are read on every call, callers never keep them between proposals.
 */
public interface ProductCatalog {

    /**
     * Returns the product, or a failed future with
     * {@link org.adseller.server.exception.ProductNotFoundException} for an unknown id.
     */
    Future<Product> getProduct(String productId, Timeout timeout);

    /**
     * Returns every product of the catalog ordered by id.
     */
    Future<List<Product>> getProducts(Timeout timeout);

    /**
     * Returns audience capabilities the product publishes, empty when it publishes none.
     */
    Future<List<AudienceCapability>> getCapabilityEmbeddings(String productId, Timeout timeout);
}
