package org.adseller.server.settings;

import io.vertx.core.Future;
import org.adseller.server.audience.model.AudienceCapability;
import org.adseller.server.exception.ProductNotFoundException;
import org.adseller.server.execution.timeout.Timeout;
import org.adseller.server.settings.model.Product;
import org.apache.commons.collections4.ListUtils;
import org.apache.commons.collections4.MapUtils;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

/**
 * {@link ProductCatalog} holding products in memory. Products may be replaced at runtime, e.g. on a rate card
 * change, and are visible to the next lookup.
 */
public class InMemoryProductCatalog implements ProductCatalog {

    private final Map<String, Product> products = new ConcurrentHashMap<>();
    private final Map<String, List<AudienceCapability>> capabilities = new ConcurrentHashMap<>();

    public InMemoryProductCatalog(List<Product> products, Map<String, List<AudienceCapability>> capabilities) {
        ListUtils.emptyIfNull(products).forEach(this::putProduct);
        MapUtils.emptyIfNull(capabilities).forEach(this::putCapabilities);
    }

    public void putProduct(Product product) {
        validateProduct(product);
        products.put(product.getId(), product);
    }

    public void putCapabilities(String productId, List<AudienceCapability> productCapabilities) {
        capabilities.put(Objects.requireNonNull(productId), List.copyOf(ListUtils.emptyIfNull(productCapabilities)));
    }

    private static void validateProduct(Product product) {
        Objects.requireNonNull(product);
        Objects.requireNonNull(product.getId(), "Product id must be present");
        if (product.getBaseCpm() == null || product.getBaseCpm().signum() < 0) {
            throw new IllegalArgumentException("Product %s base CPM must be non-negative".formatted(product.getId()));
        }
        if (product.getFloorCpm() != null && product.getFloorCpm().compareTo(product.getBaseCpm()) > 0) {
            throw new IllegalArgumentException("Product %s floor CPM %s exceeds base CPM %s"
                    .formatted(product.getId(), product.getFloorCpm(), product.getBaseCpm()));
        }
    }

    @Override
    public Future<Product> getProduct(String productId, Timeout timeout) {
        if (timeout.isExpired()) {
            return Future.failedFuture(new TimeoutException("Timed out while looking up product " + productId));
        }

        final Product product = productId != null ? products.get(productId) : null;
        return product != null
                ? Future.succeededFuture(product)
                : Future.failedFuture(new ProductNotFoundException(productId));
    }

    @Override
    public Future<List<Product>> getProducts(Timeout timeout) {
        if (timeout.isExpired()) {
            return Future.failedFuture(new TimeoutException("Timed out while listing products"));
        }

        return Future.succeededFuture(products.values().stream()
                .sorted(Comparator.comparing(Product::getId))
                .toList());
    }

    @Override
    public Future<List<AudienceCapability>> getCapabilityEmbeddings(String productId, Timeout timeout) {
        if (timeout.isExpired()) {
            return Future.failedFuture(
                    new TimeoutException("Timed out while looking up capabilities of product " + productId));
        }

        return Future.succeededFuture(productId != null
                ? capabilities.getOrDefault(productId, Collections.emptyList())
                : Collections.emptyList());
    }
}
