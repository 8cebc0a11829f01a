package org.adseller.server.pricing;

import org.adseller.server.identity.BuyerContext;
import org.adseller.server.pricing.model.PriceAcceptance;
import org.adseller.server.pricing.model.PriceDisplay;
import org.adseller.server.pricing.model.PricingResult;
import org.adseller.server.pricing.model.VolumeBreakpoint;
import org.adseller.server.settings.model.Product;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Computes buyer-specific CPM prices.
 */
public interface PricingEngine {

    /**
     * Prices the given base CPM for the buyer, enforcing only the global floor.
     */
    PricingResult calculatePrice(String productId, BigDecimal basePrice, BuyerContext buyerContext, long volume);

    /**
     * Prices the product for the buyer, enforcing the higher of the product floor and the global floor.
     */
    PricingResult calculatePrice(Product product, BuyerContext buyerContext, long volume);

    PriceDisplay getPriceDisplay(BigDecimal basePrice, BuyerContext buyerContext);

    /**
     * Checks an offered CPM against the global floor and the product floor.
     */
    PriceAcceptance isPriceAcceptable(BigDecimal offeredPrice, BigDecimal productFloor);

    /**
     * Returns the nearest breakpoint above the volume that would raise the buyer's volume discount, empty when the
     * buyer's tier has no volume discounts or the volume already earns the largest one.
     */
    Optional<VolumeBreakpoint> nextVolumeBreakpoint(BuyerContext buyerContext, long volume);
}
