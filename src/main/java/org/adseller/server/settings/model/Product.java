package org.adseller.server.settings.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Set;

@Value
@Builder(toBuilder = true)
public class Product {

    String id;

    String name;

    BigDecimal baseCpm;

    /**
     * Minimum acceptable CPM, never above {@link #baseCpm}.
     */
    BigDecimal floorCpm;

    /**
     * Inventory channel such as display, video, ctv, mobile_app or native.
     */
    String inventoryType;

    Set<String> capabilityTags;
}
