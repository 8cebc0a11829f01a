package org.adseller.server.pricing.model;

import lombok.Value;

import java.math.BigDecimal;

@Value(staticConstructor = "of")
public class VolumeBreakpoint {

    long minImpressions;

    BigDecimal discount;
}
