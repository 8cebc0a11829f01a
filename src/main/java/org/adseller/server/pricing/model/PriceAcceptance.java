package org.adseller.server.pricing.model;

import lombok.Value;

@Value(staticConstructor = "of")
public class PriceAcceptance {

    boolean acceptable;

    String reason;
}
