package org.adseller.server.audience.model;

import lombok.Value;

@Value(staticConstructor = "of")
public class RequestedCapability {

    private static final double DEFAULT_WEIGHT = 1.0d;

    String tag;

    double weight;

    public static RequestedCapability of(String tag) {
        return of(tag, DEFAULT_WEIGHT);
    }
}
