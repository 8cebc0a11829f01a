package org.adseller.server.pricing.model;

public enum PriceDisplayType {

    range, exact
}
