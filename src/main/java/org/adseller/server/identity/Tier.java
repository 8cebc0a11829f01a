package org.adseller.server.identity;

/**
 * Buyer classification controlling discount and price visibility, from least to most specific.
 */
public enum Tier {

    PUBLIC("Public"),
    SEAT("Seat"),
    AGENCY("Agency"),
    ADVERTISER("Advertiser");

    private final String title;

    Tier(String title) {
        this.title = title;
    }

    public String title() {
        return title;
    }
}
