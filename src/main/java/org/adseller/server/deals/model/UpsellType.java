package org.adseller.server.deals.model;

public enum UpsellType {

    alternative_product, volume_upgrade, cross_sell
}
