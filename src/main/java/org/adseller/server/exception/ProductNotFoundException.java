package org.adseller.server.exception;

@SuppressWarnings("serial")
public class ProductNotFoundException extends AdSellerException {

    public ProductNotFoundException(String productId) {
        super("Product not found: " + productId);
    }
}
