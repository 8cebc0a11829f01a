package org.adseller.server.exception;

import lombok.Getter;

@Getter
@SuppressWarnings("serial")
public class DimensionMismatchException extends AdSellerException {

    private final int buyerDimension;

    private final int sellerDimension;

    public DimensionMismatchException(int buyerDimension, int sellerDimension) {
        super("Embedding dimension mismatch: buyer %d vs seller %d".formatted(buyerDimension, sellerDimension));
        this.buyerDimension = buyerDimension;
        this.sellerDimension = sellerDimension;
    }
}
