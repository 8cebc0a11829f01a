package org.adseller.server.exception;

@SuppressWarnings("serial")
public class AdSellerException extends RuntimeException {

    public AdSellerException(String message) {
        super(message);
    }

    public AdSellerException(String message, Throwable cause) {
        super(message, cause);
    }
}
