package org.adseller.server.exception;

@SuppressWarnings("serial")
public class InvalidEmbeddingException extends AdSellerException {

    public InvalidEmbeddingException(String message) {
        super(message);
    }
}
