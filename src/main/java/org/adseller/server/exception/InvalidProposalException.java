package org.adseller.server.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.List;

@Getter
@SuppressWarnings("serial")
public class InvalidProposalException extends AdSellerException {

    private final List<String> messages;

    public InvalidProposalException(String message) {
        super(message);
        this.messages = Collections.singletonList(message);
    }

    public InvalidProposalException(List<String> messages) {
        super(String.join("\n", messages));
        this.messages = List.copyOf(messages);
    }
}
