package org.adseller.server.audience.model;

public enum ValidationStatus {

    valid, partial_match, no_match,

    /**
     * Audience validation was not requested, or could not be performed.
     */
    not_requested
}
