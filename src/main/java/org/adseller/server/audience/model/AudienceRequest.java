package org.adseller.server.audience.model;

import lombok.Value;

import java.util.List;

/**
 * Buyer targeting: the buyer's audience embedding and the capability tags the buyer asks for.
 */
@Value(staticConstructor = "of")
public class AudienceRequest {

    AudienceEmbedding embedding;

    List<RequestedCapability> requestedCapabilities;
}
