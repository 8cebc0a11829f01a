package org.adseller.server.settings.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.adseller.server.audience.proto.UcpEmbedding;

@Value
@Builder
@Jacksonized
public class CapabilityEmbedding {

    /**
     * One of the product's capability tags.
     */
    String tag;

    UcpEmbedding embedding;
}
