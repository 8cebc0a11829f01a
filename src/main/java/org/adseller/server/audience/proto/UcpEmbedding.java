package org.adseller.server.audience.proto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.adseller.server.audience.model.EmbeddingType;

import java.util.List;

/**
 * User Context Protocol embedding payload ({@code application/vnd.ucp.embedding+json; v=1}).
 */
@Value
@Builder
@Jacksonized
public class UcpEmbedding {

    @JsonProperty("embeddingType")
    EmbeddingType embeddingType;

    @JsonProperty("signalType")
    SignalType signalType;

    List<Float> vector;

    Integer dimension;

    @JsonProperty("modelDescriptor")
    UcpModelDescriptor modelDescriptor;

    @JsonProperty("ttlSeconds")
    Integer ttlSeconds;
}
