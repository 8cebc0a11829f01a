package org.adseller.server.audience.proto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Embedding model that produced a vector. Buyer and seller vectors are only comparable within the same model.
 */
@Value
@Builder
@Jacksonized
public class UcpModelDescriptor {

    String id;

    String version;

    Integer dimension;

    String metric;
}
