package org.adseller.server.settings.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class ProductCapabilities {

    String productId;

    List<CapabilityEmbedding> capabilities;
}
