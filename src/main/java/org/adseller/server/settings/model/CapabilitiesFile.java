package org.adseller.server.settings.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Audience capabilities file: the UCP embeddings each product publishes for its capability tags.
 */
@Value
@Builder
@Jacksonized
public class CapabilitiesFile {

    List<ProductCapabilities> products;
}
