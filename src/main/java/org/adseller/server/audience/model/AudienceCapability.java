package org.adseller.server.audience.model;

import lombok.Value;

/**
 * Audience capability a seller publishes for a product, represented by an embedding.
 */
@Value(staticConstructor = "of")
public class AudienceCapability {

    String tag;

    AudienceEmbedding embedding;
}
