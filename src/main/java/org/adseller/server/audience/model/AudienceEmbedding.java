package org.adseller.server.audience.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.Value;
import org.adseller.server.exception.InvalidEmbeddingException;

import java.util.Objects;

/**
 * Embedding vector exchanged for audience matching. The dimension always equals the vector length and every
 * value is finite.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AudienceEmbedding {

    public static final int MIN_DIMENSION = 256;
    public static final int MAX_DIMENSION = 1024;

    @Getter(AccessLevel.NONE)
    float[] vector;

    int dimension;

    EmbeddingType embeddingType;

    public static AudienceEmbedding of(EmbeddingType embeddingType, float[] vector) {
        Objects.requireNonNull(vector, "Embedding vector must be present");
        if (vector.length < MIN_DIMENSION || vector.length > MAX_DIMENSION) {
            throw new InvalidEmbeddingException("Embedding dimension must be in range [%d, %d], but was %d"
                    .formatted(MIN_DIMENSION, MAX_DIMENSION, vector.length));
        }
        for (int i = 0; i < vector.length; i++) {
            if (!Float.isFinite(vector[i])) {
                throw new InvalidEmbeddingException(
                        "Embedding value at index %d must be finite, but was %s".formatted(i, vector[i]));
            }
        }

        return new AudienceEmbedding(vector.clone(), vector.length, embeddingType);
    }

    public float[] getVector() {
        return vector.clone();
    }
}
