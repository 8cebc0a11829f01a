package org.adseller.server.audience;

import org.adseller.server.audience.model.AudienceEmbedding;
import org.adseller.server.audience.proto.UcpEmbedding;
import org.adseller.server.audience.proto.UcpModelDescriptor;
import org.adseller.server.exception.InvalidEmbeddingException;
import org.adseller.server.json.DecodeException;
import org.adseller.server.json.JacksonMapper;
import org.apache.commons.collections4.CollectionUtils;

import java.util.List;
import java.util.Objects;

/**
 * Turns UCP wire payloads into validated {@link AudienceEmbedding}s.
 */
public class UcpEmbeddingDecoder {

    private final JacksonMapper mapper;

    public UcpEmbeddingDecoder(JacksonMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper);
    }

    public AudienceEmbedding decode(String body) {
        final UcpEmbedding embedding;
        try {
            embedding = mapper.decodeValue(body, UcpEmbedding.class);
        } catch (DecodeException e) {
            throw new InvalidEmbeddingException("Cannot parse UCP embedding: " + e.getMessage());
        }
        return toAudienceEmbedding(embedding);
    }

    public AudienceEmbedding decode(byte[] body) {
        final UcpEmbedding embedding;
        try {
            embedding = mapper.decodeValue(body, UcpEmbedding.class);
        } catch (DecodeException e) {
            throw new InvalidEmbeddingException("Cannot parse UCP embedding: " + e.getMessage());
        }
        return toAudienceEmbedding(embedding);
    }

    public AudienceEmbedding toAudienceEmbedding(UcpEmbedding embedding) {
        if (embedding == null) {
            throw new InvalidEmbeddingException("UCP embedding must be present");
        }

        final List<Float> vector = embedding.getVector();
        if (CollectionUtils.isEmpty(vector)) {
            throw new InvalidEmbeddingException("UCP embedding vector must be present");
        }

        final Integer dimension = embedding.getDimension();
        if (dimension == null) {
            throw new InvalidEmbeddingException("UCP embedding dimension must be present");
        }
        if (dimension < AudienceEmbedding.MIN_DIMENSION || dimension > AudienceEmbedding.MAX_DIMENSION) {
            throw new InvalidEmbeddingException("UCP embedding dimension must be in range [%d, %d], but was %d"
                    .formatted(AudienceEmbedding.MIN_DIMENSION, AudienceEmbedding.MAX_DIMENSION, dimension));
        }
        if (vector.size() != dimension) {
            throw new InvalidEmbeddingException("UCP embedding declares dimension %d, but vector has %d values"
                    .formatted(dimension, vector.size()));
        }

        final UcpModelDescriptor model = embedding.getModelDescriptor();
        if (model != null && model.getDimension() != null && !model.getDimension().equals(dimension)) {
            throw new InvalidEmbeddingException("UCP model %s produces dimension %d, but embedding has %d"
                    .formatted(model.getId(), model.getDimension(), dimension));
        }

        final float[] values = new float[vector.size()];
        for (int i = 0; i < values.length; i++) {
            final Float value = vector.get(i);
            if (value == null || !Float.isFinite(value)) {
                throw new InvalidEmbeddingException("UCP embedding vector has invalid value at index " + i);
            }
            values[i] = value;
        }

        return AudienceEmbedding.of(embedding.getEmbeddingType(), values);
    }
}
