package org.adseller.server.audience;

import org.adseller.server.audience.model.AudienceEmbedding;
import org.adseller.server.audience.model.EmbeddingType;
import org.adseller.server.exception.InvalidEmbeddingException;
import org.adseller.server.json.JacksonMapper;
import org.adseller.server.json.ObjectMapperProvider;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class UcpEmbeddingDecoderTest {

    private final UcpEmbeddingDecoder target = new UcpEmbeddingDecoder(
            new JacksonMapper(ObjectMapperProvider.mapper()));

    @Test
    public void decodeShouldReturnEmbeddingFromUcpPayload() {
        // given
        final String body = givenPayload("user_intent", 256, 256, 256);

        // when
        final AudienceEmbedding result = target.decode(body);

        // then
        assertThat(result.getEmbeddingType()).isEqualTo(EmbeddingType.user_intent);
        assertThat(result.getDimension()).isEqualTo(256);
        assertThat(result.getVector()).hasSize(256);
        assertThat(result.getVector()[0]).isEqualTo(0.5F);
    }

    @Test
    public void decodeShouldAcceptPayloadAsBytes() {
        // given
        final byte[] body = givenPayload("context", 512, 512, 512).getBytes(StandardCharsets.UTF_8);

        // when
        final AudienceEmbedding result = target.decode(body);

        // then
        assertThat(result.getEmbeddingType()).isEqualTo(EmbeddingType.context);
        assertThat(result.getDimension()).isEqualTo(512);
    }

    @Test
    public void decodeShouldFailWhenVectorLengthDiffersFromDimension() {
        assertThatThrownBy(() -> target.decode(givenPayload("user_intent", 300, 256, 300)))
                .isInstanceOf(InvalidEmbeddingException.class)
                .hasMessage("UCP embedding declares dimension 300, but vector has 256 values");
    }

    @Test
    public void decodeShouldFailOnDimensionOutOfRange() {
        assertThatThrownBy(() -> target.decode(givenPayload("user_intent", 128, 128, 128)))
                .isInstanceOf(InvalidEmbeddingException.class)
                .hasMessage("UCP embedding dimension must be in range [256, 1024], but was 128");
    }

    @Test
    public void decodeShouldFailWhenModelDimensionDiffers() {
        assertThatThrownBy(() -> target.decode(givenPayload("user_intent", 256, 256, 512)))
                .isInstanceOf(InvalidEmbeddingException.class)
                .hasMessageContaining("produces dimension 512");
    }

    @Test
    public void decodeShouldFailOnMalformedPayload() {
        assertThatThrownBy(() -> target.decode("{\"embeddingType\": \"unknown\"}"))
                .isInstanceOf(InvalidEmbeddingException.class)
                .hasMessageStartingWith("Cannot parse UCP embedding");
    }

    @Test
    public void decodeShouldFailWithoutVector() {
        assertThatThrownBy(() -> target.decode("{\"embeddingType\": \"query\", \"dimension\": 256}"))
                .isInstanceOf(InvalidEmbeddingException.class)
                .hasMessage("UCP embedding vector must be present");
    }

    private static String givenPayload(String embeddingType, int dimension, int vectorLength, int modelDimension) {
        final String vector = String.join(",", Collections.nCopies(vectorLength, "0.5"));
        return """
                {
                  "embeddingType": "%s",
                  "signalType": "contextual",
                  "vector": [%s],
                  "dimension": %d,
                  "modelDescriptor": {"id": "ucp-embedding-v1", "version": "1.0.0", "dimension": %d},
                  "ttlSeconds": 3600
                }
                """.formatted(embeddingType, vector, dimension, modelDimension);
    }
}
