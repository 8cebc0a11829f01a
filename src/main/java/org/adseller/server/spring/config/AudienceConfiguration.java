package org.adseller.server.spring.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.adseller.server.audience.CoverageValidator;
import org.adseller.server.audience.EmbeddingCoverageValidator;
import org.adseller.server.audience.UcpEmbeddingDecoder;
import org.adseller.server.audience.model.AudienceThresholds;
import org.adseller.server.json.JacksonMapper;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
public class AudienceConfiguration {

    @Bean
    CoverageValidator coverageValidator(AudienceConfigurationProperties properties) {
        return new EmbeddingCoverageValidator(properties.toComponentProperties());
    }

    @Bean
    UcpEmbeddingDecoder ucpEmbeddingDecoder(JacksonMapper jacksonMapper) {
        return new UcpEmbeddingDecoder(jacksonMapper);
    }

    @Bean
    @ConfigurationProperties(prefix = "audience")
    AudienceConfigurationProperties audienceConfigurationProperties() {
        return new AudienceConfigurationProperties();
    }

    @Validated
    @NoArgsConstructor
    @Data
    static class AudienceConfigurationProperties {

        @DecimalMin("0")
        @DecimalMax("1")
        private double validSimilarity = 0.5d;

        @DecimalMin("0")
        @DecimalMax("1")
        private double minimumSimilarity = 0.3d;

        @DecimalMin("0")
        @DecimalMax("1")
        private double tagMatchThreshold = 0.3d;

        @PositiveOrZero
        private int maxAlternativesPerGap = 2;

        AudienceThresholds toComponentProperties() {
            return AudienceThresholds.builder()
                    .validSimilarity(validSimilarity)
                    .minimumSimilarity(minimumSimilarity)
                    .tagMatchThreshold(tagMatchThreshold)
                    .maxAlternativesPerGap(maxAlternativesPerGap)
                    .build();
        }
    }
}
