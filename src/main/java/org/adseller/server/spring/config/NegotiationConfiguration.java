package org.adseller.server.spring.config;

import io.vertx.core.Vertx;
import io.vertx.core.file.FileSystem;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.adseller.server.audience.CoverageValidator;
import org.adseller.server.audience.UcpEmbeddingDecoder;
import org.adseller.server.deals.DealIdGenerator;
import org.adseller.server.deals.DecisionMaker;
import org.adseller.server.deals.DecisionPolicies;
import org.adseller.server.deals.DecisionPolicy;
import org.adseller.server.deals.HashDealIdGenerator;
import org.adseller.server.deals.InMemoryInventoryLedger;
import org.adseller.server.deals.InventoryLedger;
import org.adseller.server.deals.ProposalNegotiationService;
import org.adseller.server.deals.ProposalValidator;
import org.adseller.server.deals.UpsellAdvisor;
import org.adseller.server.execution.timeout.TimeoutFactory;
import org.adseller.server.json.JacksonMapper;
import org.adseller.server.metric.Metrics;
import org.adseller.server.pricing.PricingEngine;
import org.adseller.server.settings.CapabilitiesFileReader;
import org.adseller.server.settings.InMemoryProductCatalog;
import org.adseller.server.settings.ProductCatalog;
import org.adseller.server.settings.model.Product;
import org.apache.commons.collections4.ListUtils;
import org.apache.commons.collections4.MapUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@Configuration
public class NegotiationConfiguration {

    @Bean
    CapabilitiesFileReader capabilitiesFileReader(FileSystem fileSystem,
                                                  JacksonMapper jacksonMapper,
                                                  UcpEmbeddingDecoder ucpEmbeddingDecoder) {

        return new CapabilitiesFileReader(fileSystem, jacksonMapper, ucpEmbeddingDecoder);
    }

    @Bean
    InMemoryProductCatalog productCatalog(CapabilitiesFileReader capabilitiesFileReader,
                                          NegotiationConfigurationProperties properties) {

        final List<Product> products = ListUtils.emptyIfNull(properties.getProducts()).stream()
                .map(ProductProperties::toProduct)
                .toList();

        return new InMemoryProductCatalog(
                products, capabilitiesFileReader.read(properties.getCapabilitiesFile(), products));
    }

    @Bean
    InMemoryInventoryLedger inventoryLedger(NegotiationConfigurationProperties properties) {
        return new InMemoryInventoryLedger(ListUtils.emptyIfNull(properties.getProducts()).stream()
                .collect(Collectors.toMap(ProductProperties::getId, ProductProperties::getAvails)));
    }

    @Bean
    DealIdGenerator dealIdGenerator() {
        return new HashDealIdGenerator();
    }

    @Bean
    DecisionPolicies decisionPolicies(NegotiationConfigurationProperties properties) {
        return new DecisionPolicies(
                properties.getDefaultPolicy().toPolicy(),
                MapUtils.emptyIfNull(properties.getPolicies()).entrySet().stream()
                        .collect(Collectors.toMap(Map.Entry::getKey, entry -> entry.getValue().toPolicy())));
    }

    @Bean
    UpsellAdvisor upsellAdvisor(PricingEngine pricingEngine, NegotiationConfigurationProperties properties) {
        return new UpsellAdvisor(pricingEngine, properties.getMaxUpsellProducts());
    }

    @Bean
    ProposalNegotiationService proposalNegotiationService(Vertx vertx,
                                                          Clock clock,
                                                          TimeoutFactory timeoutFactory,
                                                          ProductCatalog productCatalog,
                                                          CoverageValidator coverageValidator,
                                                          PricingEngine pricingEngine,
                                                          DecisionPolicies decisionPolicies,
                                                          UpsellAdvisor upsellAdvisor,
                                                          InventoryLedger inventoryLedger,
                                                          DealIdGenerator dealIdGenerator,
                                                          Metrics metrics,
                                                          NegotiationConfigurationProperties properties) {

        return new ProposalNegotiationService(
                vertx,
                clock,
                timeoutFactory,
                new ProposalValidator(),
                productCatalog,
                coverageValidator,
                pricingEngine,
                new DecisionMaker(pricingEngine),
                decisionPolicies,
                upsellAdvisor,
                inventoryLedger,
                dealIdGenerator,
                metrics,
                properties.getSellerOrgId(),
                properties.getTimeoutMs());
    }

    @Bean
    @ConfigurationProperties(prefix = "negotiation")
    NegotiationConfigurationProperties negotiationConfigurationProperties() {
        return new NegotiationConfigurationProperties();
    }

    @Validated
    @NoArgsConstructor
    @Data
    static class NegotiationConfigurationProperties {

        @NotBlank
        private String sellerOrgId;

        @Positive
        private long timeoutMs = 500L;

        @NotNull
        @Valid
        private PolicyProperties defaultPolicy = new PolicyProperties();

        /**
         * Policies of inventory channels that differ from the default one.
         */
        @Valid
        private Map<String, PolicyProperties> policies;

        @Valid
        private List<ProductProperties> products;

        /**
         * JSON file with capability embeddings of the products, resolved from the file system or classpath.
         */
        private String capabilitiesFile;

        @PositiveOrZero
        private int maxUpsellProducts = 2;
    }

    @NoArgsConstructor
    @Data
    static class PolicyProperties {

        private boolean rejectUnfulfillableAudience = true;

        private boolean counterBelowFloor = true;

        private boolean counterPartialMatch = true;

        DecisionPolicy toPolicy() {
            return DecisionPolicy.builder()
                    .rejectUnfulfillableAudience(rejectUnfulfillableAudience)
                    .counterBelowFloor(counterBelowFloor)
                    .counterPartialMatch(counterPartialMatch)
                    .build();
        }
    }

    @NoArgsConstructor
    @Data
    static class ProductProperties {

        @NotBlank
        private String id;

        private String name;

        @NotNull
        @DecimalMin("0")
        private BigDecimal baseCpm;

        @DecimalMin("0")
        private BigDecimal floorCpm;

        private String inventoryType;

        private Set<String> capabilityTags;

        @PositiveOrZero
        private long avails;

        Product toProduct() {
            return Product.builder()
                    .id(id)
                    .name(name)
                    .baseCpm(baseCpm)
                    .floorCpm(floorCpm)
                    .inventoryType(inventoryType)
                    .capabilityTags(capabilityTags != null ? Set.copyOf(capabilityTags) : Collections.emptySet())
                    .build();
        }
    }
}
