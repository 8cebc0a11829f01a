package org.adseller.server.settings;

import io.vertx.core.buffer.Buffer;
import io.vertx.core.file.FileSystem;
import org.adseller.server.audience.UcpEmbeddingDecoder;
import org.adseller.server.audience.model.AudienceCapability;
import org.adseller.server.exception.ConfigurationException;
import org.adseller.server.exception.InvalidEmbeddingException;
import org.adseller.server.json.DecodeException;
import org.adseller.server.json.JacksonMapper;
import org.adseller.server.log.Logger;
import org.adseller.server.log.LoggerFactory;
import org.adseller.server.settings.model.CapabilitiesFile;
import org.adseller.server.settings.model.CapabilityEmbedding;
import org.adseller.server.settings.model.Product;
import org.adseller.server.settings.model.ProductCapabilities;
import org.apache.commons.collections4.ListUtils;
import org.apache.commons.collections4.SetUtils;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Reads the capability embeddings of catalog products from a JSON file.
 * <p>
 * Every entry must refer to a configured product and to one of its capability tags. A declared tag without an
 * embedding is allowed, it is never matched.
 */
public class CapabilitiesFileReader {

    private static final Logger logger = LoggerFactory.getLogger(CapabilitiesFileReader.class);

    private final FileSystem fileSystem;
    private final JacksonMapper jacksonMapper;
    private final UcpEmbeddingDecoder embeddingDecoder;

    public CapabilitiesFileReader(FileSystem fileSystem,
                                  JacksonMapper jacksonMapper,
                                  UcpEmbeddingDecoder embeddingDecoder) {

        this.fileSystem = Objects.requireNonNull(fileSystem);
        this.jacksonMapper = Objects.requireNonNull(jacksonMapper);
        this.embeddingDecoder = Objects.requireNonNull(embeddingDecoder);
    }

    public Map<String, List<AudienceCapability>> read(String fileName, List<Product> products) {
        if (StringUtils.isBlank(fileName)) {
            return Collections.emptyMap();
        }

        final CapabilitiesFile capabilitiesFile = readCapabilitiesFile(fileName);
        final Map<String, Product> productsById = ListUtils.emptyIfNull(products).stream()
                .collect(Collectors.toMap(Product::getId, Function.identity()));

        final Map<String, List<AudienceCapability>> result = new HashMap<>();
        for (ProductCapabilities entry : ListUtils.emptyIfNull(capabilitiesFile.getProducts())) {
            final String productId = entry != null ? entry.getProductId() : null;
            final Product product = productId != null ? productsById.get(productId) : null;
            if (product == null) {
                throw new ConfigurationException(
                        "Capabilities file %s refers to unknown product %s".formatted(fileName, productId));
            }
            if (result.containsKey(productId)) {
                throw new ConfigurationException(
                        "Capabilities file %s lists product %s more than once".formatted(fileName, productId));
            }

            result.put(productId, toCapabilities(fileName, product, ListUtils.emptyIfNull(entry.getCapabilities())));
        }

        productsById.values().forEach(product -> warnOnMissingEmbeddings(product, result.get(product.getId())));

        logger.info("Loaded capability embeddings of {} products from {}", result.size(), fileName);
        return result;
    }

    private CapabilitiesFile readCapabilitiesFile(String fileName) {
        final Buffer buffer = fileSystem.readFileBlocking(fileName);
        try {
            return jacksonMapper.decodeValue(buffer.getBytes(), CapabilitiesFile.class);
        } catch (DecodeException e) {
            throw new ConfigurationException("Couldn't read capabilities file " + fileName, e);
        }
    }

    private List<AudienceCapability> toCapabilities(String fileName,
                                                    Product product,
                                                    List<CapabilityEmbedding> capabilities) {

        final Set<String> declaredTags = SetUtils.emptyIfNull(product.getCapabilityTags());
        final Set<String> seenTags = new HashSet<>();
        final List<AudienceCapability> result = new ArrayList<>();

        for (CapabilityEmbedding capability : capabilities) {
            final String tag = capability != null ? capability.getTag() : null;
            if (!declaredTags.contains(tag)) {
                throw new ConfigurationException("Capabilities file %s: product %s does not declare capability %s"
                        .formatted(fileName, product.getId(), tag));
            }
            if (!seenTags.add(tag)) {
                throw new ConfigurationException("Capabilities file %s: product %s lists capability %s more than once"
                        .formatted(fileName, product.getId(), tag));
            }

            try {
                result.add(AudienceCapability.of(tag, embeddingDecoder.toAudienceEmbedding(capability.getEmbedding())));
            } catch (InvalidEmbeddingException e) {
                throw new ConfigurationException("Capabilities file %s: capability %s of product %s is invalid: %s"
                        .formatted(fileName, tag, product.getId(), e.getMessage()), e);
            }
        }

        return result;
    }

    private static void warnOnMissingEmbeddings(Product product, List<AudienceCapability> capabilities) {
        final Set<String> missing = new TreeSet<>(SetUtils.emptyIfNull(product.getCapabilityTags()));
        ListUtils.emptyIfNull(capabilities).forEach(capability -> missing.remove(capability.getTag()));

        if (!missing.isEmpty()) {
            logger.warn("Product {} declares capabilities {} without embeddings, they are never matched",
                    product.getId(), missing);
        }
    }
}
