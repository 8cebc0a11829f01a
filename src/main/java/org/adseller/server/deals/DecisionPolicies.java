package org.adseller.server.deals;

import org.apache.commons.collections4.MapUtils;
import org.apache.commons.lang3.StringUtils;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Resolves the {@link DecisionPolicy} of an inventory channel, falling back to the default policy for channels
 * without their own.
 */
public class DecisionPolicies {

    private final DecisionPolicy defaultPolicy;
    private final Map<String, DecisionPolicy> policyByInventoryType;

    public DecisionPolicies(DecisionPolicy defaultPolicy, Map<String, DecisionPolicy> policyByInventoryType) {
        this.defaultPolicy = Objects.requireNonNull(defaultPolicy);
        this.policyByInventoryType = MapUtils.emptyIfNull(policyByInventoryType).entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(entry -> normalize(entry.getKey()), Map.Entry::getValue));
    }

    public static DecisionPolicies defaults() {
        return new DecisionPolicies(DecisionPolicy.defaults(), Map.of());
    }

    public DecisionPolicy forInventoryType(String inventoryType) {
        if (StringUtils.isBlank(inventoryType)) {
            return defaultPolicy;
        }
        return policyByInventoryType.getOrDefault(normalize(inventoryType), defaultPolicy);
    }

    private static String normalize(String inventoryType) {
        return inventoryType.trim().toLowerCase(Locale.ROOT);
    }
}
