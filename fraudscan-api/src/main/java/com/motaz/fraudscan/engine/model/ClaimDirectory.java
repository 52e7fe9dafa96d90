package com.motaz.fraudscan.engine.model;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.function.BinaryOperator;

/**
 * Display names looked up while building alerts. A provider seen with
 * several names or states resolves to the greatest value so the lookup
 * does not depend on record order.
 */
public final class ClaimDirectory {

    private static final BinaryOperator<String> GREATEST = (a, b) -> a.compareTo(b) >= 0 ? a : b;

    private final Map<String, String> providerNames;
    private final Map<String, String> providerStates;
    private final Map<String, String> procedureDescriptions;

    private ClaimDirectory(Map<String, String> providerNames,
                           Map<String, String> providerStates,
                           Map<String, String> procedureDescriptions) {
        this.providerNames = providerNames;
        this.providerStates = providerStates;
        this.procedureDescriptions = procedureDescriptions;
    }

    public static ClaimDirectory of(Collection<ClaimRecord> records) {
        Map<String, String> names = new HashMap<>();
        Map<String, String> states = new HashMap<>();
        Map<String, String> descriptions = new HashMap<>();
        for (ClaimRecord claim : records) {
            if (claim.getProviderName() != null) {
                names.merge(claim.getProviderId(), claim.getProviderName(), GREATEST);
            }
            states.merge(claim.getProviderId(), claim.getStateCode(), GREATEST);
            if (claim.getProcedureDescription() != null) {
                descriptions.merge(claim.getProcedureCode(), claim.getProcedureDescription(), GREATEST);
            }
        }
        return new ClaimDirectory(Map.copyOf(names), Map.copyOf(states), Map.copyOf(descriptions));
    }

    public String providerName(String providerId) {
        return providerNames.getOrDefault(providerId, providerId);
    }

    public String providerState(String providerId) {
        return providerStates.get(providerId);
    }

    public String procedureDescription(String procedureCode) {
        return procedureDescriptions.getOrDefault(procedureCode, procedureCode);
    }

    public boolean knowsProvider(String providerId) {
        return providerStates.containsKey(providerId);
    }
}
