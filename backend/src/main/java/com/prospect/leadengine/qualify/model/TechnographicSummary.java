package com.prospect.leadengine.qualify.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What website inspection found for a lead: detected technologies grouped by category, the target provider's
 * managed services it hinted at, and the buying-intent estimate with the points each indicator added.
 */
public record TechnographicSummary(
    Map<String, List<String>> techCategories,
    List<String> targetCloudServices,
    int intentScore,
    String intentUrgency,
    List<IntentIndicator> intentIndicators
) {
    public TechnographicSummary {
        if (techCategories == null || techCategories.isEmpty()) {
            techCategories = Map.of();
        } else {
            Map<String, List<String>> copy = new LinkedHashMap<>();
            for (Map.Entry<String, List<String>> entry : techCategories.entrySet()) {
                copy.put(entry.getKey(), entry.getValue() == null ? List.of() : List.copyOf(entry.getValue()));
            }
            techCategories = Collections.unmodifiableMap(copy);
        }
        targetCloudServices = targetCloudServices == null ? List.of() : List.copyOf(targetCloudServices);
        intentIndicators = intentIndicators == null ? List.of() : List.copyOf(intentIndicators);
    }

    public record IntentIndicator(String reason, int points) {
    }
}
