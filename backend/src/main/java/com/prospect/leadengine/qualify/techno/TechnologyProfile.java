package com.prospect.leadengine.qualify.techno;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Technology signals observed for one company: detected technology names, the same names grouped by category, and
 * the target provider's managed services that the inspection hinted at.
 */
public record TechnologyProfile(
    List<String> technologies,
    Map<TechCategory, List<String>> categories,
    List<String> targetCloudServices
) {
    private static final TechnologyProfile EMPTY = new TechnologyProfile(List.of(), Map.of(), List.of());

    public TechnologyProfile {
        technologies = technologies == null ? List.of() : List.copyOf(technologies);
        targetCloudServices = targetCloudServices == null ? List.of() : List.copyOf(targetCloudServices);
        if (categories == null || categories.isEmpty()) {
            categories = Map.of();
        } else {
            Map<TechCategory, List<String>> copy = new EnumMap<>(TechCategory.class);
            for (Map.Entry<TechCategory, List<String>> entry : categories.entrySet()) {
                copy.put(entry.getKey(), List.copyOf(entry.getValue()));
            }
            categories = Collections.unmodifiableMap(copy);
        }
    }

    public static TechnologyProfile empty() {
        return EMPTY;
    }

    public int techCount() {
        return technologies.size();
    }

    public boolean isEmpty() {
        return technologies.isEmpty();
    }

    public boolean has(TechCategory category) {
        List<String> names = categories.get(category);
        return names != null && !names.isEmpty();
    }

    public List<String> namesIn(TechCategory category) {
        return categories.getOrDefault(category, List.of());
    }

    public boolean hasCloudProvider() {
        return has(TechCategory.CLOUD_PROVIDER);
    }

    public boolean hasTargetProvider() {
        return namesIn(TechCategory.CLOUD_PROVIDER).contains(TechSignatureCatalog.TARGET_PROVIDER);
    }

    public List<String> competingProviders() {
        List<String> competitors = new ArrayList<>();
        for (String provider : namesIn(TechCategory.CLOUD_PROVIDER)) {
            if (!TechSignatureCatalog.TARGET_PROVIDER.equals(provider)) {
                competitors.add(provider);
            }
        }
        return competitors;
    }

    public boolean hasModernFrontend() {
        for (String name : namesIn(TechCategory.FRONTEND)) {
            if (TechSignatureCatalog.MODERN_FRONTENDS.contains(name)) {
                return true;
            }
        }
        return false;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Set<String> technologies = new LinkedHashSet<>();
        private final Map<TechCategory, Set<String>> categories = new EnumMap<>(TechCategory.class);
        private final Set<String> targetCloudServices = new LinkedHashSet<>();

        private Builder() {
        }

        public Builder add(String technology, TechCategory category) {
            technologies.add(technology);
            categories.computeIfAbsent(category, ignored -> new LinkedHashSet<>()).add(technology);
            return this;
        }

        public Builder addTechnology(String technology) {
            technologies.add(technology);
            return this;
        }

        public Builder addTargetService(String service) {
            targetCloudServices.add(service);
            return this;
        }

        public TechnologyProfile build() {
            Map<TechCategory, List<String>> grouped = new EnumMap<>(TechCategory.class);
            for (Map.Entry<TechCategory, Set<String>> entry : categories.entrySet()) {
                grouped.put(entry.getKey(), new ArrayList<>(entry.getValue()));
            }
            return new TechnologyProfile(
                new ArrayList<>(technologies),
                grouped,
                new ArrayList<>(targetCloudServices)
            );
        }
    }
}
