package com.sparrowlogic.networktopology.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Identifiers produced by a create run, keyed by role. A run that aborted part way holds only
 * the roles it reached.
 */
public record ProvisionedTopology(String region, String prefix, Map<ResourceRole, String> resources) {

    public ProvisionedTopology {
        var ordered = new EnumMap<ResourceRole, String>(ResourceRole.class);
        ordered.putAll(resources);
        resources = Collections.unmodifiableMap(ordered);
    }

    public String id(ResourceRole role) {
        return resources.get(role);
    }

    public boolean has(ResourceRole role) {
        return resources.containsKey(role);
    }

    public static Builder builder(String region, String prefix) {
        return new Builder(region, prefix);
    }

    public static final class Builder {
        private final String region;
        private final String prefix;
        private final Map<ResourceRole, String> resources = new LinkedHashMap<>();

        private Builder(String region, String prefix) {
            this.region = region;
            this.prefix = prefix;
        }

        public Builder put(ResourceRole role, String id) {
            resources.put(role, id);
            return this;
        }

        public String require(ResourceRole role) {
            var id = resources.get(role);
            if (id == null) {
                throw new IllegalStateException(role + " has not been created yet");
            }
            return id;
        }

        public ProvisionedTopology build() {
            return new ProvisionedTopology(region, prefix, resources);
        }
    }
}
