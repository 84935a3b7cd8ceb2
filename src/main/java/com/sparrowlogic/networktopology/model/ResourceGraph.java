package com.sparrowlogic.networktopology.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fixed dependency structure among the resource kinds of a topology.
 * <p>
 * Two kinds of edges are kept apart. An ownership edge means the dependent cannot exist without its
 * owner, so it must be created after and removed before it. A reference edge (a route pointing at a
 * gateway) only matters when building: the target has to resolve when the route is inserted, but the
 * provider lets the target go first and leaves a blackhole route behind.
 */
public final class ResourceGraph {

    private static final Map<ResourceKind, Set<ResourceKind>> OWNERS = new EnumMap<>(ResourceKind.class);
    private static final Map<ResourceKind, Set<ResourceKind>> REFERENCES = new EnumMap<>(ResourceKind.class);

    static {
        OWNERS.put(ResourceKind.VPC, EnumSet.noneOf(ResourceKind.class));
        OWNERS.put(ResourceKind.SUBNET, EnumSet.of(ResourceKind.VPC));
        OWNERS.put(ResourceKind.INTERNET_GATEWAY, EnumSet.of(ResourceKind.VPC));
        OWNERS.put(ResourceKind.ELASTIC_IP, EnumSet.noneOf(ResourceKind.class));
        OWNERS.put(ResourceKind.NAT_GATEWAY, EnumSet.of(ResourceKind.SUBNET, ResourceKind.ELASTIC_IP));
        OWNERS.put(ResourceKind.ROUTE_TABLE, EnumSet.of(ResourceKind.VPC, ResourceKind.SUBNET));
        OWNERS.put(ResourceKind.SECURITY_GROUP, EnumSet.of(ResourceKind.VPC));
        OWNERS.put(ResourceKind.INSTANCE, EnumSet.of(ResourceKind.SUBNET, ResourceKind.SECURITY_GROUP));
        OWNERS.put(ResourceKind.NETWORK_INTERFACE, EnumSet.of(ResourceKind.SUBNET, ResourceKind.SECURITY_GROUP));

        for (ResourceKind kind : ResourceKind.values()) {
            REFERENCES.put(kind, EnumSet.noneOf(ResourceKind.class));
        }
        REFERENCES.put(ResourceKind.ROUTE_TABLE, EnumSet.of(ResourceKind.INTERNET_GATEWAY, ResourceKind.NAT_GATEWAY));
    }

    private ResourceGraph() {
    }

    public static Set<ResourceKind> owners(ResourceKind kind) {
        return Collections.unmodifiableSet(OWNERS.get(kind));
    }

    public static Set<ResourceKind> references(ResourceKind kind) {
        return Collections.unmodifiableSet(REFERENCES.get(kind));
    }

    /**
     * A creation order over every kind: owners and reference targets come first, ties broken by
     * declaration order.
     */
    public static List<ResourceKind> buildOrder() {
        var order = new ArrayList<ResourceKind>();
        var remaining = EnumSet.allOf(ResourceKind.class);
        while (!remaining.isEmpty()) {
            ResourceKind next = remaining.stream()
                .filter(kind -> order.containsAll(prerequisites(kind)))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Cycle among " + remaining));
            order.add(next);
            remaining.remove(next);
        }
        return List.copyOf(order);
    }

    /**
     * The reverse of {@link #buildOrder()}, which removes every dependent before its owner.
     */
    public static List<ResourceKind> teardownOrder() {
        var order = new ArrayList<>(buildOrder());
        Collections.reverse(order);
        return List.copyOf(order);
    }

    /**
     * Fails if a kind in {@code sequence} is created before one of its owners or reference targets.
     * Kinds absent from the sequence are assumed to exist already.
     */
    public static void requireBuildOrder(List<ResourceKind> sequence) {
        for (int i = 0; i < sequence.size(); i++) {
            ResourceKind kind = sequence.get(i);
            for (ResourceKind prerequisite : prerequisites(kind)) {
                int at = sequence.indexOf(prerequisite);
                if (at > i) {
                    throw new IllegalStateException(kind + " is built before " + prerequisite);
                }
            }
        }
    }

    /**
     * Fails if a kind in {@code sequence} is removed before something it owns.
     */
    public static void requireTeardownOrder(List<ResourceKind> sequence) {
        for (int i = 0; i < sequence.size(); i++) {
            ResourceKind kind = sequence.get(i);
            for (int j = i + 1; j < sequence.size(); j++) {
                ResourceKind later = sequence.get(j);
                if (later != kind && OWNERS.get(later).contains(kind)) {
                    throw new IllegalStateException(kind + " is removed before " + later);
                }
            }
        }
    }

    private static Set<ResourceKind> prerequisites(ResourceKind kind) {
        var all = EnumSet.copyOf(OWNERS.get(kind));
        all.addAll(REFERENCES.get(kind));
        return all;
    }
}
