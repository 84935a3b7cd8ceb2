package com.sparrowlogic.networktopology.model;

import java.util.List;

/**
 * Described state of the resources that live inside one VPC, as the cloud client reports them.
 */
public final class TopologyResources {

    public static final String DEFAULT_ROUTE = "0.0.0.0/0";

    private TopologyResources() {
    }

    public record Instance(String id, String state, String subnetId) {
        public boolean isTerminated() {
            return "terminated".equals(state);
        }
    }

    public record NatGateway(String id, String state, String subnetId, List<String> allocationIds) {
        public boolean isDeleted() {
            return "deleted".equals(state);
        }
    }

    public record NetworkInterface(String id, String subnetId, AddressAssociation association, Attachment attachment) {}

    public record AddressAssociation(String associationId, String allocationId, String publicIp) {}

    public record Address(String allocationId, String associationId, String publicIp) {
        public boolean isAssociated() {
            return associationId != null;
        }
    }

    public record Attachment(String attachmentId, String status) {
        public boolean isAttached() {
            return "attached".equals(status);
        }
    }

    public record InternetGateway(String id, List<String> attachedVpcIds) {}

    public record RouteTable(String id, List<RouteTableAssociation> associations, List<String> destinationCidrs) {
        public boolean isMain() {
            return associations.stream().anyMatch(RouteTableAssociation::main);
        }

        public boolean hasDefaultRoute() {
            return destinationCidrs.contains(DEFAULT_ROUTE);
        }
    }

    public record RouteTableAssociation(String id, boolean main, String subnetId) {}

    public record Subnet(String id, String cidr, String availabilityZone) {}

    public record SecurityGroup(String id, String name, List<SecurityGroupRule> rules) {
        public boolean isDefault() {
            return "default".equals(name);
        }

        public boolean references(String groupId) {
            return rules.stream().anyMatch(rule -> rule.isGroupReference() && groupId.equals(rule.source()));
        }
    }
}
