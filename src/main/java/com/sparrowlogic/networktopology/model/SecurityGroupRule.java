package com.sparrowlogic.networktopology.model;

public record SecurityGroupRule(
    String protocol,
    int fromPort,
    int toPort,
    String source,
    SourceKind sourceKind,
    String direction
) {
    /**
     * What {@link #source()} names: an address range or another security group.
     */
    public enum SourceKind {
        CIDR,
        GROUP
    }

    public static SecurityGroupRule sshFromCidr(String cidr) {
        return new SecurityGroupRule("tcp", 22, 22, cidr, SourceKind.CIDR, "ingress");
    }

    public static SecurityGroupRule sshFromGroup(String groupId) {
        return new SecurityGroupRule("tcp", 22, 22, groupId, SourceKind.GROUP, "ingress");
    }

    public boolean isGroupReference() {
        return sourceKind == SourceKind.GROUP;
    }
}
