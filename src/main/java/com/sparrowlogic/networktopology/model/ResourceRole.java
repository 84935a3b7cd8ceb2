package com.sparrowlogic.networktopology.model;

/**
 * The labelled roles of a topology. Every resource is named {@code <prefix>-<suffix>}.
 */
public enum ResourceRole {
    VPC("vpc"),
    PUBLIC_SUBNET("public-subnet"),
    PRIVATE_SUBNET("private-subnet"),
    INTERNET_GATEWAY("igw"),
    ELASTIC_IP("eip"),
    NAT_GATEWAY("natgw"),
    MAIN_ROUTE_TABLE("main-RTB"),
    PRIVATE_ROUTE_TABLE("rtb-private"),
    PUBLIC_SECURITY_GROUP("sg-public"),
    PRIVATE_SECURITY_GROUP("sg-private"),
    PUBLIC_INSTANCE("ec2-public"),
    PRIVATE_INSTANCE("ec2-private");

    public static final String NAME_TAG = "Name";

    private final String suffix;

    ResourceRole(String suffix) {
        this.suffix = suffix;
    }

    public String suffix() {
        return suffix;
    }

    public String name(String prefix) {
        return prefix + "-" + suffix;
    }
}
