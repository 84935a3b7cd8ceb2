package com.sparrowlogic.networktopology.model;

/**
 * A live topology resolved from its {@code <prefix>-vpc} label.
 */
public record TopologyHandle(String region, String prefix, String vpcId) {}
