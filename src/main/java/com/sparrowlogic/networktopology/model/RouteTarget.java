package com.sparrowlogic.networktopology.model;

/**
 * Where a route sends its traffic: an internet gateway or a NAT gateway.
 */
public record RouteTarget(Kind kind, String id) {

    public enum Kind { INTERNET_GATEWAY, NAT_GATEWAY }

    public static RouteTarget internetGateway(String igwId) {
        return new RouteTarget(Kind.INTERNET_GATEWAY, igwId);
    }

    public static RouteTarget natGateway(String natGatewayId) {
        return new RouteTarget(Kind.NAT_GATEWAY, natGatewayId);
    }
}
