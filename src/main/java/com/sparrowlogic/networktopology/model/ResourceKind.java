package com.sparrowlogic.networktopology.model;

public enum ResourceKind {
    VPC,
    SUBNET,
    INTERNET_GATEWAY,
    ELASTIC_IP,
    NAT_GATEWAY,
    ROUTE_TABLE,
    SECURITY_GROUP,
    INSTANCE,
    NETWORK_INTERFACE
}
