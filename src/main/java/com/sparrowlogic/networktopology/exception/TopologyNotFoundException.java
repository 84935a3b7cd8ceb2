package com.sparrowlogic.networktopology.exception;

public class TopologyNotFoundException extends RuntimeException {

    public TopologyNotFoundException(String region, String vpcName) {
        super("No VPC with Name tag '" + vpcName + "' found in region " + region + ".");
    }
}
