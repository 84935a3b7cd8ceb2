package com.sparrowlogic.networktopology.exception;

import java.util.List;

public class AmbiguousTopologyException extends RuntimeException {

    private final List<String> vpcIds;

    public AmbiguousTopologyException(String region, String vpcName, List<String> vpcIds) {
        super(vpcIds.size() + " VPCs are tagged '" + vpcName + "' in region " + region + ": " + vpcIds);
        this.vpcIds = List.copyOf(vpcIds);
    }

    public List<String> vpcIds() {
        return vpcIds;
    }
}
