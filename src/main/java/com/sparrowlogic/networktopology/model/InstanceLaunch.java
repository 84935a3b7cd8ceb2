package com.sparrowlogic.networktopology.model;

import java.util.Map;

public record InstanceLaunch(
    String imageId,
    String instanceType,
    String keyName,
    String subnetId,
    String securityGroupId,
    String userData,
    Map<String, String> tags
) {}
