package com.sparrowlogic.networktopology.service;

import com.sparrowlogic.networktopology.cloud.CloudClient;
import com.sparrowlogic.networktopology.model.ProvisionedTopology;

/**
 * State threaded through the create steps: inputs, the open client and the IDs made so far.
 */
record ProvisioningContext(
    String region,
    String prefix,
    String keyName,
    CloudClient cloud,
    RetryingTagger tagger,
    ProvisionedTopology.Builder topology
) {}
