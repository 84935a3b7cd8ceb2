package com.sparrowlogic.networktopology.service;

import com.sparrowlogic.networktopology.cloud.CloudClient;
import com.sparrowlogic.networktopology.exception.AmbiguousTopologyException;
import com.sparrowlogic.networktopology.model.ResourceRole;
import com.sparrowlogic.networktopology.model.TopologyHandle;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Finds the live topology for a prefix through its {@code <prefix>-vpc} label, the only link between
 * a prefix and its resources.
 */
@Service
public class TopologyResolver {

    public List<TopologyHandle> resolveAll(CloudClient cloud, String region, String prefix) {
        return cloud.findVpcIdsByName(ResourceRole.VPC.name(prefix)).stream()
            .map(vpcId -> new TopologyHandle(region, prefix, vpcId))
            .toList();
    }

    /**
     * @throws AmbiguousTopologyException if more than one VPC carries the label
     */
    public Optional<TopologyHandle> resolve(CloudClient cloud, String region, String prefix) {
        var handles = resolveAll(cloud, region, prefix);
        if (handles.size() > 1) {
            throw new AmbiguousTopologyException(region, ResourceRole.VPC.name(prefix),
                handles.stream().map(TopologyHandle::vpcId).toList());
        }
        return handles.stream().findFirst();
    }
}
