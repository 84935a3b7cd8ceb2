package com.sparrowlogic.networktopology.service;

import com.sparrowlogic.networktopology.cloud.CloudClient;
import com.sparrowlogic.networktopology.cloud.CloudClientException;
import com.sparrowlogic.networktopology.cloud.WaiterTimeoutException;
import com.sparrowlogic.networktopology.model.InstanceLaunch;
import com.sparrowlogic.networktopology.model.RouteTarget;
import com.sparrowlogic.networktopology.model.SecurityGroupRule;
import com.sparrowlogic.networktopology.model.TopologyResources;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A single-region control plane held in memory. It refuses the same things the real one refuses
 * (deleting a subnet that still has instances, a VPC that still has subnets, an address a NAT
 * gateway still holds...), which is what makes ordering mistakes show up in tests.
 */
class InMemoryCloudClient implements CloudClient {

    private int sequence;
    private boolean hideNewIdsFromFirstTag;
    private final Set<String> taggedOnce = new HashSet<>();
    private final List<String> calls = new ArrayList<>();

    private final Map<String, Map<String, String>> tags = new HashMap<>();
    private final Set<String> vpcs = new LinkedHashSet<>();
    private final Map<String, SubnetState> subnets = new LinkedHashMap<>();
    private final Map<String, Set<String>> internetGateways = new LinkedHashMap<>();
    private final Map<String, String> addresses = new LinkedHashMap<>();
    private final Map<String, NatState> natGateways = new LinkedHashMap<>();
    private final Map<String, RouteTableState> routeTables = new LinkedHashMap<>();
    private final Map<String, GroupState> groups = new LinkedHashMap<>();
    private final Map<String, InstanceState> instances = new LinkedHashMap<>();
    private final Map<String, EniState> interfaces = new LinkedHashMap<>();

    /**
     * Makes the first tag call on every new ID fail as not found, like a freshly created ID the
     * tagging endpoint does not see yet.
     */
    InMemoryCloudClient hideNewIdsFromFirstTag() {
        this.hideNewIdsFromFirstTag = true;
        return this;
    }

    List<String> calls() {
        return calls;
    }

    /**
     * Everything still alive or billable: terminated instances and deleted NAT gateways excluded.
     */
    Set<String> liveResources() {
        var live = new LinkedHashSet<String>();
        live.addAll(vpcs);
        live.addAll(subnets.keySet());
        live.addAll(internetGateways.keySet());
        live.addAll(addresses.keySet());
        natGateways.values().stream().filter(n -> !"deleted".equals(n.state)).forEach(n -> live.add(n.id));
        live.addAll(routeTables.keySet());
        live.addAll(groups.keySet());
        instances.values().stream().filter(i -> !"terminated".equals(i.state)).forEach(i -> live.add(i.id));
        live.addAll(interfaces.keySet());
        return live;
    }

    String tag(String resourceId, String key) {
        return tags.getOrDefault(resourceId, Map.of()).get(key);
    }

    boolean autoAssignsPublicIp(String subnetId) {
        return subnets.get(subnetId).mapPublicIp;
    }

    List<SecurityGroupRule> rules(String groupId) {
        return groups.get(groupId).rules;
    }

    @Override
    public String createVpc(String cidrBlock) {
        calls.add("createVpc");
        var vpcId = next("vpc");
        vpcs.add(vpcId);
        var main = new RouteTableState(next("rtb"), vpcId);
        main.associations.add(new TopologyResources.RouteTableAssociation(next("rtbassoc"), true, null));
        main.routes.put(cidrBlock, "local");
        routeTables.put(main.id, main);
        var defaultGroup = new GroupState(next("sg"), vpcId, "default");
        groups.put(defaultGroup.id, defaultGroup);
        return vpcId;
    }

    @Override
    public String createSubnet(String vpcId, String cidrBlock, String availabilityZone) {
        calls.add("createSubnet");
        requireVpc(vpcId);
        var subnet = new SubnetState(next("subnet"), vpcId, cidrBlock, availabilityZone);
        subnets.put(subnet.id, subnet);
        return subnet.id;
    }

    @Override
    public void enableAutoAssignPublicIp(String subnetId) {
        calls.add("enableAutoAssignPublicIp");
        requireSubnet(subnetId).mapPublicIp = true;
    }

    @Override
    public String createInternetGateway() {
        calls.add("createInternetGateway");
        var igwId = next("igw");
        internetGateways.put(igwId, new LinkedHashSet<>());
        return igwId;
    }

    @Override
    public void attachInternetGateway(String internetGatewayId, String vpcId) {
        calls.add("attachInternetGateway");
        requireVpc(vpcId);
        var attachments = requireInternetGateway(internetGatewayId);
        if (!attachments.isEmpty()) {
            throw error("AttachInternetGateway", "Resource.AlreadyAssociated", internetGatewayId);
        }
        attachments.add(vpcId);
    }

    @Override
    public String allocateAddress() {
        calls.add("allocateAddress");
        var allocationId = next("eipalloc");
        addresses.put(allocationId, null);
        return allocationId;
    }

    @Override
    public String createNatGateway(String subnetId, String allocationId) {
        calls.add("createNatGateway");
        var subnet = requireSubnet(subnetId);
        if (!addresses.containsKey(allocationId)) {
            throw error("CreateNatGateway", "InvalidAllocationID.NotFound", allocationId);
        }
        var nat = new NatState(next("nat"), subnet.vpcId, subnetId, allocationId);
        natGateways.put(nat.id, nat);
        addresses.put(allocationId, nat.id);
        var eni = new EniState(next("eni"), subnetId, subnet.vpcId, nat.id);
        eni.association = new TopologyResources.AddressAssociation(null, allocationId, "203.0.113." + sequence);
        interfaces.put(eni.id, eni);
        return nat.id;
    }

    @Override
    public String createRouteTable(String vpcId) {
        calls.add("createRouteTable");
        requireVpc(vpcId);
        var table = new RouteTableState(next("rtb"), vpcId);
        table.routes.put("10.0.0.0/16", "local");
        routeTables.put(table.id, table);
        return table.id;
    }

    @Override
    public String associateRouteTable(String routeTableId, String subnetId) {
        calls.add("associateRouteTable");
        var table = requireRouteTable(routeTableId);
        requireSubnet(subnetId);
        boolean taken = routeTables.values().stream()
            .flatMap(t -> t.associations.stream())
            .anyMatch(a -> subnetId.equals(a.subnetId()));
        if (taken) {
            throw error("AssociateRouteTable", "Resource.AlreadyAssociated", subnetId);
        }
        var association = new TopologyResources.RouteTableAssociation(next("rtbassoc"), false, subnetId);
        table.associations.add(association);
        return association.id();
    }

    @Override
    public void createRoute(String routeTableId, String destinationCidr, RouteTarget target) {
        calls.add("createRoute");
        var table = requireRouteTable(routeTableId);
        if (table.routes.containsKey(destinationCidr)) {
            throw error("CreateRoute", "RouteAlreadyExists", destinationCidr);
        }
        if (target.kind() == RouteTarget.Kind.NAT_GATEWAY) {
            var nat = natGateways.get(target.id());
            if (nat == null || !"available".equals(nat.state)) {
                throw error("CreateRoute", "InvalidNatGatewayID.NotFound", target.id());
            }
        } else if (!internetGateways.getOrDefault(target.id(), Set.of()).contains(table.vpcId)) {
            throw error("CreateRoute", "InvalidGatewayID.NotFound", target.id());
        }
        table.routes.put(destinationCidr, target.id());
    }

    @Override
    public String createSecurityGroup(String vpcId, String groupName, String description) {
        calls.add("createSecurityGroup");
        requireVpc(vpcId);
        if (groups.values().stream().anyMatch(g -> g.vpcId.equals(vpcId) && g.name.equals(groupName))) {
            throw error("CreateSecurityGroup", "InvalidGroup.Duplicate", groupName);
        }
        var group = new GroupState(next("sg"), vpcId, groupName);
        groups.put(group.id, group);
        return group.id;
    }

    @Override
    public void authorizeIngress(String groupId, SecurityGroupRule rule) {
        calls.add("authorizeIngress");
        var group = requireGroup(groupId);
        if (rule.isGroupReference()) {
            requireGroup(rule.source());
        }
        group.rules.add(rule);
    }

    @Override
    public String runInstance(InstanceLaunch launch) {
        calls.add("runInstance");
        var subnet = requireSubnet(launch.subnetId());
        var group = requireGroup(launch.securityGroupId());
        if (!group.vpcId.equals(subnet.vpcId)) {
            throw error("RunInstances", "InvalidParameter", launch.securityGroupId());
        }
        var instance = new InstanceState(next("i"), subnet.vpcId, subnet.id, group.id);
        instances.put(instance.id, instance);
        tags.put(instance.id, new HashMap<>(launch.tags()));
        var eni = new EniState(next("eni"), subnet.id, subnet.vpcId, instance.id);
        eni.attachment = new TopologyResources.Attachment(next("eni-attach"), "attached");
        if (subnet.mapPublicIp) {
            eni.association = new TopologyResources.AddressAssociation(null, null, "198.51.100." + sequence);
        }
        interfaces.put(eni.id, eni);
        return instance.id;
    }

    @Override
    public void tag(String resourceId, String key, String value) {
        calls.add("tag");
        if (!exists(resourceId) || (hideNewIdsFromFirstTag && taggedOnce.add(resourceId))) {
            throw error("CreateTags", notFoundCode(resourceId), resourceId);
        }
        tags.computeIfAbsent(resourceId, id -> new HashMap<>()).put(key, value);
    }

    @Override
    public List<String> findVpcIdsByName(String name) {
        calls.add("findVpcIdsByName");
        return vpcs.stream().filter(vpcId -> name.equals(tag(vpcId, "Name"))).toList();
    }

    @Override
    public List<TopologyResources.Instance> describeInstances(String vpcId) {
        calls.add("describeInstances");
        return instances.values().stream()
            .filter(i -> i.vpcId.equals(vpcId))
            .map(i -> new TopologyResources.Instance(i.id, i.state, i.subnetId))
            .toList();
    }

    @Override
    public List<TopologyResources.NatGateway> describeNatGateways(String vpcId) {
        calls.add("describeNatGateways");
        return natGateways.values().stream()
            .filter(n -> n.vpcId.equals(vpcId))
            .map(n -> new TopologyResources.NatGateway(n.id, n.state, n.subnetId, List.of(n.allocationId)))
            .toList();
    }

    @Override
    public List<TopologyResources.NetworkInterface> describeNetworkInterfaces(String vpcId) {
        calls.add("describeNetworkInterfaces");
        return interfaces.values().stream().filter(e -> e.vpcId.equals(vpcId)).map(EniState::view).toList();
    }

    @Override
    public List<TopologyResources.NetworkInterface> describeSubnetNetworkInterfaces(String subnetId) {
        calls.add("describeSubnetNetworkInterfaces");
        return interfaces.values().stream().filter(e -> e.subnetId.equals(subnetId)).map(EniState::view).toList();
    }

    @Override
    public List<TopologyResources.InternetGateway> describeInternetGateways(String vpcId) {
        calls.add("describeInternetGateways");
        return internetGateways.entrySet().stream()
            .filter(e -> e.getValue().contains(vpcId))
            .map(e -> new TopologyResources.InternetGateway(e.getKey(), List.copyOf(e.getValue())))
            .toList();
    }

    @Override
    public List<TopologyResources.Address> describeAddresses(String name) {
        calls.add("describeAddresses");
        return addresses.entrySet().stream()
            .filter(e -> name.equals(tag(e.getKey(), "Name")))
            .map(e -> new TopologyResources.Address(e.getKey(),
                holdsAddress(e.getValue()) ? "eipassoc-" + e.getKey().substring("eipalloc-".length()) : null,
                "203.0.113.1"))
            .toList();
    }

    @Override
    public List<TopologyResources.RouteTable> describeRouteTables(String vpcId) {
        calls.add("describeRouteTables");
        return routeTables.values().stream()
            .filter(t -> t.vpcId.equals(vpcId))
            .map(t -> new TopologyResources.RouteTable(t.id, List.copyOf(t.associations), List.copyOf(t.routes.keySet())))
            .toList();
    }

    @Override
    public List<TopologyResources.Subnet> describeSubnets(String vpcId) {
        calls.add("describeSubnets");
        return subnets.values().stream()
            .filter(s -> s.vpcId.equals(vpcId))
            .map(s -> new TopologyResources.Subnet(s.id, s.cidr, s.zone))
            .toList();
    }

    @Override
    public List<TopologyResources.SecurityGroup> describeSecurityGroups(String vpcId) {
        calls.add("describeSecurityGroups");
        return groups.values().stream()
            .filter(g -> g.vpcId.equals(vpcId))
            .map(g -> new TopologyResources.SecurityGroup(g.id, g.name, List.copyOf(g.rules)))
            .toList();
    }

    @Override
    public void terminateInstances(Collection<String> instanceIds) {
        calls.add("terminateInstances");
        for (var instanceId : instanceIds) {
            if (!instances.containsKey(instanceId)) {
                throw error("TerminateInstances", "InvalidInstanceID.NotFound", instanceId);
            }
        }
        instanceIds.forEach(id -> instances.get(id).state = "shutting-down");
    }

    @Override
    public void deleteNatGateway(String natGatewayId) {
        calls.add("deleteNatGateway");
        var nat = natGateways.get(natGatewayId);
        if (nat == null) {
            throw error("DeleteNatGateway", "NatGatewayNotFound", natGatewayId);
        }
        nat.state = "deleting";
    }

    @Override
    public void disassociateAddress(String associationId) {
        calls.add("disassociateAddress");
        var eni = interfaces.values().stream()
            .filter(e -> e.association != null && associationId.equals(e.association.associationId()))
            .findFirst()
            .orElseThrow(() -> error("DisassociateAddress", "InvalidAssociationID.NotFound", associationId));
        eni.association = null;
    }

    @Override
    public void releaseAddress(String allocationId) {
        calls.add("releaseAddress");
        if (!addresses.containsKey(allocationId)) {
            throw error("ReleaseAddress", "InvalidAllocationID.NotFound", allocationId);
        }
        if (holdsAddress(addresses.get(allocationId))) {
            throw error("ReleaseAddress", "InvalidIPAddress.InUse", allocationId);
        }
        addresses.remove(allocationId);
    }

    @Override
    public void detachInternetGateway(String internetGatewayId, String vpcId) {
        calls.add("detachInternetGateway");
        if (!requireInternetGateway(internetGatewayId).remove(vpcId)) {
            throw error("DetachInternetGateway", "Gateway.NotAttached", internetGatewayId);
        }
    }

    @Override
    public void deleteInternetGateway(String internetGatewayId) {
        calls.add("deleteInternetGateway");
        if (!requireInternetGateway(internetGatewayId).isEmpty()) {
            throw error("DeleteInternetGateway", "DependencyViolation", internetGatewayId);
        }
        internetGateways.remove(internetGatewayId);
    }

    @Override
    public void disassociateRouteTable(String associationId) {
        calls.add("disassociateRouteTable");
        for (var table : routeTables.values()) {
            for (var association : table.associations) {
                if (association.id().equals(associationId)) {
                    if (association.main()) {
                        throw error("DisassociateRouteTable", "InvalidParameterValue", associationId);
                    }
                    table.associations.remove(association);
                    return;
                }
            }
        }
        throw error("DisassociateRouteTable", "InvalidAssociationID.NotFound", associationId);
    }

    @Override
    public void deleteRoute(String routeTableId, String destinationCidr) {
        calls.add("deleteRoute");
        if (requireRouteTable(routeTableId).routes.remove(destinationCidr) == null) {
            throw error("DeleteRoute", "InvalidRoute.NotFound", destinationCidr);
        }
    }

    @Override
    public void deleteRouteTable(String routeTableId) {
        calls.add("deleteRouteTable:" + routeTableId);
        var table = requireRouteTable(routeTableId);
        if (!table.associations.isEmpty()) {
            throw error("DeleteRouteTable", "DependencyViolation", routeTableId);
        }
        routeTables.remove(routeTableId);
    }

    @Override
    public void detachNetworkInterface(String attachmentId, boolean force) {
        calls.add("detachNetworkInterface");
        var eni = interfaces.values().stream()
            .filter(e -> e.attachment != null && attachmentId.equals(e.attachment.attachmentId()))
            .findFirst()
            .orElseThrow(() -> error("DetachNetworkInterface", "InvalidAttachmentID.NotFound", attachmentId));
        eni.attachment = null;
    }

    @Override
    public void deleteNetworkInterface(String networkInterfaceId) {
        calls.add("deleteNetworkInterface");
        var eni = interfaces.get(networkInterfaceId);
        if (eni == null) {
            throw error("DeleteNetworkInterface", "InvalidNetworkInterfaceID.NotFound", networkInterfaceId);
        }
        if (eni.attachment != null) {
            throw error("DeleteNetworkInterface", "InvalidNetworkInterface.InUse", networkInterfaceId);
        }
        interfaces.remove(networkInterfaceId);
    }

    @Override
    public void deleteSubnet(String subnetId) {
        calls.add("deleteSubnet");
        requireSubnet(subnetId);
        boolean busy = instances.values().stream().anyMatch(i -> i.subnetId.equals(subnetId) && !"terminated".equals(i.state))
            || interfaces.values().stream().anyMatch(e -> e.subnetId.equals(subnetId))
            || natGateways.values().stream().anyMatch(n -> n.subnetId.equals(subnetId) && !"deleted".equals(n.state));
        if (busy) {
            throw error("DeleteSubnet", "DependencyViolation", subnetId);
        }
        routeTables.values().forEach(t -> t.associations.removeIf(a -> subnetId.equals(a.subnetId())));
        subnets.remove(subnetId);
    }

    @Override
    public void deleteSecurityGroup(String groupId) {
        calls.add("deleteSecurityGroup");
        var group = requireGroup(groupId);
        if (group.name.equals("default")) {
            throw error("DeleteSecurityGroup", "CannotDelete", groupId);
        }
        boolean referenced = groups.values().stream()
            .anyMatch(g -> g != group && g.rules.stream().anyMatch(r -> r.source().equals(groupId)));
        boolean inUse = instances.values().stream()
            .anyMatch(i -> i.groupId.equals(groupId) && !"terminated".equals(i.state));
        if (referenced || inUse) {
            throw error("DeleteSecurityGroup", "DependencyViolation", groupId);
        }
        groups.remove(groupId);
    }

    @Override
    public void deleteVpc(String vpcId) {
        calls.add("deleteVpc");
        requireVpc(vpcId);
        boolean busy = subnets.values().stream().anyMatch(s -> s.vpcId.equals(vpcId))
            || internetGateways.values().stream().anyMatch(a -> a.contains(vpcId))
            || routeTables.values().stream().anyMatch(t -> t.vpcId.equals(vpcId) && !t.isMain())
            || groups.values().stream().anyMatch(g -> g.vpcId.equals(vpcId) && !g.name.equals("default"));
        if (busy) {
            throw error("DeleteVpc", "DependencyViolation", vpcId);
        }
        routeTables.values().removeIf(t -> t.vpcId.equals(vpcId));
        groups.values().removeIf(g -> g.vpcId.equals(vpcId));
        vpcs.remove(vpcId);
    }

    @Override
    public void awaitNatGatewaysAvailable(Collection<String> natGatewayIds) {
        calls.add("awaitNatGatewaysAvailable");
        for (var id : natGatewayIds) {
            var nat = natGateways.get(id);
            if (nat == null || !"pending".equals(nat.state) && !"available".equals(nat.state)) {
                throw new WaiterTimeoutException("WaitNatGatewayAvailable", id + " never became available", null);
            }
            nat.state = "available";
        }
    }

    @Override
    public void awaitNatGatewaysDeleted(Collection<String> natGatewayIds) {
        calls.add("awaitNatGatewaysDeleted");
        for (var id : natGatewayIds) {
            var nat = natGateways.get(id);
            if (nat == null || !"deleting".equals(nat.state) && !"deleted".equals(nat.state)) {
                throw new WaiterTimeoutException("WaitNatGatewayDeleted", id + " is not being deleted", null);
            }
            nat.state = "deleted";
            interfaces.values().removeIf(e -> id.equals(e.owner));
        }
    }

    @Override
    public void awaitInstancesTerminated(Collection<String> instanceIds) {
        calls.add("awaitInstancesTerminated");
        for (var id : instanceIds) {
            var instance = instances.get(id);
            if (instance == null || !"shutting-down".equals(instance.state) && !"terminated".equals(instance.state)) {
                throw new WaiterTimeoutException("WaitInstanceTerminated", id + " is not terminating", null);
            }
            instance.state = "terminated";
            interfaces.values().removeIf(e -> id.equals(e.owner));
        }
    }

    private String next(String kind) {
        return kind + "-" + String.format("%04d", ++sequence);
    }

    private boolean exists(String id) {
        return vpcs.contains(id) || subnets.containsKey(id) || internetGateways.containsKey(id)
            || addresses.containsKey(id) || natGateways.containsKey(id) || routeTables.containsKey(id)
            || groups.containsKey(id) || instances.containsKey(id) || interfaces.containsKey(id);
    }

    private boolean holdsAddress(String natGatewayId) {
        return natGatewayId != null && natGatewayId.startsWith("nat-") && natGateways.containsKey(natGatewayId)
            && !"deleted".equals(natGateways.get(natGatewayId).state);
    }

    private static String notFoundCode(String id) {
        if (id.startsWith("vpc-")) {
            return "InvalidVpcID.NotFound";
        } else if (id.startsWith("subnet-")) {
            return "InvalidSubnetID.NotFound";
        } else if (id.startsWith("igw-")) {
            return "InvalidInternetGatewayID.NotFound";
        } else if (id.startsWith("rtb-")) {
            return "InvalidRouteTableID.NotFound";
        } else if (id.startsWith("sg-")) {
            return "InvalidGroup.NotFound";
        } else if (id.startsWith("nat-")) {
            return "InvalidNatGatewayID.NotFound";
        } else if (id.startsWith("eipalloc-")) {
            return "InvalidAllocationID.NotFound";
        }
        return "InvalidID";
    }

    private void requireVpc(String vpcId) {
        if (!vpcs.contains(vpcId)) {
            throw error("Vpc", "InvalidVpcID.NotFound", vpcId);
        }
    }

    private SubnetState requireSubnet(String subnetId) {
        var subnet = subnets.get(subnetId);
        if (subnet == null) {
            throw error("Subnet", "InvalidSubnetID.NotFound", subnetId);
        }
        return subnet;
    }

    private Set<String> requireInternetGateway(String igwId) {
        var attachments = internetGateways.get(igwId);
        if (attachments == null) {
            throw error("InternetGateway", "InvalidInternetGatewayID.NotFound", igwId);
        }
        return attachments;
    }

    private RouteTableState requireRouteTable(String routeTableId) {
        var table = routeTables.get(routeTableId);
        if (table == null) {
            throw error("RouteTable", "InvalidRouteTableID.NotFound", routeTableId);
        }
        return table;
    }

    private GroupState requireGroup(String groupId) {
        var group = groups.get(groupId);
        if (group == null) {
            throw error("SecurityGroup", "InvalidGroup.NotFound", groupId);
        }
        return group;
    }

    private static CloudClientException error(String operation, String code, String resourceId) {
        return new CloudClientException(operation, code, code + " (" + resourceId + ")", null);
    }

    private static final class SubnetState {
        final String id;
        final String vpcId;
        final String cidr;
        final String zone;
        boolean mapPublicIp;

        SubnetState(String id, String vpcId, String cidr, String zone) {
            this.id = id;
            this.vpcId = vpcId;
            this.cidr = cidr;
            this.zone = zone;
        }
    }

    private static final class NatState {
        final String id;
        final String vpcId;
        final String subnetId;
        final String allocationId;
        String state = "pending";

        NatState(String id, String vpcId, String subnetId, String allocationId) {
            this.id = id;
            this.vpcId = vpcId;
            this.subnetId = subnetId;
            this.allocationId = allocationId;
        }
    }

    private static final class RouteTableState {
        final String id;
        final String vpcId;
        final List<TopologyResources.RouteTableAssociation> associations = new ArrayList<>();
        final Map<String, String> routes = new LinkedHashMap<>();

        RouteTableState(String id, String vpcId) {
            this.id = id;
            this.vpcId = vpcId;
        }

        boolean isMain() {
            return associations.stream().anyMatch(TopologyResources.RouteTableAssociation::main);
        }
    }

    private static final class GroupState {
        final String id;
        final String vpcId;
        final String name;
        final List<SecurityGroupRule> rules = new ArrayList<>();

        GroupState(String id, String vpcId, String name) {
            this.id = id;
            this.vpcId = vpcId;
            this.name = name;
        }
    }

    private static final class InstanceState {
        final String id;
        final String vpcId;
        final String subnetId;
        final String groupId;
        String state = "running";

        InstanceState(String id, String vpcId, String subnetId, String groupId) {
            this.id = id;
            this.vpcId = vpcId;
            this.subnetId = subnetId;
            this.groupId = groupId;
        }
    }

    private static final class EniState {
        final String id;
        final String subnetId;
        final String vpcId;
        final String owner;
        TopologyResources.AddressAssociation association;
        TopologyResources.Attachment attachment;

        EniState(String id, String subnetId, String vpcId, String owner) {
            this.id = id;
            this.subnetId = subnetId;
            this.vpcId = vpcId;
            this.owner = owner;
        }

        TopologyResources.NetworkInterface view() {
            return new TopologyResources.NetworkInterface(id, subnetId, association, attachment);
        }
    }
}
