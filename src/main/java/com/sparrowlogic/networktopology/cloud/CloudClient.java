package com.sparrowlogic.networktopology.cloud;

import com.sparrowlogic.networktopology.model.InstanceLaunch;
import com.sparrowlogic.networktopology.model.RouteTarget;
import com.sparrowlogic.networktopology.model.SecurityGroupRule;
import com.sparrowlogic.networktopology.model.TopologyResources;

import java.util.Collection;
import java.util.List;

/**
 * Resource CRUD, describe calls and blocking waiters against one region of the provider's
 * control plane. Every failure surfaces as a {@link CloudClientException}.
 */
public interface CloudClient extends AutoCloseable {

    String createVpc(String cidrBlock);

    String createSubnet(String vpcId, String cidrBlock, String availabilityZone);

    void enableAutoAssignPublicIp(String subnetId);

    String createInternetGateway();

    void attachInternetGateway(String internetGatewayId, String vpcId);

    String allocateAddress();

    String createNatGateway(String subnetId, String allocationId);

    String createRouteTable(String vpcId);

    String associateRouteTable(String routeTableId, String subnetId);

    void createRoute(String routeTableId, String destinationCidr, RouteTarget target);

    String createSecurityGroup(String vpcId, String groupName, String description);

    void authorizeIngress(String groupId, SecurityGroupRule rule);

    /**
     * Launches a single instance, applying the launch's tags as part of the same call.
     */
    String runInstance(InstanceLaunch launch);

    void tag(String resourceId, String key, String value);

    List<String> findVpcIdsByName(String name);

    List<TopologyResources.Instance> describeInstances(String vpcId);

    List<TopologyResources.NatGateway> describeNatGateways(String vpcId);

    List<TopologyResources.NetworkInterface> describeNetworkInterfaces(String vpcId);

    List<TopologyResources.NetworkInterface> describeSubnetNetworkInterfaces(String subnetId);

    List<TopologyResources.InternetGateway> describeInternetGateways(String vpcId);

    /**
     * Elastic IP allocations carrying the given {@code Name} label. Addresses are not scoped to a VPC,
     * so this is the only way to find one that was allocated but never attached.
     */
    List<TopologyResources.Address> describeAddresses(String name);

    List<TopologyResources.RouteTable> describeRouteTables(String vpcId);

    List<TopologyResources.Subnet> describeSubnets(String vpcId);

    List<TopologyResources.SecurityGroup> describeSecurityGroups(String vpcId);

    void terminateInstances(Collection<String> instanceIds);

    void deleteNatGateway(String natGatewayId);

    void disassociateAddress(String associationId);

    void releaseAddress(String allocationId);

    void detachInternetGateway(String internetGatewayId, String vpcId);

    void deleteInternetGateway(String internetGatewayId);

    void disassociateRouteTable(String associationId);

    void deleteRoute(String routeTableId, String destinationCidr);

    void deleteRouteTable(String routeTableId);

    void detachNetworkInterface(String attachmentId, boolean force);

    void deleteNetworkInterface(String networkInterfaceId);

    void deleteSubnet(String subnetId);

    void deleteSecurityGroup(String groupId);

    void deleteVpc(String vpcId);

    /**
     * Blocks until every gateway is {@code available}. Fails at once if one lands in {@code failed}.
     *
     * @throws WaiterTimeoutException if the waiter's bound is exhausted first
     */
    void awaitNatGatewaysAvailable(Collection<String> natGatewayIds);

    /**
     * Blocks until every gateway is {@code deleted}.
     *
     * @throws WaiterTimeoutException if the waiter's bound is exhausted first
     */
    void awaitNatGatewaysDeleted(Collection<String> natGatewayIds);

    /**
     * Blocks until every instance is {@code terminated}.
     *
     * @throws WaiterTimeoutException if the waiter's bound is exhausted first
     */
    void awaitInstancesTerminated(Collection<String> instanceIds);

    @Override
    default void close() {
    }
}
