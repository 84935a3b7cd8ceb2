package com.sparrowlogic.networktopology.cloud;

import com.sparrowlogic.networktopology.model.InstanceLaunch;
import com.sparrowlogic.networktopology.model.RouteTarget;
import com.sparrowlogic.networktopology.model.SecurityGroupRule;
import com.sparrowlogic.networktopology.model.SecurityGroupRule.SourceKind;
import com.sparrowlogic.networktopology.model.TopologyResources;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.*;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.List;
import java.util.function.Supplier;

/**
 * {@link CloudClient} over the EC2 API.
 */
public class Ec2CloudClient implements CloudClient {

    private final Ec2Client ec2Client;
    private final StateWaiter natGatewayWaiter;
    private final StateWaiter instanceWaiter;

    public Ec2CloudClient(Ec2Client ec2Client, StateWaiter natGatewayWaiter, StateWaiter instanceWaiter) {
        this.ec2Client = ec2Client;
        this.natGatewayWaiter = natGatewayWaiter;
        this.instanceWaiter = instanceWaiter;
    }

    @Override
    public String createVpc(String cidrBlock) {
        return call("CreateVpc", () -> ec2Client.createVpc(
            CreateVpcRequest.builder().cidrBlock(cidrBlock).build()
        ).vpc().vpcId());
    }

    @Override
    public String createSubnet(String vpcId, String cidrBlock, String availabilityZone) {
        return call("CreateSubnet", () -> ec2Client.createSubnet(
            CreateSubnetRequest.builder()
                .vpcId(vpcId)
                .cidrBlock(cidrBlock)
                .availabilityZone(availabilityZone)
                .build()
        ).subnet().subnetId());
    }

    @Override
    public void enableAutoAssignPublicIp(String subnetId) {
        run("ModifySubnetAttribute", () -> ec2Client.modifySubnetAttribute(
            ModifySubnetAttributeRequest.builder()
                .subnetId(subnetId)
                .mapPublicIpOnLaunch(AttributeBooleanValue.builder().value(true).build())
                .build()));
    }

    @Override
    public String createInternetGateway() {
        return call("CreateInternetGateway", () -> ec2Client.createInternetGateway(
            CreateInternetGatewayRequest.builder().build()
        ).internetGateway().internetGatewayId());
    }

    @Override
    public void attachInternetGateway(String internetGatewayId, String vpcId) {
        run("AttachInternetGateway", () -> ec2Client.attachInternetGateway(
            AttachInternetGatewayRequest.builder().internetGatewayId(internetGatewayId).vpcId(vpcId).build()));
    }

    @Override
    public String allocateAddress() {
        return call("AllocateAddress", () -> ec2Client.allocateAddress(
            AllocateAddressRequest.builder().domain(DomainType.VPC).build()
        ).allocationId());
    }

    @Override
    public String createNatGateway(String subnetId, String allocationId) {
        return call("CreateNatGateway", () -> ec2Client.createNatGateway(
            CreateNatGatewayRequest.builder().subnetId(subnetId).allocationId(allocationId).build()
        ).natGateway().natGatewayId());
    }

    @Override
    public String createRouteTable(String vpcId) {
        return call("CreateRouteTable", () -> ec2Client.createRouteTable(
            CreateRouteTableRequest.builder().vpcId(vpcId).build()
        ).routeTable().routeTableId());
    }

    @Override
    public String associateRouteTable(String routeTableId, String subnetId) {
        return call("AssociateRouteTable", () -> ec2Client.associateRouteTable(
            AssociateRouteTableRequest.builder().routeTableId(routeTableId).subnetId(subnetId).build()
        ).associationId());
    }

    @Override
    public void createRoute(String routeTableId, String destinationCidr, RouteTarget target) {
        var request = CreateRouteRequest.builder()
            .routeTableId(routeTableId)
            .destinationCidrBlock(destinationCidr);
        if (target.kind() == RouteTarget.Kind.NAT_GATEWAY) {
            request.natGatewayId(target.id());
        } else {
            request.gatewayId(target.id());
        }
        run("CreateRoute", () -> ec2Client.createRoute(request.build()));
    }

    @Override
    public String createSecurityGroup(String vpcId, String groupName, String description) {
        return call("CreateSecurityGroup", () -> ec2Client.createSecurityGroup(
            CreateSecurityGroupRequest.builder().groupName(groupName).description(description).vpcId(vpcId).build()
        ).groupId());
    }

    @Override
    public void authorizeIngress(String groupId, SecurityGroupRule rule) {
        var permission = IpPermission.builder()
            .ipProtocol(rule.protocol())
            .fromPort(rule.fromPort())
            .toPort(rule.toPort());
        if (rule.isGroupReference()) {
            permission.userIdGroupPairs(UserIdGroupPair.builder().groupId(rule.source()).build());
        } else {
            permission.ipRanges(IpRange.builder().cidrIp(rule.source()).build());
        }
        run("AuthorizeSecurityGroupIngress", () -> ec2Client.authorizeSecurityGroupIngress(
            AuthorizeSecurityGroupIngressRequest.builder().groupId(groupId).ipPermissions(permission.build()).build()));
    }

    @Override
    public String runInstance(InstanceLaunch launch) {
        var tags = launch.tags().entrySet().stream()
            .map(e -> Tag.builder().key(e.getKey()).value(e.getValue()).build())
            .toList();
        var request = RunInstancesRequest.builder()
            .imageId(launch.imageId())
            .instanceType(launch.instanceType())
            .minCount(1)
            .maxCount(1)
            .keyName(launch.keyName())
            .subnetId(launch.subnetId())
            .securityGroupIds(launch.securityGroupId())
            .tagSpecifications(TagSpecification.builder().resourceType(ResourceType.INSTANCE).tags(tags).build());
        if (launch.userData() != null) {
            request.userData(Base64.getEncoder().encodeToString(launch.userData().getBytes(StandardCharsets.UTF_8)));
        }
        return call("RunInstances", () -> ec2Client.runInstances(request.build()).instances().get(0).instanceId());
    }

    @Override
    public void tag(String resourceId, String key, String value) {
        run("CreateTags", () -> ec2Client.createTags(
            CreateTagsRequest.builder()
                .resources(resourceId)
                .tags(Tag.builder().key(key).value(value).build())
                .build()));
    }

    @Override
    public List<String> findVpcIdsByName(String name) {
        var request = DescribeVpcsRequest.builder().filters(filter("tag:Name", name)).build();
        return call("DescribeVpcs", () -> ec2Client.describeVpcs(request).vpcs().stream()
            .map(Vpc::vpcId)
            .toList());
    }

    @Override
    public List<TopologyResources.Instance> describeInstances(String vpcId) {
        var request = DescribeInstancesRequest.builder().filters(filter("vpc-id", vpcId)).build();
        return call("DescribeInstances", () -> ec2Client.describeInstances(request).reservations().stream()
            .flatMap(r -> r.instances().stream())
            .map(i -> new TopologyResources.Instance(
                i.instanceId(),
                i.state() != null ? i.state().nameAsString() : null,
                i.subnetId()
            )).toList());
    }

    @Override
    public List<TopologyResources.NatGateway> describeNatGateways(String vpcId) {
        var request = DescribeNatGatewaysRequest.builder().filter(filter("vpc-id", vpcId)).build();
        return call("DescribeNatGateways", () -> ec2Client.describeNatGateways(request).natGateways().stream()
            .map(Ec2CloudClient::toNatGateway)
            .toList());
    }

    @Override
    public List<TopologyResources.NetworkInterface> describeNetworkInterfaces(String vpcId) {
        return describeNetworkInterfaces(filter("vpc-id", vpcId));
    }

    @Override
    public List<TopologyResources.NetworkInterface> describeSubnetNetworkInterfaces(String subnetId) {
        return describeNetworkInterfaces(filter("subnet-id", subnetId));
    }

    private List<TopologyResources.NetworkInterface> describeNetworkInterfaces(Filter filter) {
        var request = DescribeNetworkInterfacesRequest.builder().filters(filter).build();
        return call("DescribeNetworkInterfaces", () -> ec2Client.describeNetworkInterfaces(request)
            .networkInterfaces().stream()
            .map(eni -> new TopologyResources.NetworkInterface(
                eni.networkInterfaceId(),
                eni.subnetId(),
                eni.association() != null ? new TopologyResources.AddressAssociation(
                    eni.association().associationId(),
                    eni.association().allocationId(),
                    eni.association().publicIp()) : null,
                eni.attachment() != null ? new TopologyResources.Attachment(
                    eni.attachment().attachmentId(),
                    eni.attachment().statusAsString()) : null
            )).toList());
    }

    @Override
    public List<TopologyResources.InternetGateway> describeInternetGateways(String vpcId) {
        var request = DescribeInternetGatewaysRequest.builder().filters(filter("attachment.vpc-id", vpcId)).build();
        return call("DescribeInternetGateways", () -> ec2Client.describeInternetGateways(request)
            .internetGateways().stream()
            .map(igw -> new TopologyResources.InternetGateway(
                igw.internetGatewayId(),
                igw.attachments().stream().map(InternetGatewayAttachment::vpcId).toList()
            )).toList());
    }

    @Override
    public List<TopologyResources.Address> describeAddresses(String name) {
        var request = DescribeAddressesRequest.builder().filters(filter("tag:Name", name)).build();
        return call("DescribeAddresses", () -> ec2Client.describeAddresses(request).addresses().stream()
            .map(address -> new TopologyResources.Address(
                address.allocationId(), address.associationId(), address.publicIp()))
            .toList());
    }

    @Override
    public List<TopologyResources.RouteTable> describeRouteTables(String vpcId) {
        var request = DescribeRouteTablesRequest.builder().filters(filter("vpc-id", vpcId)).build();
        return call("DescribeRouteTables", () -> ec2Client.describeRouteTables(request).routeTables().stream()
            .map(rt -> new TopologyResources.RouteTable(
                rt.routeTableId(),
                rt.associations().stream()
                    .map(a -> new TopologyResources.RouteTableAssociation(
                        a.routeTableAssociationId(),
                        Boolean.TRUE.equals(a.main()),
                        a.subnetId()))
                    .toList(),
                rt.routes().stream()
                    .map(Route::destinationCidrBlock)
                    .filter(cidr -> cidr != null)
                    .toList()
            )).toList());
    }

    @Override
    public List<TopologyResources.Subnet> describeSubnets(String vpcId) {
        var request = DescribeSubnetsRequest.builder().filters(filter("vpc-id", vpcId)).build();
        return call("DescribeSubnets", () -> ec2Client.describeSubnets(request).subnets().stream()
            .map(s -> new TopologyResources.Subnet(s.subnetId(), s.cidrBlock(), s.availabilityZone()))
            .toList());
    }

    @Override
    public List<TopologyResources.SecurityGroup> describeSecurityGroups(String vpcId) {
        var request = DescribeSecurityGroupsRequest.builder().filters(filter("vpc-id", vpcId)).build();
        return call("DescribeSecurityGroups", () -> ec2Client.describeSecurityGroups(request).securityGroups().stream()
            .map(sg -> {
                var rules = new ArrayList<SecurityGroupRule>();
                sg.ipPermissions().forEach(rule -> {
                    rule.ipRanges().forEach(ipRange -> rules.add(toRule(rule, ipRange.cidrIp(), SourceKind.CIDR, "ingress")));
                    rule.userIdGroupPairs().forEach(pair -> rules.add(toRule(rule, pair.groupId(), SourceKind.GROUP, "ingress")));
                });
                sg.ipPermissionsEgress().forEach(rule -> {
                    rule.ipRanges().forEach(ipRange -> rules.add(toRule(rule, ipRange.cidrIp(), SourceKind.CIDR, "egress")));
                    rule.userIdGroupPairs().forEach(pair -> rules.add(toRule(rule, pair.groupId(), SourceKind.GROUP, "egress")));
                });
                return new TopologyResources.SecurityGroup(sg.groupId(), sg.groupName(), List.copyOf(rules));
            }).toList());
    }

    @Override
    public void terminateInstances(Collection<String> instanceIds) {
        run("TerminateInstances", () -> ec2Client.terminateInstances(
            TerminateInstancesRequest.builder().instanceIds(instanceIds).build()));
    }

    @Override
    public void deleteNatGateway(String natGatewayId) {
        run("DeleteNatGateway", () -> ec2Client.deleteNatGateway(
            DeleteNatGatewayRequest.builder().natGatewayId(natGatewayId).build()));
    }

    @Override
    public void disassociateAddress(String associationId) {
        run("DisassociateAddress", () -> ec2Client.disassociateAddress(
            DisassociateAddressRequest.builder().associationId(associationId).build()));
    }

    @Override
    public void releaseAddress(String allocationId) {
        run("ReleaseAddress", () -> ec2Client.releaseAddress(
            ReleaseAddressRequest.builder().allocationId(allocationId).build()));
    }

    @Override
    public void detachInternetGateway(String internetGatewayId, String vpcId) {
        run("DetachInternetGateway", () -> ec2Client.detachInternetGateway(
            DetachInternetGatewayRequest.builder().internetGatewayId(internetGatewayId).vpcId(vpcId).build()));
    }

    @Override
    public void deleteInternetGateway(String internetGatewayId) {
        run("DeleteInternetGateway", () -> ec2Client.deleteInternetGateway(
            DeleteInternetGatewayRequest.builder().internetGatewayId(internetGatewayId).build()));
    }

    @Override
    public void disassociateRouteTable(String associationId) {
        run("DisassociateRouteTable", () -> ec2Client.disassociateRouteTable(
            DisassociateRouteTableRequest.builder().associationId(associationId).build()));
    }

    @Override
    public void deleteRoute(String routeTableId, String destinationCidr) {
        run("DeleteRoute", () -> ec2Client.deleteRoute(
            DeleteRouteRequest.builder().routeTableId(routeTableId).destinationCidrBlock(destinationCidr).build()));
    }

    @Override
    public void deleteRouteTable(String routeTableId) {
        run("DeleteRouteTable", () -> ec2Client.deleteRouteTable(
            DeleteRouteTableRequest.builder().routeTableId(routeTableId).build()));
    }

    @Override
    public void detachNetworkInterface(String attachmentId, boolean force) {
        run("DetachNetworkInterface", () -> ec2Client.detachNetworkInterface(
            DetachNetworkInterfaceRequest.builder().attachmentId(attachmentId).force(force).build()));
    }

    @Override
    public void deleteNetworkInterface(String networkInterfaceId) {
        run("DeleteNetworkInterface", () -> ec2Client.deleteNetworkInterface(
            DeleteNetworkInterfaceRequest.builder().networkInterfaceId(networkInterfaceId).build()));
    }

    @Override
    public void deleteSubnet(String subnetId) {
        run("DeleteSubnet", () -> ec2Client.deleteSubnet(
            DeleteSubnetRequest.builder().subnetId(subnetId).build()));
    }

    @Override
    public void deleteSecurityGroup(String groupId) {
        run("DeleteSecurityGroup", () -> ec2Client.deleteSecurityGroup(
            DeleteSecurityGroupRequest.builder().groupId(groupId).build()));
    }

    @Override
    public void deleteVpc(String vpcId) {
        run("DeleteVpc", () -> ec2Client.deleteVpc(DeleteVpcRequest.builder().vpcId(vpcId).build()));
    }

    @Override
    public void awaitNatGatewaysAvailable(Collection<String> natGatewayIds) {
        var request = DescribeNatGatewaysRequest.builder().natGatewayIds(natGatewayIds).build();
        natGatewayWaiter.await("WaitNatGatewayAvailable", DescribeNatGatewaysResponse.class,
            () -> ec2Client.describeNatGateways(request),
            response -> allInState(response, NatGatewayState.AVAILABLE, natGatewayIds.size()),
            response -> response.natGateways().stream().anyMatch(n -> n.state() == NatGatewayState.FAILED));
    }

    @Override
    public void awaitNatGatewaysDeleted(Collection<String> natGatewayIds) {
        var request = DescribeNatGatewaysRequest.builder().natGatewayIds(natGatewayIds).build();
        natGatewayWaiter.await("WaitNatGatewayDeleted", DescribeNatGatewaysResponse.class,
            () -> ec2Client.describeNatGateways(request),
            response -> response.natGateways().stream().allMatch(n -> n.state() == NatGatewayState.DELETED),
            response -> false);
    }

    @Override
    public void awaitInstancesTerminated(Collection<String> instanceIds) {
        var request = DescribeInstancesRequest.builder().instanceIds(instanceIds).build();
        instanceWaiter.await("WaitInstanceTerminated", DescribeInstancesResponse.class,
            () -> ec2Client.describeInstances(request),
            response -> response.reservations().stream()
                .flatMap(r -> r.instances().stream())
                .allMatch(i -> i.state() != null && i.state().name() == InstanceStateName.TERMINATED),
            response -> false);
    }

    @Override
    public void close() {
        ec2Client.close();
    }

    static CloudClientException translate(String operation, AwsServiceException e) {
        var details = e.awsErrorDetails();
        if (details == null) {
            return new CloudClientException(operation, null, e.getMessage(), e);
        }
        var message = details.errorMessage() != null ? details.errorMessage() : e.getMessage();
        return new CloudClientException(operation, details.errorCode(), message, e);
    }

    private static boolean allInState(DescribeNatGatewaysResponse response, NatGatewayState state, int expected) {
        return response.natGateways().size() >= expected
            && response.natGateways().stream().allMatch(n -> n.state() == state);
    }

    private static TopologyResources.NatGateway toNatGateway(NatGateway natGateway) {
        return new TopologyResources.NatGateway(
            natGateway.natGatewayId(),
            natGateway.stateAsString(),
            natGateway.subnetId(),
            natGateway.natGatewayAddresses().stream()
                .map(NatGatewayAddress::allocationId)
                .filter(id -> id != null)
                .toList());
    }

    private static SecurityGroupRule toRule(IpPermission rule, String source,
                                            SourceKind sourceKind, String direction) {
        return new SecurityGroupRule(
            rule.ipProtocol(),
            rule.fromPort() != null ? rule.fromPort() : 0,
            rule.toPort() != null ? rule.toPort() : 0,
            source,
            sourceKind,
            direction
        );
    }

    private static Filter filter(String name, String value) {
        return Filter.builder().name(name).values(value).build();
    }

    private static <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (AwsServiceException e) {
            throw translate(operation, e);
        } catch (SdkException e) {
            throw new CloudClientException(operation, null, e.getMessage(), e);
        }
    }

    private static void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }
}
