package com.sparrowlogic.networktopology.service;

import com.sparrowlogic.networktopology.cloud.CloudClient;
import com.sparrowlogic.networktopology.cloud.CloudClientException;
import com.sparrowlogic.networktopology.cloud.CloudClients;
import com.sparrowlogic.networktopology.config.TopologyProperties;
import com.sparrowlogic.networktopology.exception.ProvisioningException;
import com.sparrowlogic.networktopology.model.InstanceLaunch;
import com.sparrowlogic.networktopology.model.ProvisionedTopology;
import com.sparrowlogic.networktopology.model.ResourceGraph;
import com.sparrowlogic.networktopology.model.ResourceKind;
import com.sparrowlogic.networktopology.model.ResourceRole;
import com.sparrowlogic.networktopology.model.RouteTarget;
import com.sparrowlogic.networktopology.model.SecurityGroupRule;
import com.sparrowlogic.networktopology.model.TopologyResources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.Assert;

import java.util.List;
import java.util.Map;

/**
 * Builds a topology in one forward pass. Steps run strictly in order and the first failure aborts the
 * run; whatever was created before it stays live until a teardown for the same prefix.
 */
@Service
public class CreateOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(CreateOrchestrator.class);

    static final String ROUTE_ALREADY_EXISTS = "RouteAlreadyExists";

    private final CloudClients clients;
    private final TopologyProperties properties;
    private final List<ProvisioningStep> steps;

    public CreateOrchestrator(CloudClients clients, TopologyProperties properties) {
        this.clients = clients;
        this.properties = properties;
        this.steps = List.of(
            new ProvisioningStep("vpc", ResourceKind.VPC, this::createVpc),
            new ProvisioningStep("subnets", ResourceKind.SUBNET, this::createSubnets),
            new ProvisioningStep("internet-gateway", ResourceKind.INTERNET_GATEWAY, this::createInternetGateway),
            new ProvisioningStep("elastic-ip", ResourceKind.ELASTIC_IP, this::allocateAddress),
            new ProvisioningStep("nat-gateway", ResourceKind.NAT_GATEWAY, this::createNatGateway),
            new ProvisioningStep("route-tables", ResourceKind.ROUTE_TABLE, this::configureRouteTables),
            new ProvisioningStep("security-groups", ResourceKind.SECURITY_GROUP, this::createSecurityGroups),
            new ProvisioningStep("instances", ResourceKind.INSTANCE, this::launchInstances)
        );
        ResourceGraph.requireBuildOrder(steps.stream().map(ProvisioningStep::kind).toList());
    }

    List<ProvisioningStep> steps() {
        return steps;
    }

    /**
     * @throws ProvisioningException on the first step that fails, carrying the IDs created before it
     */
    public ProvisionedTopology create(String region, String prefix, String keyName) {
        Assert.hasText(region, "region is required");
        Assert.hasText(prefix, "prefix is required");
        Assert.hasText(keyName, "keyName is required");

        var topology = ProvisionedTopology.builder(region, prefix);
        try (CloudClient cloud = clients.forRegion(region)) {
            var tagging = properties.tagging();
            var context = new ProvisioningContext(region, prefix, keyName, cloud,
                new RetryingTagger(cloud, tagging.maxAttempts(), tagging.baseDelay()), topology);
            for (ProvisioningStep step : steps) {
                logger.info("[{}] create step: {}", prefix, step.name());
                try {
                    step.action().accept(context);
                } catch (RuntimeException e) {
                    logger.error("[{}] create aborted at step {}; created so far: {}",
                        prefix, step.name(), topology.build().resources(), e);
                    throw new ProvisioningException(step.name(), topology.build(), e);
                }
            }
        }
        var created = topology.build();
        logger.info("[{}] create complete in {}: {}", prefix, region, created.resources());
        return created;
    }

    private void createVpc(ProvisioningContext ctx) {
        var vpcId = ctx.cloud().createVpc(properties.network().vpcCidr());
        ctx.topology().put(ResourceRole.VPC, vpcId);
        ctx.tagger().tagName(vpcId, ResourceRole.VPC.name(ctx.prefix()));
        logger.info("VPC: {}", vpcId);
    }

    private void createSubnets(ProvisioningContext ctx) {
        var network = properties.network();
        var vpcId = ctx.topology().require(ResourceRole.VPC);

        var publicSubnet = ctx.cloud().createSubnet(vpcId, network.publicSubnetCidr(),
            ctx.region() + network.publicZoneSuffix());
        ctx.topology().put(ResourceRole.PUBLIC_SUBNET, publicSubnet);
        ctx.tagger().tagName(publicSubnet, ResourceRole.PUBLIC_SUBNET.name(ctx.prefix()));

        var privateSubnet = ctx.cloud().createSubnet(vpcId, network.privateSubnetCidr(),
            ctx.region() + network.privateZoneSuffix());
        ctx.topology().put(ResourceRole.PRIVATE_SUBNET, privateSubnet);
        ctx.tagger().tagName(privateSubnet, ResourceRole.PRIVATE_SUBNET.name(ctx.prefix()));

        ctx.cloud().enableAutoAssignPublicIp(publicSubnet);
        logger.info("Subnets: {} {}", publicSubnet, privateSubnet);
    }

    private void createInternetGateway(ProvisioningContext ctx) {
        var igwId = ctx.cloud().createInternetGateway();
        ctx.topology().put(ResourceRole.INTERNET_GATEWAY, igwId);
        ctx.cloud().attachInternetGateway(igwId, ctx.topology().require(ResourceRole.VPC));
        ctx.tagger().tagName(igwId, ResourceRole.INTERNET_GATEWAY.name(ctx.prefix()));
        logger.info("IGW: {}", igwId);
    }

    private void allocateAddress(ProvisioningContext ctx) {
        var allocationId = ctx.cloud().allocateAddress();
        ctx.topology().put(ResourceRole.ELASTIC_IP, allocationId);
        ctx.tagger().tagName(allocationId, ResourceRole.ELASTIC_IP.name(ctx.prefix()));
        logger.info("EIP: {}", allocationId);
    }

    private void createNatGateway(ProvisioningContext ctx) {
        var natGatewayId = ctx.cloud().createNatGateway(
            ctx.topology().require(ResourceRole.PUBLIC_SUBNET),
            ctx.topology().require(ResourceRole.ELASTIC_IP));
        ctx.topology().put(ResourceRole.NAT_GATEWAY, natGatewayId);
        ctx.tagger().tagName(natGatewayId, ResourceRole.NAT_GATEWAY.name(ctx.prefix()));
        logger.info("NATGW: {} (waiting until available)", natGatewayId);
        ctx.cloud().awaitNatGatewaysAvailable(List.of(natGatewayId));
    }

    private void configureRouteTables(ProvisioningContext ctx) {
        var vpcId = ctx.topology().require(ResourceRole.VPC);

        var mainRouteTable = ctx.cloud().describeRouteTables(vpcId).stream()
            .filter(TopologyResources.RouteTable::isMain)
            .map(TopologyResources.RouteTable::id)
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("No main route table in " + vpcId));
        ctx.topology().put(ResourceRole.MAIN_ROUTE_TABLE, mainRouteTable);
        ctx.tagger().tagName(mainRouteTable, ResourceRole.MAIN_ROUTE_TABLE.name(ctx.prefix()));
        ctx.cloud().associateRouteTable(mainRouteTable, ctx.topology().require(ResourceRole.PUBLIC_SUBNET));
        createDefaultRoute(ctx.cloud(), mainRouteTable,
            RouteTarget.internetGateway(ctx.topology().require(ResourceRole.INTERNET_GATEWAY)));

        var privateRouteTable = ctx.cloud().createRouteTable(vpcId);
        ctx.topology().put(ResourceRole.PRIVATE_ROUTE_TABLE, privateRouteTable);
        ctx.tagger().tagName(privateRouteTable, ResourceRole.PRIVATE_ROUTE_TABLE.name(ctx.prefix()));
        ctx.cloud().associateRouteTable(privateRouteTable, ctx.topology().require(ResourceRole.PRIVATE_SUBNET));
        createDefaultRoute(ctx.cloud(), privateRouteTable,
            RouteTarget.natGateway(ctx.topology().require(ResourceRole.NAT_GATEWAY)));

        logger.info("RouteTables: {} {}", mainRouteTable, privateRouteTable);
    }

    private void createDefaultRoute(CloudClient cloud, String routeTableId, RouteTarget target) {
        try {
            cloud.createRoute(routeTableId, TopologyResources.DEFAULT_ROUTE, target);
        } catch (CloudClientException e) {
            if (!ROUTE_ALREADY_EXISTS.equals(e.errorCode())) {
                throw e;
            }
            logger.warn("Default route already present in {}, keeping it", routeTableId);
        }
    }

    private void createSecurityGroups(ProvisioningContext ctx) {
        var vpcId = ctx.topology().require(ResourceRole.VPC);

        var publicGroupName = ResourceRole.PUBLIC_SECURITY_GROUP.name(ctx.prefix());
        var publicGroup = ctx.cloud().createSecurityGroup(vpcId, publicGroupName, "Public SG");
        ctx.topology().put(ResourceRole.PUBLIC_SECURITY_GROUP, publicGroup);
        ctx.tagger().tagName(publicGroup, publicGroupName);
        ctx.cloud().authorizeIngress(publicGroup, SecurityGroupRule.sshFromCidr(properties.network().sshCidr()));
        logger.info("SecurityGroup Public: {}", publicGroup);

        var privateGroupName = ResourceRole.PRIVATE_SECURITY_GROUP.name(ctx.prefix());
        var privateGroup = ctx.cloud().createSecurityGroup(vpcId, privateGroupName, "Private SG");
        ctx.topology().put(ResourceRole.PRIVATE_SECURITY_GROUP, privateGroup);
        ctx.tagger().tagName(privateGroup, privateGroupName);
        ctx.cloud().authorizeIngress(privateGroup, SecurityGroupRule.sshFromGroup(publicGroup));
        logger.info("SecurityGroup Private: {}", privateGroup);
    }

    private void launchInstances(ProvisioningContext ctx) {
        var publicInstance = ctx.cloud().runInstance(launch(ctx, ResourceRole.PUBLIC_INSTANCE,
            ResourceRole.PUBLIC_SUBNET, ResourceRole.PUBLIC_SECURITY_GROUP));
        ctx.topology().put(ResourceRole.PUBLIC_INSTANCE, publicInstance);

        var privateInstance = ctx.cloud().runInstance(launch(ctx, ResourceRole.PRIVATE_INSTANCE,
            ResourceRole.PRIVATE_SUBNET, ResourceRole.PRIVATE_SECURITY_GROUP));
        ctx.topology().put(ResourceRole.PRIVATE_INSTANCE, privateInstance);

        logger.info("EC2: {} {}", publicInstance, privateInstance);
    }

    private InstanceLaunch launch(ProvisioningContext ctx, ResourceRole role, ResourceRole subnet, ResourceRole group) {
        var instances = properties.instances();
        return new InstanceLaunch(
            instances.imageId(),
            instances.instanceType(),
            ctx.keyName(),
            ctx.topology().require(subnet),
            ctx.topology().require(group),
            instances.userData(),
            Map.of(ResourceRole.NAME_TAG, role.name(ctx.prefix()))
        );
    }
}
