package com.sparrowlogic.networktopology.service;

import com.sparrowlogic.networktopology.cloud.CloudClient;
import com.sparrowlogic.networktopology.cloud.CloudClients;
import com.sparrowlogic.networktopology.model.ResourceGraph;
import com.sparrowlogic.networktopology.model.ResourceKind;
import com.sparrowlogic.networktopology.model.ResourceRole;
import com.sparrowlogic.networktopology.model.TeardownReport;
import com.sparrowlogic.networktopology.model.TopologyResources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.Assert;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;

/**
 * Destroys a topology in reverse dependency order. Every action is best effort: a failure is recorded
 * in the report and the remaining actions and steps still run. Waits sit where a later step needs an
 * asynchronous deletion to have finished.
 */
@Service
public class TeardownOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(TeardownOrchestrator.class);

    public static final String INSTANCES = "instances";
    public static final String NAT_GATEWAYS = "nat-gateways";
    public static final String ADDRESSES = "addresses";
    public static final String INTERNET_GATEWAYS = "internet-gateways";
    public static final String ROUTE_TABLES = "route-tables";
    public static final String SUBNETS = "subnets";
    public static final String SECURITY_GROUPS = "security-groups";
    public static final String VPC = "vpc";

    private final CloudClients clients;
    private final TopologyResolver resolver;
    private final List<TeardownStep> steps;

    public TeardownOrchestrator(CloudClients clients, TopologyResolver resolver) {
        this.clients = clients;
        this.resolver = resolver;
        this.steps = List.of(
            new TeardownStep(INSTANCES, List.of(ResourceKind.INSTANCE), this::terminateInstances),
            new TeardownStep(NAT_GATEWAYS, List.of(ResourceKind.NAT_GATEWAY), this::deleteNatGateways),
            new TeardownStep(ADDRESSES, List.of(ResourceKind.ELASTIC_IP), this::releaseAddresses),
            new TeardownStep(INTERNET_GATEWAYS, List.of(ResourceKind.INTERNET_GATEWAY), this::deleteInternetGateways),
            new TeardownStep(ROUTE_TABLES, List.of(ResourceKind.ROUTE_TABLE), this::cleanRouteTables),
            new TeardownStep(SUBNETS, List.of(ResourceKind.NETWORK_INTERFACE, ResourceKind.SUBNET), this::deleteSubnets),
            new TeardownStep(SECURITY_GROUPS, List.of(ResourceKind.SECURITY_GROUP), this::deleteSecurityGroups),
            new TeardownStep(VPC, List.of(ResourceKind.VPC), this::deleteVpc)
        );
        ResourceGraph.requireTeardownOrder(steps.stream().flatMap(step -> step.kinds().stream()).toList());
    }

    List<TeardownStep> steps() {
        return steps;
    }

    /**
     * Tears down every VPC labelled {@code <prefix>-vpc}. No match is a successful no-op. Individual
     * resource failures never propagate; only failing to look the topology up does.
     */
    public TeardownReport teardown(String region, String prefix) {
        Assert.hasText(region, "region is required");
        Assert.hasText(prefix, "prefix is required");

        var report = TeardownReport.builder(region, prefix);
        try (CloudClient cloud = clients.forRegion(region)) {
            var handles = resolver.resolveAll(cloud, region, prefix);
            if (handles.isEmpty()) {
                logger.info("No VPC found with tag Name={} in {}. Nothing to do.", ResourceRole.VPC.name(prefix), region);
                return report.build();
            }
            if (handles.size() > 1) {
                logger.warn("{} VPCs carry Name={} in {}; tearing down all of them",
                    handles.size(), ResourceRole.VPC.name(prefix), region);
            }
            for (var handle : handles) {
                report.vpc(handle.vpcId());
                logger.info("VPC: {}", handle.vpcId());
                for (TeardownStep step : steps) {
                    logger.info("[{}] teardown step: {}", handle.vpcId(), step.name());
                    step.action().accept(new TeardownContext(cloud, handle, step.name(), report));
                }
            }
        }
        var result = report.build();
        logger.info("teardown complete for {} in {} ({} failed actions)", prefix, region, result.failures().size());
        return result;
    }

    private void terminateInstances(TeardownContext ctx) {
        var instanceIds = ctx.enumerate("instances", () -> ctx.cloud().describeInstances(ctx.vpcId())).stream()
            .filter(instance -> !instance.isTerminated())
            .map(TopologyResources.Instance::id)
            .toList();
        if (instanceIds.isEmpty()) {
            return;
        }
        var ids = String.join(",", instanceIds);
        if (ctx.attempt("terminate instances", ids, () -> ctx.cloud().terminateInstances(instanceIds))) {
            ctx.attempt("wait for instances terminated", ids, () -> ctx.cloud().awaitInstancesTerminated(instanceIds));
        }
    }

    private void deleteNatGateways(TeardownContext ctx) {
        var deleting = new ArrayList<String>();
        for (var natGateway : ctx.enumerate("NAT gateways", () -> ctx.cloud().describeNatGateways(ctx.vpcId()))) {
            if (natGateway.isDeleted()) {
                continue;
            }
            if (ctx.attempt("delete NAT gateway", natGateway.id(), () -> ctx.cloud().deleteNatGateway(natGateway.id()))) {
                deleting.add(natGateway.id());
            }
        }
        if (!deleting.isEmpty()) {
            ctx.attempt("wait for NAT gateways deleted", String.join(",", deleting),
                () -> ctx.cloud().awaitNatGatewaysDeleted(deleting));
        }
    }

    private void releaseAddresses(TeardownContext ctx) {
        var released = new HashSet<String>();
        for (var eni : ctx.enumerate("network interfaces", () -> ctx.cloud().describeNetworkInterfaces(ctx.vpcId()))) {
            var association = eni.association();
            if (association == null || association.publicIp() == null) {
                continue;
            }
            if (association.associationId() != null) {
                ctx.attempt("disassociate address from " + eni.id(), association.associationId(),
                    () -> ctx.cloud().disassociateAddress(association.associationId()));
            }
            if (association.allocationId() != null && released.add(association.allocationId())) {
                ctx.attempt("release address", association.allocationId(),
                    () -> ctx.cloud().releaseAddress(association.allocationId()));
            }
        }
        // a deleted NAT gateway gives its interface back but keeps its allocation
        for (var natGateway : ctx.enumerate("NAT gateways", () -> ctx.cloud().describeNatGateways(ctx.vpcId()))) {
            for (var allocationId : natGateway.allocationIds()) {
                if (released.add(allocationId)) {
                    ctx.attempt("release address", allocationId, () -> ctx.cloud().releaseAddress(allocationId));
                }
            }
        }
        // allocated but never handed to a NAT gateway, e.g. when create stopped before one existed
        var name = ResourceRole.ELASTIC_IP.name(ctx.prefix());
        for (var address : ctx.enumerate("addresses", () -> ctx.cloud().describeAddresses(name))) {
            if (address.isAssociated() || !released.add(address.allocationId())) {
                continue;
            }
            ctx.attempt("release address", address.allocationId(),
                () -> ctx.cloud().releaseAddress(address.allocationId()));
        }
    }

    private void deleteInternetGateways(TeardownContext ctx) {
        for (var igw : ctx.enumerate("internet gateways", () -> ctx.cloud().describeInternetGateways(ctx.vpcId()))) {
            for (var vpcId : igw.attachedVpcIds()) {
                ctx.attempt("detach internet gateway from " + vpcId, igw.id(),
                    () -> ctx.cloud().detachInternetGateway(igw.id(), vpcId));
            }
            ctx.attempt("delete internet gateway", igw.id(), () -> ctx.cloud().deleteInternetGateway(igw.id()));
        }
    }

    private void cleanRouteTables(TeardownContext ctx) {
        for (var routeTable : ctx.enumerate("route tables", () -> ctx.cloud().describeRouteTables(ctx.vpcId()))) {
            for (var association : routeTable.associations()) {
                if (association.main() || association.id() == null) {
                    continue;
                }
                ctx.attempt("disassociate route table " + routeTable.id(), association.id(),
                    () -> ctx.cloud().disassociateRouteTable(association.id()));
            }
            if (routeTable.hasDefaultRoute()) {
                ctx.attempt("delete default route", routeTable.id(),
                    () -> ctx.cloud().deleteRoute(routeTable.id(), TopologyResources.DEFAULT_ROUTE));
            }
            // the main table goes away with the VPC
            if (!routeTable.isMain()) {
                ctx.attempt("delete route table", routeTable.id(), () -> ctx.cloud().deleteRouteTable(routeTable.id()));
            }
        }
    }

    private void deleteSubnets(TeardownContext ctx) {
        for (var subnet : ctx.enumerate("subnets", () -> ctx.cloud().describeSubnets(ctx.vpcId()))) {
            var interfaces = ctx.enumerate("network interfaces in " + subnet.id(),
                () -> ctx.cloud().describeSubnetNetworkInterfaces(subnet.id()));
            for (var eni : interfaces) {
                if (eni.attachment() != null && eni.attachment().isAttached()) {
                    ctx.attempt("detach network interface " + eni.id(), eni.attachment().attachmentId(),
                        () -> ctx.cloud().detachNetworkInterface(eni.attachment().attachmentId(), true));
                }
                ctx.attempt("delete network interface", eni.id(), () -> ctx.cloud().deleteNetworkInterface(eni.id()));
            }
            ctx.attempt("delete subnet", subnet.id(), () -> ctx.cloud().deleteSubnet(subnet.id()));
        }
    }

    private void deleteSecurityGroups(TeardownContext ctx) {
        var groups = ctx.enumerate("security groups", () -> ctx.cloud().describeSecurityGroups(ctx.vpcId())).stream()
            .filter(group -> !group.isDefault())
            .toList();
        // groups other groups still reference can only go once the referencing ones are gone
        var ordered = new ArrayList<>(groups);
        ordered.sort(Comparator.comparing((TopologyResources.SecurityGroup group) -> groups.stream()
            .anyMatch(other -> !other.id().equals(group.id()) && other.references(group.id()))));
        for (var group : ordered) {
            ctx.attempt("delete security group " + group.name(), group.id(),
                () -> ctx.cloud().deleteSecurityGroup(group.id()));
        }
    }

    private void deleteVpc(TeardownContext ctx) {
        ctx.attempt("delete VPC", ctx.vpcId(), () -> ctx.cloud().deleteVpc(ctx.vpcId()));
    }
}
