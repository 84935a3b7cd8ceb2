package com.sparrowlogic.networktopology.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sparrowlogic.networktopology.cloud.AwsClientFactory;
import com.sparrowlogic.networktopology.config.TopologyProperties;
import com.sparrowlogic.networktopology.exception.TopologyNotFoundException;
import com.sparrowlogic.networktopology.model.ResourceRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.Assert;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesRequest;
import software.amazon.awssdk.services.ec2.model.DescribeRouteTablesRequest;
import software.amazon.awssdk.services.ec2.model.DescribeSubnetsRequest;
import software.amazon.awssdk.services.ec2.model.Filter;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.model.GetCallerIdentityRequest;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Exports the state of a topology as JSON snapshots, one file per describe call, named
 * {@code <prefix>-<kind>.json}. Read-only.
 */
@Service
public class TopologyCollector {

    private static final Logger logger = LoggerFactory.getLogger(TopologyCollector.class);

    private final AwsClientFactory clients;
    private final TopologyResolver resolver;
    private final ObjectMapper objectMapper;
    private final TopologyProperties properties;

    public TopologyCollector(AwsClientFactory clients, TopologyResolver resolver, ObjectMapper objectMapper,
                             TopologyProperties properties) {
        this.clients = clients;
        this.resolver = resolver;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * @return the files written, in the order they were written
     * @throws TopologyNotFoundException if no VPC carries {@code <prefix>-vpc}
     */
    public List<Path> collect(String region, String prefix) {
        Assert.hasText(region, "region is required");
        Assert.hasText(prefix, "prefix is required");

        var outputDir = Path.of(properties.collect().outputDir());
        var written = new ArrayList<Path>();
        try (Ec2Client ec2 = clients.ec2(region); StsClient sts = clients.sts(region)) {
            written.add(write(outputDir, prefix, "caller-identity",
                sts.getCallerIdentity(GetCallerIdentityRequest.builder().build())));

            var handle = resolver.resolve(clients.wrap(ec2), region, prefix)
                .orElseThrow(() -> new TopologyNotFoundException(region, ResourceRole.VPC.name(prefix)));
            var byVpc = Filter.builder().name("vpc-id").values(handle.vpcId()).build();

            written.add(write(outputDir, prefix, "instances",
                ec2.describeInstances(DescribeInstancesRequest.builder().filters(byVpc).build())));
            written.add(write(outputDir, prefix, "subnets",
                ec2.describeSubnets(DescribeSubnetsRequest.builder().filters(byVpc).build())));
            written.add(write(outputDir, prefix, "route-tables",
                ec2.describeRouteTables(DescribeRouteTablesRequest.builder().filters(byVpc).build())));
        }
        logger.info("All outputs collected for {} in {}", prefix, region);
        return written;
    }

    private Path write(Path outputDir, String prefix, String kind, Object response) {
        var file = outputDir.resolve(prefix + "-" + kind + ".json");
        try {
            Files.createDirectories(outputDir);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), SdkResponseJson.toTree(response));
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write " + file, e);
        }
        logger.info("Saved: {}", file);
        return file;
    }
}
