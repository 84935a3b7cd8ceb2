package com.sparrowlogic.networktopology.cloud;

import com.sparrowlogic.networktopology.config.TopologyProperties;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.sts.StsClient;

/**
 * Builds region-scoped AWS clients. A configured profile wins over the default credentials chain.
 */
@Component
public class AwsClientFactory implements CloudClients {

    private final TopologyProperties properties;

    public AwsClientFactory(TopologyProperties properties) {
        this.properties = properties;
    }

    @Override
    public CloudClient forRegion(String region) {
        return wrap(ec2(region));
    }

    public CloudClient wrap(Ec2Client ec2Client) {
        var waiter = properties.waiter();
        return new Ec2CloudClient(
            ec2Client,
            new StateWaiter(waiter.pollInterval(), waiter.natGatewayMaxAttempts()),
            new StateWaiter(waiter.pollInterval(), waiter.instanceMaxAttempts()));
    }

    public Ec2Client ec2(String region) {
        return Ec2Client.builder()
            .credentialsProvider(credentialsProvider())
            .region(Region.of(region))
            .build();
    }

    public StsClient sts(String region) {
        return StsClient.builder()
            .credentialsProvider(credentialsProvider())
            .region(Region.of(region))
            .build();
    }

    private AwsCredentialsProvider credentialsProvider() {
        return properties.profile() != null ?
            ProfileCredentialsProvider.create(properties.profile()) :
            DefaultCredentialsProvider.create();
    }
}
