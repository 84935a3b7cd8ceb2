package com.sparrowlogic.networktopology.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

@ConfigurationProperties(prefix = "topology")
public record TopologyProperties(
    String profile,
    @DefaultValue Network network,
    @DefaultValue Instances instances,
    @DefaultValue Tagging tagging,
    @DefaultValue Waiter waiter,
    @DefaultValue Collect collect
) {

    public record Network(
        @DefaultValue("10.0.0.0/16") String vpcCidr,
        @DefaultValue("10.0.1.0/24") String publicSubnetCidr,
        @DefaultValue("10.0.2.0/24") String privateSubnetCidr,
        @DefaultValue("a") String publicZoneSuffix,
        @DefaultValue("c") String privateZoneSuffix,
        @DefaultValue("0.0.0.0/0") String sshCidr
    ) {}

    public record Instances(
        @DefaultValue("ami-0b09bf4b909f29738") String imageId,
        @DefaultValue("t3.micro") String instanceType,
        String userData
    ) {}

    /**
     * Retry bound for labelling a resource the provider does not show yet. The delay before retry
     * {@code n} (zero based) is {@code (1 + n) * baseDelay}.
     */
    public record Tagging(
        @DefaultValue("5") int maxAttempts,
        @DefaultValue("1s") Duration baseDelay
    ) {}

    public record Waiter(
        @DefaultValue("15s") Duration pollInterval,
        @DefaultValue("40") int natGatewayMaxAttempts,
        @DefaultValue("40") int instanceMaxAttempts
    ) {}

    public record Collect(@DefaultValue(".") String outputDir) {}
}
