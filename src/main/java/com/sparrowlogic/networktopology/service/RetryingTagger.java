package com.sparrowlogic.networktopology.service;

import com.sparrowlogic.networktopology.cloud.CloudClient;
import com.sparrowlogic.networktopology.cloud.CloudClientException;
import com.sparrowlogic.networktopology.model.ResourceRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Sets the {@code Name} label on a freshly created resource. The tagging endpoint may not know a new
 * ID yet, so those not-found codes are retried with a linearly growing delay. Anything else, or
 * running out of attempts, propagates: teardown and collect find a topology only by its labels.
 */
public class RetryingTagger {

    private static final Logger logger = LoggerFactory.getLogger(RetryingTagger.class);

    static final Set<String> NOT_YET_VISIBLE = Set.of(
        "InvalidVpcID.NotFound",
        "InvalidSubnetID.NotFound",
        "InvalidRouteTableID.NotFound",
        "InvalidInternetGatewayID.NotFound",
        "InvalidGroup.NotFound",
        "InvalidNatGatewayID.NotFound",
        "InvalidAllocationID.NotFound",
        "InvalidInstanceID.NotFound"
    );

    private final CloudClient cloud;
    private final int maxAttempts;
    private final Duration baseDelay;
    private final Consumer<Duration> pause;

    public RetryingTagger(CloudClient cloud, int maxAttempts, Duration baseDelay) {
        this(cloud, maxAttempts, baseDelay, RetryingTagger::sleep);
    }

    RetryingTagger(CloudClient cloud, int maxAttempts, Duration baseDelay, Consumer<Duration> pause) {
        this.cloud = cloud;
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.pause = pause;
    }

    public void tagName(String resourceId, String name) {
        for (int attempt = 0; ; attempt++) {
            try {
                cloud.tag(resourceId, ResourceRole.NAME_TAG, name);
                return;
            } catch (CloudClientException e) {
                if (!isNotYetVisible(e) || attempt >= maxAttempts - 1) {
                    throw e;
                }
                var delay = baseDelay.multipliedBy(1 + attempt);
                logger.warn("{} not visible for tagging yet ({}), retry {} in {} ms",
                    resourceId, e.errorCode(), attempt + 1, delay.toMillis());
                pause.accept(delay);
            }
        }
    }

    private static boolean isNotYetVisible(CloudClientException e) {
        return e.errorCode() != null && NOT_YET_VISIBLE.contains(e.errorCode());
    }

    private static void sleep(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CloudClientException("CreateTags", null, "interrupted while waiting to retry", e);
        }
    }
}
