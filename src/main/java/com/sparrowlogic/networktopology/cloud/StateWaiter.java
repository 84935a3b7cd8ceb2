package com.sparrowlogic.networktopology.cloud;

import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.retry.backoff.FixedDelayBackoffStrategy;
import software.amazon.awssdk.core.waiters.Waiter;
import software.amazon.awssdk.core.waiters.WaiterAcceptor;
import software.amazon.awssdk.core.waiters.WaiterOverrideConfiguration;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Polls a describe call until a predicate over the described state holds, bounded by a fixed number
 * of attempts. A not-found error while polling is read as "not visible yet" and polled again.
 */
public class StateWaiter {

    private final WaiterOverrideConfiguration configuration;
    private final int maxAttempts;

    public StateWaiter(Duration pollInterval, int maxAttempts) {
        this.maxAttempts = maxAttempts;
        this.configuration = WaiterOverrideConfiguration.builder()
            .maxAttempts(maxAttempts)
            .backoffStrategy(FixedDelayBackoffStrategy.create(pollInterval))
            .build();
    }

    /**
     * @param operation name used in errors
     * @param describe  the poll; called once per attempt
     * @param reached   true once the target state holds
     * @param failed    true if the state can no longer reach the target
     * @return the last described state
     * @throws WaiterTimeoutException if the attempts run out
     * @throws CloudClientException   if the state failed or polling hit a non-retryable error
     */
    public <T> T await(String operation, Class<T> responseType, Supplier<T> describe,
                       Predicate<T> reached, Predicate<T> failed) {
        Waiter<T> waiter = Waiter.builder(responseType)
            .addAcceptor(WaiterAcceptor.successOnResponseAcceptor(reached.or(failed)))
            .addAcceptor(WaiterAcceptor.retryOnResponseAcceptor(response -> true))
            .addAcceptor(WaiterAcceptor.retryOnExceptionAcceptor(StateWaiter::isNotFound))
            .overrideConfiguration(configuration)
            .build();

        var polls = new AtomicInteger();
        T state;
        try {
            state = waiter.run(() -> {
                polls.incrementAndGet();
                return describe.get();
            }).matched().response()
                .orElseThrow(() -> new CloudClientException(operation, null, "waiter finished without a response", null));
        } catch (AwsServiceException e) {
            throw Ec2CloudClient.translate(operation, e);
        } catch (SdkClientException e) {
            if (e.getCause() instanceof AwsServiceException service) {
                throw Ec2CloudClient.translate(operation, service);
            }
            // the waiter reports exhaustion as a bare client error once every attempt was spent retrying
            if (e.getCause() == null && polls.get() >= maxAttempts) {
                throw new WaiterTimeoutException(operation, e.getMessage(), e);
            }
            throw new CloudClientException(operation, null, e.getMessage(), e);
        }

        if (failed.test(state)) {
            throw new CloudClientException(operation, null, "resource entered a failure state", null);
        }
        return state;
    }

    private static boolean isNotFound(Throwable error) {
        return error instanceof AwsServiceException service
            && service.awsErrorDetails() != null
            && service.awsErrorDetails().errorCode() != null
            && service.awsErrorDetails().errorCode().endsWith("NotFound");
    }
}
