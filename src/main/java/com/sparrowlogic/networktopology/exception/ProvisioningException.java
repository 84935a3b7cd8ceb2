package com.sparrowlogic.networktopology.exception;

import com.sparrowlogic.networktopology.model.ProvisionedTopology;

/**
 * A create step failed. Everything in {@link #partial()} is live and stays live until a teardown
 * for the same prefix runs.
 */
public class ProvisioningException extends RuntimeException {

    private final String step;
    private final ProvisionedTopology partial;

    public ProvisioningException(String step, ProvisionedTopology partial, Throwable cause) {
        super("Create failed at step '" + step + "': " + cause.getMessage(), cause);
        this.step = step;
        this.partial = partial;
    }

    public String step() {
        return step;
    }

    public ProvisionedTopology partial() {
        return partial;
    }
}
