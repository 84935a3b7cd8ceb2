package com.sparrowlogic.networktopology.cloud;

/**
 * Opens a {@link CloudClient} scoped to one region.
 */
@FunctionalInterface
public interface CloudClients {

    CloudClient forRegion(String region);
}
