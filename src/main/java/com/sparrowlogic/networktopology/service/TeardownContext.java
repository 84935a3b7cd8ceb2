package com.sparrowlogic.networktopology.service;

import com.sparrowlogic.networktopology.cloud.CloudClient;
import com.sparrowlogic.networktopology.cloud.CloudClientException;
import com.sparrowlogic.networktopology.model.StepOutcome;
import com.sparrowlogic.networktopology.model.TeardownReport;
import com.sparrowlogic.networktopology.model.TopologyHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Supplier;

/**
 * Runs the actions of one teardown step on one topology, recording each outcome and never letting
 * a failure escape.
 */
final class TeardownContext {

    private static final Logger logger = LoggerFactory.getLogger(TeardownOrchestrator.class);

    private final CloudClient cloud;
    private final TopologyHandle handle;
    private final String step;
    private final TeardownReport.Builder report;

    TeardownContext(CloudClient cloud, TopologyHandle handle, String step, TeardownReport.Builder report) {
        this.cloud = cloud;
        this.handle = handle;
        this.step = step;
        this.report = report;
    }

    CloudClient cloud() {
        return cloud;
    }

    String vpcId() {
        return handle.vpcId();
    }

    String prefix() {
        return handle.prefix();
    }

    /**
     * @return true if the call succeeded
     */
    boolean attempt(String action, String resourceId, Runnable call) {
        try {
            call.run();
            report.record(StepOutcome.succeeded(step, action, resourceId));
            logger.info("✓ {} {}", action, resourceId);
            return true;
        } catch (CloudClientException e) {
            if (e.isNotFound()) {
                report.record(StepOutcome.notFound(step, action, resourceId, e.getMessage()));
                logger.info("... {} {} -> already gone ({})", action, resourceId, e.errorCode());
            } else {
                report.record(StepOutcome.failed(step, action, resourceId, e.getMessage()));
                logger.error("... {} {} -> {}", action, resourceId, e.getMessage(), e);
            }
            return false;
        } catch (RuntimeException e) {
            report.record(StepOutcome.failed(step, action, resourceId, e.getMessage()));
            logger.error("... {} {} -> {}", action, resourceId, e.getMessage(), e);
            return false;
        }
    }

    /**
     * Lists resources for this step. A failed listing is recorded and yields nothing to act on.
     */
    <T> List<T> enumerate(String what, Supplier<List<T>> describe) {
        try {
            return describe.get();
        } catch (RuntimeException e) {
            report.record(StepOutcome.failed(step, "describe " + what, handle.vpcId(), e.getMessage()));
            logger.error("... describe {} in {} -> {}", what, handle.vpcId(), e.getMessage(), e);
            return List.of();
        }
    }
}
