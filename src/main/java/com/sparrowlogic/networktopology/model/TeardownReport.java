package com.sparrowlogic.networktopology.model;

import java.util.ArrayList;
import java.util.List;

/**
 * What a teardown attempted and how each action ended. A report with failures is still a finished
 * teardown; callers that need a clean account inspect {@link #failures()}.
 */
public record TeardownReport(String region, String prefix, List<String> vpcIds, List<StepOutcome> outcomes) {

    public TeardownReport {
        vpcIds = List.copyOf(vpcIds);
        outcomes = List.copyOf(outcomes);
    }

    public boolean topologyFound() {
        return !vpcIds.isEmpty();
    }

    public List<StepOutcome> failures() {
        return outcomes.stream().filter(o -> o.status() == StepOutcome.Status.FAILED).toList();
    }

    public boolean isClean() {
        return failures().isEmpty();
    }

    public List<StepOutcome> outcomesFor(String step) {
        return outcomes.stream().filter(o -> o.step().equals(step)).toList();
    }

    public static Builder builder(String region, String prefix) {
        return new Builder(region, prefix);
    }

    public static final class Builder {
        private final String region;
        private final String prefix;
        private final List<String> vpcIds = new ArrayList<>();
        private final List<StepOutcome> outcomes = new ArrayList<>();

        private Builder(String region, String prefix) {
            this.region = region;
            this.prefix = prefix;
        }

        public Builder vpc(String vpcId) {
            vpcIds.add(vpcId);
            return this;
        }

        public Builder record(StepOutcome outcome) {
            outcomes.add(outcome);
            return this;
        }

        public TeardownReport build() {
            return new TeardownReport(region, prefix, vpcIds, outcomes);
        }
    }
}
