package com.sparrowlogic.networktopology.cli;

import com.sparrowlogic.networktopology.exception.ProvisioningException;
import com.sparrowlogic.networktopology.model.StepOutcome;
import com.sparrowlogic.networktopology.model.TeardownReport;
import com.sparrowlogic.networktopology.service.CreateOrchestrator;
import com.sparrowlogic.networktopology.service.TeardownOrchestrator;
import com.sparrowlogic.networktopology.service.TopologyCollector;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * Command-line surface: {@code create}, {@code collect} and {@code teardown}.
 * Exit status is 0 on success and 1 when create or collect fails. Teardown exits 0 whatever happens to
 * individual resources, and 1 only when the topology could not be looked up at all.
 */
@Command(
    name = "network-topology",
    description = "Create, export and tear down a prefixed VPC topology",
    mixinStandardHelpOptions = true,
    subcommands = {
        TopologyCommand.Create.class,
        TopologyCommand.Collect.class,
        TopologyCommand.Teardown.class
    }
)
public class TopologyCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand");
    }

    /**
     * Builds a command line whose subcommands run against the given services.
     */
    public static CommandLine commandLine(CreateOrchestrator create, TeardownOrchestrator teardown,
                                          TopologyCollector collector) {
        return new CommandLine(new TopologyCommand(), new CommandLine.IFactory() {
            @Override
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == Create.class) {
                    return cls.cast(new Create(create));
                }
                if (cls == Collect.class) {
                    return cls.cast(new Collect(collector));
                }
                if (cls == Teardown.class) {
                    return cls.cast(new Teardown(teardown));
                }
                return CommandLine.defaultFactory().create(cls);
            }
        });
    }

    @Command(name = "create", description = "Create the whole stack")
    static class Create implements Callable<Integer> {

        private final CreateOrchestrator orchestrator;

        @Spec
        CommandSpec spec;

        @Option(names = "--region", required = true)
        String region;

        @Option(names = "--prefix", required = true, description = "Name prefix for all resources (e.g. fang)")
        String prefix;

        @Option(names = "--key-name", required = true, description = "Existing EC2 key pair name")
        String keyName;

        Create(CreateOrchestrator orchestrator) {
            this.orchestrator = orchestrator;
        }

        @Override
        public Integer call() {
            var out = spec.commandLine().getOut();
            try {
                var topology = orchestrator.create(region, prefix, keyName);
                topology.resources().forEach((role, id) -> out.println(role.name(prefix) + ": " + id));
                out.flush();
                return 0;
            } catch (ProvisioningException e) {
                var err = spec.commandLine().getErr();
                err.println("✗ " + e.getMessage());
                e.partial().resources().forEach((role, id) -> err.println("  still live: " + role.name(prefix) + ": " + id));
                err.println("  run teardown --region " + region + " --prefix " + prefix + " to clean up");
                err.flush();
                return 1;
            }
        }
    }

    @Command(name = "collect", description = "Export JSON snapshots of the stack")
    static class Collect implements Callable<Integer> {

        private final TopologyCollector collector;

        @Spec
        CommandSpec spec;

        @Option(names = "--region", required = true)
        String region;

        @Option(names = "--prefix", required = true)
        String prefix;

        Collect(TopologyCollector collector) {
            this.collector = collector;
        }

        @Override
        public Integer call() {
            try {
                var out = spec.commandLine().getOut();
                collector.collect(region, prefix).forEach(file -> out.println("Saved: " + file));
                out.flush();
                return 0;
            } catch (RuntimeException e) {
                spec.commandLine().getErr().println("✗ " + e.getMessage());
                spec.commandLine().getErr().flush();
                return 1;
            }
        }
    }

    @Command(name = "teardown", description = "Destroy all resources created for the prefix")
    static class Teardown implements Callable<Integer> {

        private final TeardownOrchestrator orchestrator;

        @Spec
        CommandSpec spec;

        @Option(names = "--region", required = true)
        String region;

        @Option(names = "--prefix", required = true)
        String prefix;

        Teardown(TeardownOrchestrator orchestrator) {
            this.orchestrator = orchestrator;
        }

        @Override
        public Integer call() {
            var out = spec.commandLine().getOut();
            TeardownReport report;
            try {
                report = orchestrator.teardown(region, prefix);
            } catch (RuntimeException e) {
                spec.commandLine().getErr().println("✗ could not look up " + prefix + " in " + region + ": "
                    + e.getMessage());
                spec.commandLine().getErr().flush();
                return 1;
            }
            if (!report.topologyFound()) {
                out.println("Nothing to do.");
            }
            for (StepOutcome outcome : report.failures()) {
                out.println("... " + outcome.step() + ": " + outcome.action() + " " + outcome.resourceId()
                    + " -> " + outcome.reason());
            }
            out.println("teardown complete.");
            out.flush();
            return 0;
        }
    }
}
