package com.sparrowlogic.networktopology.cli;

import com.sparrowlogic.networktopology.service.CreateOrchestrator;
import com.sparrowlogic.networktopology.service.TeardownOrchestrator;
import com.sparrowlogic.networktopology.service.TopologyCollector;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Runs {@link TopologyCommand} when the application starts with a subcommand.
 */
@Component
public class TopologyCommandRunner implements CommandLineRunner, ExitCodeGenerator {

    private final CreateOrchestrator createOrchestrator;
    private final TeardownOrchestrator teardownOrchestrator;
    private final TopologyCollector collector;
    private int exitCode;

    public TopologyCommandRunner(CreateOrchestrator createOrchestrator, TeardownOrchestrator teardownOrchestrator,
                                 TopologyCollector collector) {
        this.createOrchestrator = createOrchestrator;
        this.teardownOrchestrator = teardownOrchestrator;
        this.collector = collector;
    }

    @Override
    public void run(String... args) {
        if (!isCommand(args)) {
            return;
        }
        exitCode = TopologyCommand.commandLine(createOrchestrator, teardownOrchestrator, collector).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    public static boolean isCommand(String... args) {
        return args.length > 0 && !args[0].startsWith("-");
    }
}
