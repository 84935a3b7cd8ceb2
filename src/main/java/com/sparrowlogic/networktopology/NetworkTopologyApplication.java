package com.sparrowlogic.networktopology;

import com.sparrowlogic.networktopology.cli.TopologyCommandRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

@SpringBootApplication
public class NetworkTopologyApplication {

    public static void main(String[] args) {
        var command = TopologyCommandRunner.isCommand(args);
        var context = new SpringApplicationBuilder(NetworkTopologyApplication.class)
            .web(command ? WebApplicationType.NONE : WebApplicationType.SERVLET)
            .run(args);
        if (command) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
