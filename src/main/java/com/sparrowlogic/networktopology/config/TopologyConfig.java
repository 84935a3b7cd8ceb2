package com.sparrowlogic.networktopology.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(TopologyProperties.class)
public class TopologyConfig {
}
