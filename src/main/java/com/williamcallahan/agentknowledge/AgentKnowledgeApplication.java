package com.williamcallahan.agentknowledge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the agent knowledge store service.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class AgentKnowledgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentKnowledgeApplication.class, args);
    }
}
