package com.extractpilot.orchestrator;

import com.extractpilot.orchestrator.config.ExtractPilotProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * To run:
 *   ANTHROPIC_API_KEY=sk-ant-... mvn -pl orchestrator spring-boot:run
 */
@SpringBootApplication
@EnableConfigurationProperties(ExtractPilotProperties.class)
public class ExtractPilotApplication {

    public static void main(String[] args) {
        SpringApplication.run(ExtractPilotApplication.class, args);
    }
}
