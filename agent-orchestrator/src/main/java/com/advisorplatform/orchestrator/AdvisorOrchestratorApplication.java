package com.advisorplatform.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.r2dbc.repository.config.EnableR2dbcRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "com.advisorplatform")
@EnableR2dbcRepositories(basePackages = "com.advisorplatform.trace.repository")
@EnableScheduling
public class AdvisorOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(AdvisorOrchestratorApplication.class, args);
    }
}
