package com.survivaladvisor.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Scans the whole {@code com.survivaladvisor} tree so the analysis-engine components are
 * picked up alongside the orchestrator's own beans.
 */
@SpringBootApplication(scanBasePackages = "com.survivaladvisor")
public class AdvisorApplication {

    public static void main(String[] args) {
        SpringApplication.run(AdvisorApplication.class, args);
    }
}
