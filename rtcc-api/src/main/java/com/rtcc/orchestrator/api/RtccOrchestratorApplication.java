package com.rtcc.orchestrator.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application entry point for the RTCC orchestration core.
 */
@SpringBootApplication
public class RtccOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(RtccOrchestratorApplication.class, args);
    }
}
