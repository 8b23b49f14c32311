package io.sqlpulse.monitor.controller;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the SQLPulse HTTP controller.
 * Triggers monitoring runs and exposes reports and approval endpoints.
 */
@SpringBootApplication
public class SqlPulseControllerApplication {

    public static void main(String[] args) {
        SpringApplication.run(SqlPulseControllerApplication.class, args);
    }
}
