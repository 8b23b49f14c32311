package io.sqlpulse.monitor.controller.config;

import io.sqlpulse.monitor.engine.HealthCheckRunner;
import io.sqlpulse.monitor.engine.MonitorConfig;
import io.sqlpulse.monitor.engine.MonitorSettingsLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;

/**
 * Wires the monitoring engine. Nothing connects to the database until a run is requested.
 */
@Configuration
public class MonitorBeans {

    private static final Logger logger = LoggerFactory.getLogger(MonitorBeans.class);

    @Bean
    public MonitorConfig monitorConfig(ControllerConfig controllerConfig) {
        String settingsFile = controllerConfig.getSettingsFile();
        if (settingsFile == null || settingsFile.isBlank()) {
            logger.info("No settings file configured, using built-in defaults");
            return MonitorConfig.defaults();
        }
        MonitorConfig config = new MonitorSettingsLoader().load(Paths.get(settingsFile)).build();
        logger.info("Monitor configuration: {}", config);
        return config;
    }

    @Bean(destroyMethod = "shutdown")
    public HealthCheckRunner healthCheckRunner(MonitorConfig monitorConfig) {
        return HealthCheckRunner.create(monitorConfig);
    }
}
