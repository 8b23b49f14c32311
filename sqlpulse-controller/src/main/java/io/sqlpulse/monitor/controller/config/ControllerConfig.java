package io.sqlpulse.monitor.controller.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the SQLPulse controller
 */
@Component
@ConfigurationProperties(prefix = "sqlpulse.controller")
public class ControllerConfig {

    private String settingsFile;
    private String defaultFormat = "json";

    public String getSettingsFile() {
        return settingsFile;
    }

    public void setSettingsFile(String settingsFile) {
        this.settingsFile = settingsFile;
    }

    public String getDefaultFormat() {
        return defaultFormat;
    }

    public void setDefaultFormat(String defaultFormat) {
        this.defaultFormat = defaultFormat;
    }
}
