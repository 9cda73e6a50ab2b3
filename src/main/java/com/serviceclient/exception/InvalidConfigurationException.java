package com.serviceclient.exception;

public class InvalidConfigurationException extends ServiceClientException {
    private final String configKey;
    private final String configValue;

    public InvalidConfigurationException(String configKey, Object configValue) {
        this(configKey, configValue, null);
    }

    public InvalidConfigurationException(String configKey, Object configValue, String message) {
        super(message != null ? message
            : "Invalid configuration for key '" + configKey + "' with value '" + configValue + "'");
        this.configKey = configKey;
        this.configValue = String.valueOf(configValue);
    }

    public String getConfigKey() {
        return configKey;
    }

    public String getConfigValue() {
        return configValue;
    }
}
