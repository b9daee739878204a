package com.stepwise.core.oracle;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "stepwise.oracle")
public class OracleProperties {

    private String model = "";
    private double temperature = 0.0;

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
    }

    public boolean hasModel() {
        return model != null && !model.isBlank();
    }
}
