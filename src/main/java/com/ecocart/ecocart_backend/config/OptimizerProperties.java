package com.ecocart.ecocart_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "optimizer")
public class OptimizerProperties {

    private int hybridThreshold = 20;
    // Upper bound on items x budget-in-cents for the hybrid entrypoint's DP path.
    private long maxTableCells = 50_000_000L;

    public int getHybridThreshold() {
        return hybridThreshold;
    }

    public void setHybridThreshold(int hybridThreshold) {
        this.hybridThreshold = hybridThreshold;
    }

    public long getMaxTableCells() {
        return maxTableCells;
    }

    public void setMaxTableCells(long maxTableCells) {
        this.maxTableCells = maxTableCells;
    }
}
