package com.ecocart.ecocart_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "list-optimization")
public class ListOptimizationProperties {

    private int parallelism = 4;
    private double swapTolerance = 0.02;
    private double scoreTieMargin = 0.01;
    private double minScoreImprovement = 0.05;

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        this.parallelism = parallelism;
    }

    public double getSwapTolerance() {
        return swapTolerance;
    }

    public void setSwapTolerance(double swapTolerance) {
        this.swapTolerance = swapTolerance;
    }

    public double getScoreTieMargin() {
        return scoreTieMargin;
    }

    public void setScoreTieMargin(double scoreTieMargin) {
        this.scoreTieMargin = scoreTieMargin;
    }

    public double getMinScoreImprovement() {
        return minScoreImprovement;
    }

    public void setMinScoreImprovement(double minScoreImprovement) {
        this.minScoreImprovement = minScoreImprovement;
    }
}
