package com.ecocart.ecocart_backend.model;

public enum ScoreDimension {
    ECONOMIC,
    ENVIRONMENTAL,
    SOCIAL
}
