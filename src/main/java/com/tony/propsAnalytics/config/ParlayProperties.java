package com.tony.propsAnalytics.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "parlay")
@Data
public class ParlayProperties {
    // --- Mise par défaut ---
    private double defaultStake = 10.0;

    // --- Sélection des jambes ---
    private int rotationAttempts = 5;
    private double edgeWeight = 0.7;
    private double correlationWeight = 0.3;

    // --- Value Play ---
    private double valuePlayMinEdge = 2.0;
}
