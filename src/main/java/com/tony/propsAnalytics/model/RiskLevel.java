package com.tony.propsAnalytics.model;

public enum RiskLevel { LOW, MEDIUM, HIGH }
