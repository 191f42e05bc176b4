package com.tony.propsAnalytics.model;

public enum TeamSide { HOME, AWAY, UNKNOWN }
