package com.metricrecon.common.model;

public enum AnomalyType {
    RANGE,
    TREND,
    PEER
}
