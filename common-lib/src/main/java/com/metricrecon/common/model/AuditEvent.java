package com.metricrecon.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AuditEvent(
    @JsonProperty("code")   AuditCode code,
    @JsonProperty("detail") String    detail
) {}
