package com.metricrecon.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ErrorDTO(
    @JsonProperty("error")   String error,
    @JsonProperty("message") String message
) {}
