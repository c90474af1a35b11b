package com.metricrecon.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record BatchResolveRequest(
    @JsonProperty("units") List<ResolveRequest> units
) {}
