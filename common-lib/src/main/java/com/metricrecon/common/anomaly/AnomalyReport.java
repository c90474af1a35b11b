package com.metricrecon.common.anomaly;

import com.metricrecon.common.model.AnomalyFinding;
import com.metricrecon.common.model.AnomalySeverity;
import com.metricrecon.common.model.AuditEvent;

import java.util.List;

/**
 * Accumulated findings of one detector run plus audit entries for every check that could not run.
 */
public record AnomalyReport(List<AnomalyFinding> findings, List<AuditEvent> skipped) {

    public AnomalyReport {
        findings = List.copyOf(findings);
        skipped  = List.copyOf(skipped);
    }

    public AnomalySeverity maxSeverity() {
        AnomalySeverity max = AnomalySeverity.NONE;
        for (AnomalyFinding f : findings) {
            max = max.max(f.severity());
        }
        return max;
    }
}
