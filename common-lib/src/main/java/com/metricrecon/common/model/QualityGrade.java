package com.metricrecon.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Letter grade for a resolved record.
 *
 * <pre>
 *   score ≥ 0.9 → A+
 *   score ≥ 0.8 → A
 *   score ≥ 0.7 → B
 *   score ≥ 0.6 → C
 *   otherwise   → D
 * </pre>
 */
public enum QualityGrade {
    A_PLUS("A+", 0.9),
    A("A", 0.8),
    B("B", 0.7),
    C("C", 0.6),
    D("D", 0.0);

    private final String label;
    private final double threshold;

    QualityGrade(String label, double threshold) {
        this.label = label;
        this.threshold = threshold;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static QualityGrade fromScore(double score) {
        for (QualityGrade grade : values()) {
            if (score >= grade.threshold) {
                return grade;
            }
        }
        return D;
    }

    @JsonCreator
    public static QualityGrade fromLabel(String label) {
        for (QualityGrade grade : values()) {
            if (grade.label.equals(label)) {
                return grade;
            }
        }
        throw new IllegalArgumentException("Unknown quality grade: " + label);
    }
}
