package com.metricrecon.common.anomaly;

import com.metricrecon.common.exception.InvalidMetricRangeException;
import com.metricrecon.common.model.MetricRange;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Per-metric absolute plausibility bounds. Every range is validated as it is added, so a
 * bad configuration fails while the table is built and never during a resolution.
 */
public final class MetricRangeTable {

    private final Map<String, MetricRange> ranges;

    private MetricRangeTable(Map<String, MetricRange> ranges) {
        this.ranges = Collections.unmodifiableMap(ranges);
    }

    public static MetricRangeTable empty() {
        return new MetricRangeTable(new TreeMap<>());
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<MetricRange> rangeFor(String metricName) {
        return Optional.ofNullable(ranges.get(metricName));
    }

    public int size() {
        return ranges.size();
    }

    public static final class Builder {

        private final Map<String, MetricRange> ranges = new TreeMap<>();

        private Builder() {}

        /**
         * @throws InvalidMetricRangeException when {@code min > max} or either bound is NaN
         */
        public Builder range(String metricName, double min, double max) {
            if (Double.isNaN(min) || Double.isNaN(max) || min > max) {
                throw new InvalidMetricRangeException(metricName, min, max);
            }
            ranges.put(metricName, new MetricRange(metricName, min, max));
            return this;
        }

        public MetricRangeTable build() {
            return new MetricRangeTable(new TreeMap<>(ranges));
        }
    }
}
