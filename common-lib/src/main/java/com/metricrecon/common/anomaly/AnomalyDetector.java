package com.metricrecon.common.anomaly;

import com.metricrecon.common.model.AnomalyFinding;
import com.metricrecon.common.model.AnomalySeverity;
import com.metricrecon.common.model.AnomalyType;
import com.metricrecon.common.model.AuditCode;
import com.metricrecon.common.model.AuditEvent;
import com.metricrecon.common.model.BenchmarkRange;
import com.metricrecon.common.model.MetricRange;
import com.metricrecon.common.stats.SeriesStatistics;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Flags a candidate value as suspect using three independent checks. Each check yields at most
 * one finding and findings accumulate.
 *
 * <h3>Checks</h3>
 * <ol>
 *   <li><b>Absolute range</b> — outside the metric's configured {@code [min, max]} → HIGH.</li>
 *   <li><b>Trend deviation</b> — with ≥ {@value #MIN_HISTORY_POINTS} history points,
 *       {@code z = (v − mean) / stddev}: {@code |z| > 3} → HIGH, {@code 2 < |z| ≤ 3} → MEDIUM.
 *       Zero stddev yields no finding.</li>
 *   <li><b>Peer deviation</b> — outside the industry benchmark widened by
 *       {@code tolerance × (max − min)} on both sides → MEDIUM.</li>
 * </ol>
 *
 * <p>A check that cannot run is not a failure; it is reported through {@link AnomalyReport#skipped()}
 * so the resolved record shows the gap. This class is stateless and thread-safe.
 */
public final class AnomalyDetector {

    public static final int    MIN_HISTORY_POINTS = 3;
    public static final double Z_HIGH             = 3.0;
    public static final double Z_MEDIUM           = 2.0;
    public static final double DEFAULT_PEER_TOLERANCE = 0.25;

    private final MetricRangeTable ranges;
    private final double peerTolerance;

    public AnomalyDetector(MetricRangeTable ranges, double peerTolerance) {
        if (!(peerTolerance >= 0.0)) {
            throw new IllegalArgumentException("peer tolerance must be non-negative: " + peerTolerance);
        }
        this.ranges        = ranges;
        this.peerTolerance = peerTolerance;
    }

    public AnomalyDetector(MetricRangeTable ranges) {
        this(ranges, DEFAULT_PEER_TOLERANCE);
    }

    public AnomalyReport detect(String metricName, double candidate,
                                List<Double> history, BenchmarkRange benchmark) {
        List<AnomalyFinding> findings = new ArrayList<>();
        List<AuditEvent> skipped = new ArrayList<>();

        Optional<MetricRange> range = ranges.rangeFor(metricName);
        if (range.isPresent()) {
            checkRange(range.get(), candidate).ifPresent(findings::add);
        } else {
            skipped.add(new AuditEvent(AuditCode.RANGE_CHECK_SKIPPED, "no range configured for " + metricName));
        }

        checkTrend(candidate, history, findings, skipped);
        checkPeer(candidate, benchmark, findings, skipped);

        return new AnomalyReport(findings, skipped);
    }

    private Optional<AnomalyFinding> checkRange(MetricRange r, double candidate) {
        if (r.contains(candidate)) {
            return Optional.empty();
        }
        return Optional.of(new AnomalyFinding(AnomalyType.RANGE, AnomalySeverity.HIGH,
            String.format("value %s outside range [%s, %s]", candidate, r.min(), r.max())));
    }

    private void checkTrend(double candidate, List<Double> history,
                            List<AnomalyFinding> findings, List<AuditEvent> skipped) {
        int points = history == null ? 0 : history.size();
        if (points < MIN_HISTORY_POINTS) {
            skipped.add(new AuditEvent(AuditCode.ANOMALY_DETECTION_DEGRADED,
                String.format("trend check needs %d history points, had %d", MIN_HISTORY_POINTS, points)));
            return;
        }
        double mean   = SeriesStatistics.mean(history);
        double stddev = SeriesStatistics.stddev(history);
        if (stddev == 0.0) {
            skipped.add(new AuditEvent(AuditCode.TREND_CHECK_ZERO_VARIANCE,
                String.format("history of %d points has zero variance (mean=%s)", points, mean)));
            return;
        }
        double z = (candidate - mean) / stddev;
        double absZ = Math.abs(z);
        AnomalySeverity severity = absZ > Z_HIGH ? AnomalySeverity.HIGH
                                 : absZ > Z_MEDIUM ? AnomalySeverity.MEDIUM
                                 : AnomalySeverity.NONE;
        if (severity != AnomalySeverity.NONE) {
            findings.add(new AnomalyFinding(AnomalyType.TREND, severity,
                String.format("z=%.2f mean=%s stddev=%s points=%d", z, mean, stddev, points)));
        }
    }

    private void checkPeer(double candidate, BenchmarkRange benchmark,
                           List<AnomalyFinding> findings, List<AuditEvent> skipped) {
        if (benchmark == null) {
            skipped.add(new AuditEvent(AuditCode.PEER_CHECK_SKIPPED, "no industry benchmark supplied"));
            return;
        }
        double slack = peerTolerance * Math.abs(benchmark.max() - benchmark.min());
        double lower = Math.min(benchmark.min(), benchmark.max()) - slack;
        double upper = Math.max(benchmark.min(), benchmark.max()) + slack;
        if (candidate < lower || candidate > upper) {
            findings.add(new AnomalyFinding(AnomalyType.PEER, AnomalySeverity.MEDIUM,
                String.format("value %s outside benchmark [%s, %s] tolerance=%s",
                    candidate, benchmark.min(), benchmark.max(), peerTolerance)));
        }
    }
}
