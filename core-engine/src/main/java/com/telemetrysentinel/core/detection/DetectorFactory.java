package com.telemetrysentinel.core.detection;

import com.telemetrysentinel.core.model.AnalysisMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Factory that creates {@link AnomalyDetector} instances for
 * {@link AnalysisMethod analysis methods}.
 *
 * <p>
 * This is the single point of extension when adding new analysis methods:
 * add the enum constant and create the corresponding detector here.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // utility class, not instantiable
    }

    /**
     * Create a detector for the given method.
     *
     * @param method the analysis method; must not be {@code null}
     * @return a new detector
     * @throws NullPointerException if {@code method} is {@code null}
     */
    public static AnomalyDetector create(AnalysisMethod method) {
        Objects.requireNonNull(method, "AnalysisMethod must not be null");
        return switch (method) {
            case COUNTER -> new CounterSeriesAnalyzer();
            case STATISTICAL -> new DistributionBaselineComparator();
            case DURATION -> new DurationOutlierDetector();
            case GAUGE -> new GaugeSeriesAnalyzer();
            case MONOTONIC -> new MonotonicCounterAnalyzer();
            case ENUM -> new EnumSeriesAnalyzer();
        };
    }

    /**
     * Create one detector per method, in iteration order.
     *
     * @param methods selected methods; must not be {@code null}
     * @return unmodifiable list of detectors
     * @throws NullPointerException if {@code methods} is {@code null}
     */
    public static List<AnomalyDetector> createAll(Collection<AnalysisMethod> methods) {
        Objects.requireNonNull(methods, "Methods must not be null");
        LOG.debug("Creating {} detector(s): {}", methods.size(), methods);
        return methods.stream()
                .map(DetectorFactory::create)
                .toList();
    }
}
