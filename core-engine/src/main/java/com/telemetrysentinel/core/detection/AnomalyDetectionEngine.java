package com.telemetrysentinel.core.detection;

import com.telemetrysentinel.core.config.DetectionConfig;
import com.telemetrysentinel.core.config.DetectionOptions;
import com.telemetrysentinel.core.model.AnalysisMethod;
import com.telemetrysentinel.core.model.Anomaly;
import com.telemetrysentinel.core.model.DetectionResult;
import com.telemetrysentinel.core.model.TimeRange;
import com.telemetrysentinel.core.source.TelemetrySource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Combined entry point: runs every selected detector concurrently against one
 * {@link TelemetrySource} and aggregates their output.
 *
 * <h3>Concurrency</h3>
 * <p>
 * Detectors share no mutable state, so each runs as its own task on the
 * engine's executor. Results are merged by {@link AnomalyAggregator}, whose
 * ordering does not depend on completion order.
 * </p>
 *
 * <h3>Failures</h3>
 * <p>
 * A failure of the source inside any detector is re-thrown from
 * {@link #detect(DetectionRequest)} as the original exception, without retry.
 * </p>
 *
 * <p>
 * An engine created with a thread count owns its pool and must be
 * {@link #close() closed}; an engine given an executor leaves it to the caller.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyDetectionEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyDetectionEngine.class);

    private final TelemetrySource source;
    private final ExecutorService executor;
    private final boolean ownsExecutor;

    /**
     * Engine with one worker per analysis method.
     */
    public AnomalyDetectionEngine(TelemetrySource source) {
        this(source, AnalysisMethod.values().length);
    }

    /**
     * Engine with its own fixed pool of daemon workers.
     *
     * @param workerThreads pool size; must be positive
     */
    public AnomalyDetectionEngine(TelemetrySource source, int workerThreads) {
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be >= 1, got: " + workerThreads);
        }
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.executor = Executors.newFixedThreadPool(workerThreads, new WorkerThreadFactory());
        this.ownsExecutor = true;
    }

    /**
     * Engine on a caller-managed executor.
     */
    public AnomalyDetectionEngine(TelemetrySource source, ExecutorService executor) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.ownsExecutor = false;
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Run the configured methods over the given analysis window.
     *
     * @see #detect(DetectionRequest)
     */
    public DetectionResult detect(DetectionConfig config, TimeRange analysisRange) {
        return detect(DetectionRequest.fromConfig(config, analysisRange));
    }

    /**
     * Run every selected method and aggregate the anomalies.
     *
     * @param request windows, subjects and options
     * @return ranked and grouped result
     * @throws RuntimeException whatever the source threw, unchanged
     */
    public DetectionResult detect(DetectionRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        DetectionOptions options = request.getOptions();
        List<AnomalyDetector> detectors = DetectorFactory.createAll(options.resolveMethods());
        long started = System.nanoTime();

        List<CompletableFuture<List<Anomaly>>> futures = new ArrayList<>(detectors.size());
        for (AnomalyDetector detector : detectors) {
            futures.add(CompletableFuture.supplyAsync(() -> runDetector(detector, request), executor));
        }

        List<List<Anomaly>> batches = new ArrayList<>(futures.size());
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();
            for (CompletableFuture<List<Anomaly>> future : futures) {
                batches.add(future.join());
            }
        } catch (CompletionException e) {
            throw unwrap(e);
        }

        DetectionResult result = AnomalyAggregator.aggregate(batches, options.getMaxResults(),
                options.isGroupByOperation(), request.getSubjects().getServices().size() > 1);
        LOG.info("Detection over {} finished in {} ms: methods={}, anomalies={} (returned {})",
                request.getAnalysisRange(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started),
                options.getMethods(), result.getTotalAnomalies(), result.getAnomalies().size());
        return result;
    }

    /**
     * Run a single method synchronously on the calling thread.
     *
     * @param method  the method to run
     * @param request windows, subjects and options
     * @return that method's anomalies, unranked
     */
    public List<Anomaly> detect(AnalysisMethod method, DetectionRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        return runDetector(DetectorFactory.create(method), request);
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            executor.shutdownNow();
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private List<Anomaly> runDetector(AnomalyDetector detector, DetectionRequest request) {
        List<Anomaly> anomalies = detector.detect(source, request);
        LOG.debug("Detector [{}] produced {} anomaly(ies)", detector.getMethod().configName(), anomalies.size());
        return anomalies;
    }

    private static RuntimeException unwrap(CompletionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IllegalStateException("Detector failed", cause != null ? cause : e);
    }

    /** Named daemon threads so a forgotten engine never blocks JVM exit. */
    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "detector-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
