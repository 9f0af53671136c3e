package com.telemetrysentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What to analyze: metric names, field names and span filters.
 *
 * <p>
 * Field discovery is not part of the engine; callers list the subjects
 * explicitly.
 * </p>
 *
 * @since 1.0.0
 */
public class SubjectSelection implements Serializable {

    private static final long serialVersionUID = 1L;

    private List<String> counterMetrics = new ArrayList<>();
    private List<String> gaugeMetrics = new ArrayList<>();
    private List<String> monotonicMetrics = new ArrayList<>();

    /** Metrics whose values are a small set of discrete states. */
    private List<String> enumMetrics = new ArrayList<>();
    private List<String> statisticalFields = new ArrayList<>();

    /** Services in scope; empty means all. */
    private List<String> services = new ArrayList<>();

    /** Single operation to restrict span analysis to, or {@code null}. */
    private String operation;

    public List<String> getCounterMetrics() {
        return Collections.unmodifiableList(counterMetrics);
    }

    public void setCounterMetrics(List<String> counterMetrics) {
        this.counterMetrics = copyOf(counterMetrics);
    }

    public List<String> getGaugeMetrics() {
        return Collections.unmodifiableList(gaugeMetrics);
    }

    public void setGaugeMetrics(List<String> gaugeMetrics) {
        this.gaugeMetrics = copyOf(gaugeMetrics);
    }

    public List<String> getMonotonicMetrics() {
        return Collections.unmodifiableList(monotonicMetrics);
    }

    public void setMonotonicMetrics(List<String> monotonicMetrics) {
        this.monotonicMetrics = copyOf(monotonicMetrics);
    }

    public List<String> getEnumMetrics() {
        return Collections.unmodifiableList(enumMetrics);
    }

    public void setEnumMetrics(List<String> enumMetrics) {
        this.enumMetrics = copyOf(enumMetrics);
    }

    public List<String> getStatisticalFields() {
        return Collections.unmodifiableList(statisticalFields);
    }

    public void setStatisticalFields(List<String> statisticalFields) {
        this.statisticalFields = copyOf(statisticalFields);
    }

    public List<String> getServices() {
        return Collections.unmodifiableList(services);
    }

    public void setServices(List<String> services) {
        this.services = copyOf(services);
    }

    public String getOperation() {
        return operation;
    }

    public void setOperation(String operation) {
        this.operation = operation;
    }

    private static List<String> copyOf(List<String> values) {
        return values != null ? new ArrayList<>(values) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "SubjectSelection{" +
                "counterMetrics=" + counterMetrics +
                ", gaugeMetrics=" + gaugeMetrics +
                ", monotonicMetrics=" + monotonicMetrics +
                ", enumMetrics=" + enumMetrics +
                ", statisticalFields=" + statisticalFields +
                ", services=" + services +
                ", operation='" + operation + '\'' +
                '}';
    }
}
