package com.extractpilot.orchestrator.worker;

import com.extractpilot.orchestrator.model.StepKind;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * In-process worker registry.
 *
 * All {@link StepWorker} beans are collected at startup via constructor
 * injection, one per step-kind. Callers get an instrumented view of a worker
 * through {@link #instrumented}: every invocation is timed and counted.
 *
 * <pre>
 *   extractpilot.worker.calls{step, status="success|error"}
 *   extractpilot.worker.duration{step}
 * </pre>
 */
@Component
public class WorkerRegistry {

    private static final Logger log = LoggerFactory.getLogger(WorkerRegistry.class);

    private final Map<StepKind, StepWorker> workers = new EnumMap<>(StepKind.class);
    private final MeterRegistry meterRegistry;

    public WorkerRegistry(List<StepWorker> allWorkers, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        for (StepWorker worker : allWorkers) {
            StepWorker previous = workers.put(worker.kind(), worker);
            if (previous != null) {
                throw new IllegalStateException("Two workers registered for step '" + worker.kind().key()
                        + "': " + previous.getClass().getSimpleName()
                        + " and " + worker.getClass().getSimpleName());
            }
            log.info("Registered worker '{}' -> {}", worker.kind().key(), worker.getClass().getSimpleName());
        }
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public StepWorker get(StepKind kind) {
        StepWorker worker = workers.get(kind);
        if (worker == null) {
            throw new IllegalArgumentException("No worker registered for step '" + kind.key() + "'");
        }
        return worker;
    }

    public boolean has(StepKind kind) {
        return workers.containsKey(kind);
    }

    // ------------------------------------------------------------------
    // Metrics-instrumented execution
    // ------------------------------------------------------------------

    /**
     * The worker for {@code kind}, wrapped so each invocation is timed and
     * counted. Exceptions pass through unchanged.
     */
    public StepWorker instrumented(StepKind kind) {
        StepWorker delegate = get(kind);
        return new StepWorker() {
            @Override
            public StepKind kind() {
                return delegate.kind();
            }

            @Override
            public CandidateOutput invoke(StepContext context) {
                Timer.Sample sample = Timer.start(meterRegistry);
                String status = "success";
                try {
                    return delegate.invoke(context);
                } catch (RuntimeException e) {
                    status = "error";
                    throw e;
                } finally {
                    sample.stop(meterRegistry.timer("extractpilot.worker.duration", "step", kind.key()));
                    meterRegistry.counter("extractpilot.worker.calls",
                            "step", kind.key(), "status", status).increment();
                }
            }
        };
    }
}
