package com.extractpilot.orchestrator.worker;

import com.extractpilot.orchestrator.model.StepKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for WorkerRegistry: lookup, duplicate detection and the
 * metrics wrapper.
 */
class WorkerRegistryTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private SimpleMeterRegistry meterRegistry;
    private StepContext         context;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        context = StepContext.initial(UUID.randomUUID(), StepKind.PARSE, "goal", null).forAttempt(1, 3, null, null);
    }

    @Test
    void get_registeredKind_returnsWorker() {
        StepWorker parse = worker(StepKind.PARSE, false);
        WorkerRegistry registry = new WorkerRegistry(List.of(parse), meterRegistry);

        assertThat(registry.get(StepKind.PARSE)).isSameAs(parse);
        assertThat(registry.has(StepKind.PARSE)).isTrue();
        assertThat(registry.has(StepKind.GENERATE)).isFalse();
    }

    @Test
    void get_unknownKind_throwsIllegalArgument() {
        WorkerRegistry registry = new WorkerRegistry(List.of(), meterRegistry);

        assertThatThrownBy(() -> registry.get(StepKind.RETRIEVE))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("retrieve");
    }

    @Test
    void constructor_twoWorkersForSameKind_failsFast() {
        assertThatThrownBy(() -> new WorkerRegistry(
                List.of(worker(StepKind.PARSE, false), worker(StepKind.PARSE, false)), meterRegistry))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("parse");
    }

    @Test
    void instrumented_success_recordsTimerAndSuccessCounter() {
        WorkerRegistry registry = new WorkerRegistry(List.of(worker(StepKind.PARSE, false)), meterRegistry);

        CandidateOutput output = registry.instrumented(StepKind.PARSE).invoke(context);

        assertThat(output.payload().get("title").asText()).isEqualTo("ok");
        assertThat(meterRegistry.get("extractpilot.worker.duration").tag("step", "parse").timer().count())
                .isEqualTo(1);
        assertThat(meterRegistry.get("extractpilot.worker.calls")
                .tag("step", "parse").tag("status", "success").counter().count()).isEqualTo(1.0);
    }

    @Test
    void instrumented_failure_countsErrorAndRethrows() {
        WorkerRegistry registry = new WorkerRegistry(List.of(worker(StepKind.PARSE, true)), meterRegistry);
        StepWorker instrumented = registry.instrumented(StepKind.PARSE);

        assertThatThrownBy(() -> instrumented.invoke(context)).isInstanceOf(WorkerException.class);
        assertThat(instrumented.kind()).isEqualTo(StepKind.PARSE);
        assertThat(meterRegistry.get("extractpilot.worker.calls")
                .tag("step", "parse").tag("status", "error").counter().count()).isEqualTo(1.0);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private StepWorker worker(StepKind kind, boolean fails) {
        return new StepWorker() {
            @Override
            public StepKind kind() {
                return kind;
            }

            @Override
            public CandidateOutput invoke(StepContext ctx) {
                if (fails) {
                    throw new WorkerException(kind, "boom");
                }
                return CandidateOutput.fromJson(mapper.createObjectNode().put("title", "ok"));
            }
        };
    }
}
