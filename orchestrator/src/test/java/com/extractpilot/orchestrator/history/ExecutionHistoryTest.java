package com.extractpilot.orchestrator.history;

import com.extractpilot.orchestrator.model.StepKind;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExecutionHistoryTest {

    @Test
    void append_keepsOrderAndFiltersByStep() {
        ExecutionHistory history = new ExecutionHistory();
        history.append(failed(StepKind.PARSE, 1));
        history.append(failed(StepKind.PARSE, 2));
        history.append(failed(StepKind.RETRIEVE, 1));

        assertThat(history.size()).isEqualTo(3);
        assertThat(history.forStep(StepKind.PARSE)).extracting(StepExecutionRecord::attempt).containsExactly(1, 2);
        assertThat(history.since(2)).extracting(StepExecutionRecord::stepKind).containsExactly(StepKind.RETRIEVE);
        assertThat(history.since(10)).isEmpty();
    }

    @Test
    void records_isReadOnly() {
        ExecutionHistory history = new ExecutionHistory();
        history.append(failed(StepKind.PARSE, 1));

        assertThatThrownBy(() -> history.records().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void onAppend_listenerSeesSizeBeforeRecordIsAdded() {
        ExecutionHistory history = new ExecutionHistory();
        List<Integer> sequences = new ArrayList<>();
        history.onAppend(r -> sequences.add(history.size()));

        history.append(failed(StepKind.PARSE, 1));
        history.append(failed(StepKind.PARSE, 2));

        assertThat(sequences).containsExactly(0, 1);
    }

    @Test
    void onAppend_throwingListener_recordNotAdded() {
        ExecutionHistory history = new ExecutionHistory().onAppend(r -> {
            throw new IllegalStateException("db down");
        });

        assertThatThrownBy(() -> history.append(failed(StepKind.PARSE, 1))).hasMessage("db down");
        assertThat(history.isEmpty()).isTrue();
    }

    @Test
    void record_snapshotsOutput() {
        ObjectNode output = JsonNodeFactory.instance.objectNode().put("title", "before");
        StepExecutionRecord record = new StepExecutionRecord(StepKind.PARSE, 1, output, null, null,
                Instant.now(), Instant.now());

        output.put("title", "after");

        assertThat(record.output().get("title").asText()).isEqualTo("before");
        assertThat(record.failed()).isFalse();
        assertThat(record.score()).isNull();
    }

    private static StepExecutionRecord failed(StepKind kind, int attempt) {
        return new StepExecutionRecord(kind, attempt, null, null, "Worker failed: timeout",
                Instant.now(), Instant.now());
    }
}
