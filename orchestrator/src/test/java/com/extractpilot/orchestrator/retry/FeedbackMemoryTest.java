package com.extractpilot.orchestrator.retry;

import com.extractpilot.orchestrator.model.StepKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FeedbackMemoryTest {

    @Test
    void add_sameOpTwice_storedOnce() {
        FeedbackMemory memory = new FeedbackMemory(10);

        memory.add(StepKind.PARSE, List.of("Add the authors"));
        memory.add(StepKind.PARSE, List.of("Add the authors"));

        assertThat(memory.get(StepKind.PARSE)).containsExactly("Add the authors");
    }

    @Test
    void add_differsOnlyInCaseAndWhitespace_isDuplicate() {
        FeedbackMemory memory = new FeedbackMemory(10);

        int first  = memory.add(StepKind.PARSE, List.of("Add the authors"));
        int second = memory.add(StepKind.PARSE, List.of("  ADD THE AUTHORS \n", "add the AUTHORS"));

        assertThat(first).isEqualTo(1);
        assertThat(second).isZero();
        assertThat(memory.get(StepKind.PARSE)).containsExactly("Add the authors");
    }

    @Test
    void add_beyondCapacity_evictsOldestFirst() {
        FeedbackMemory memory = new FeedbackMemory(3);

        memory.add(StepKind.GENERATE, List.of("a", "b", "c"));
        memory.add(StepKind.GENERATE, List.of("d"));

        assertThat(memory.get(StepKind.GENERATE)).containsExactly("b", "c", "d");
    }

    @Test
    void add_blankAndNullOps_areIgnored() {
        FeedbackMemory memory = new FeedbackMemory(5);

        memory.add(StepKind.PARSE, java.util.Arrays.asList("", "   ", null, "real"));

        assertThat(memory.get(StepKind.PARSE)).containsExactly("real");
    }

    @Test
    void get_stepKindsAreIndependent() {
        FeedbackMemory memory = new FeedbackMemory(5);

        memory.add(StepKind.PARSE, List.of("fix title"));

        assertThat(memory.get(StepKind.RETRIEVE)).isEmpty();
        memory.add(StepKind.RETRIEVE, List.of("fix title"));
        assertThat(memory.get(StepKind.RETRIEVE)).containsExactly("fix title");
    }

    @Test
    void get_returnsSnapshotInInsertionOrder() {
        FeedbackMemory memory = new FeedbackMemory(5);
        memory.add(StepKind.PARSE, List.of("one", "two"));

        List<String> snapshot = memory.get(StepKind.PARSE);
        memory.add(StepKind.PARSE, List.of("three"));

        assertThat(snapshot).containsExactly("one", "two");
        assertThatThrownBy(() -> snapshot.add("x")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void constructor_zeroCapacity_throws() {
        assertThatThrownBy(() -> new FeedbackMemory(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
