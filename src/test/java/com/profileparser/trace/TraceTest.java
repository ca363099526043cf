package com.profileparser.trace;

import com.profileparser.model.OperationRecord;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

import static com.profileparser.TraceFixtures.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TraceTest {

    private static List<OperationRecord> children() {
        return List.of(
                record("1.1", "a", 0.4),
                record("1.1.1", "a1", 0.1),
                record("1.1.2", "a2", 0.2),
                record("1.1.2.1", "a2x", 0.05),
                record("1.2", "b", 0.3),
                record("1.3", "c", 0.1),
                record("1.3.1", "c1", 0.1));
    }

    private static Trace build(List<OperationRecord> records) {
        Trace trace = new Trace(record("1", "root", 1.0), "trace-1");
        records.forEach(trace::add);
        trace.finish();
        return trace;
    }

    private static String shape(TraceNode node) {
        String children = node.getChildren().stream()
                .map(TraceTest::shape)
                .sorted()
                .collect(Collectors.joining(","));
        return node.getPathId() + ":" + node.getRecord().getName() + ":" + node.getInclusiveTimeMs()
                + ":" + node.getExclusiveTimeMs() + "[" + children + "]";
    }

    @Test
    void insertionOrderDoesNotChangeTheTree() {
        String expected = shape(build(children()).getRoot());

        Random random = new Random(42);
        for (int i = 0; i < 50; i++) {
            List<OperationRecord> shuffled = new ArrayList<>(children());
            Collections.shuffle(shuffled, random);
            assertThat(shape(build(shuffled).getRoot())).isEqualTo(expected);
        }
    }

    @Test
    void computesInclusiveAndExclusiveTimes() {
        Trace trace = build(children());
        TraceNode root = trace.getRoot();

        assertThat(trace.getInclusiveTimeMs()).isEqualTo(1000);
        assertThat(trace.getExclusiveTimeMs()).isEqualTo(1000 - 400 - 300 - 100);
        assertThat(root.getChild("1").getExclusiveTimeMs()).isEqualTo(400 - 100 - 200);
        assertThat(root.getChild("1").getChild("2").getExclusiveTimeMs()).isEqualTo(150);
        assertThat(root.getChild("3").getExclusiveTimeMs()).isZero();
    }

    @Test
    void clampsExclusiveTimeWhenChildrenOutlastTheParent() {
        Trace trace = new Trace(record("1", "parent", 0.1));
        trace.add(record("1.1", "child", 0.15));
        trace.finish();

        assertThat(trace.getInclusiveTimeMs()).isEqualTo(100);
        assertThat(trace.getExclusiveTimeMs()).isZero();
        assertThat(trace.getRoot().getChild("1").getExclusiveTimeMs()).isEqualTo(150);
    }

    @Test
    void exclusiveTimesNeverExceedTheRootInclusiveTime() {
        Trace trace = build(children());

        long exclusiveSum = trace.stream().mapToLong(TraceNode::getExclusiveTimeMs).sum();

        assertThat(trace.stream()).allSatisfy(node -> assertThat(node.getExclusiveTimeMs()).isNotNegative());
        assertThat(exclusiveSum).isEqualTo(trace.getInclusiveTimeMs());
    }

    @Test
    void clampingCanMakeExclusiveSumExceedRoot() {
        Trace trace = new Trace(record("1", "parent", 0.1));
        trace.add(record("1.1", "child", 0.15));
        trace.finish();

        long exclusiveSum = trace.stream().mapToLong(TraceNode::getExclusiveTimeMs).sum();
        assertThat(exclusiveSum).isGreaterThan(trace.getInclusiveTimeMs());
    }

    @Test
    void truncatesDurationsToWholeMilliseconds() {
        Trace trace = new Trace(record("1", "root", 0.0019));
        trace.finish();

        assertThat(trace.getInclusiveTimeMs()).isEqualTo(1);
    }

    @Test
    void traversesDepthFirstInTheOrderChildrenWereCreated() {
        Trace trace = new Trace(record("1", "root", 1.0));
        trace.add(record("1.2", "second", 0.1));
        trace.add(record("1.1.1", "grandchild", 0.1));
        trace.add(record("1.1", "first", 0.2));
        trace.finish();

        List<String> order = trace.stream().map(TraceNode::getPathId).collect(Collectors.toList());
        assertThat(order).containsExactly("1", "1.2", "1.1", "1.1.1");
    }

    @Test
    void recordsAncestryAndParentReferences() {
        Trace trace = build(children());
        TraceNode deepest = trace.getRoot().getChild("1").getChild("2").getChild("1");

        assertThat(deepest.getStack()).containsExactly("root", "a", "a2", "a2x");
        assertThat(deepest.getRecord().getParentSpanId()).contains("1.1.2");
        assertThat(deepest.getRecord().getTraceId()).isEqualTo("trace-1");
        assertThat(trace.getRoot().getRecord().getParentSpanId()).isEmpty();
        assertThat(trace.getRoot().getRecord().getReferences()).isEmpty();
    }

    @Test
    void finalizingTwiceIsRejected() {
        Trace trace = build(children());

        assertThatThrownBy(trace::finish)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already been finalized");
        assertThat(trace.getInclusiveTimeMs()).isEqualTo(1000);
    }

    @Test
    void addingAfterFinalizeIsRejected() {
        Trace trace = build(children());

        assertThatThrownBy(() -> trace.add(record("1.4", "late", 0.1)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void lastRecordForAPathWins() {
        Trace trace = new Trace(record("1", "root", 1.0));
        trace.add(record("1.1", "first", 0.1));
        trace.add(record("1.1", "second", 0.2));
        trace.finish();

        assertThat(trace.getNodes()).hasSize(2);
        assertThat(trace.getRoot().getChild("1").getRecord().getName()).isEqualTo("second");
    }

    @Test
    void missingParentRecordFailsFinalize() {
        Trace trace = new Trace(record("1", "root", 1.0));
        trace.add(record("1.1.1", "orphan", 0.1));

        assertThatThrownBy(trace::finish)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("1.1");
    }

    @Test
    void rejectsSpansOutsideTheRoot() {
        Trace trace = new Trace(record("1", "root", 1.0));

        assertThatThrownBy(() -> trace.add(record("2.1", "elsewhere", 0.1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void timesAreUnavailableBeforeFinalize() {
        Trace trace = new Trace(record("1", "root", 1.0));

        assertThat(trace.isFinished()).isFalse();
        assertThatThrownBy(trace::getInclusiveTimeMs).isInstanceOf(IllegalStateException.class);
    }
}
