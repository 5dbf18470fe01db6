package io.aim.core.execution;

import io.aim.core.session.EvaluationEvent;
import io.aim.core.session.EvaluationEventSink;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/// Records events and lets a test wait for the terminal one.
final class CollectingSink implements EvaluationEventSink {

    private final List<EvaluationEvent> events = new CopyOnWriteArrayList<>();
    private final CountDownLatch terminal = new CountDownLatch(1);

    @Override
    public void accept(EvaluationEvent event) {
        events.add(event);
        if (event.isTerminal()) {
            terminal.countDown();
        }
    }

    List<EvaluationEvent> awaitTerminal() throws InterruptedException {
        if (!terminal.await(10, TimeUnit.SECONDS)) {
            throw new AssertionError("No terminal event within 10s, got " + events);
        }
        return events;
    }

    List<EvaluationEvent> events() {
        return events;
    }

    List<EvaluationEvent.MetricResult> results() {
        return events.stream()
                .filter(EvaluationEvent.MetricResult.class::isInstance)
                .map(EvaluationEvent.MetricResult.class::cast)
                .toList();
    }

    EvaluationEvent.MetricResult resultFor(String metricId) {
        return results().stream()
                .filter(result -> result.metricId().equals(metricId))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No result for " + metricId + " in " + events));
    }
}
