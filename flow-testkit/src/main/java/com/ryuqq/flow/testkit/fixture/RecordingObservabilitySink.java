package com.ryuqq.flow.testkit.fixture;

import com.ryuqq.flow.core.spi.ObservabilitySink;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * {@link ObservabilitySink} that records log lines and spans for assertions.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RecordingObservabilitySink implements ObservabilitySink {

    public record LogEntry(Level level, String message, Map<String, Object> context) {
    }

    public record Span(String name, Map<String, Object> attributes, boolean failed) {
    }

    private final List<LogEntry> logs = new CopyOnWriteArrayList<>();
    private final List<Span> spans = new CopyOnWriteArrayList<>();

    @Override
    public void log(Level level, String message, Map<String, Object> context) {
        logs.add(new LogEntry(level, message, context == null ? Map.of() : Map.copyOf(context)));
    }

    @Override
    public <T> T trace(String name, Map<String, Object> attributes, Supplier<T> body) {
        Map<String, Object> copy = attributes == null ? Map.of() : Map.copyOf(attributes);
        try {
            T result = body.get();
            spans.add(new Span(name, copy, false));
            return result;
        } catch (RuntimeException | Error e) {
            spans.add(new Span(name, copy, true));
            throw e;
        }
    }

    public List<LogEntry> logs() {
        return List.copyOf(logs);
    }

    public List<Span> spans() {
        return List.copyOf(spans);
    }

    public void clear() {
        logs.clear();
        spans.clear();
    }
}
