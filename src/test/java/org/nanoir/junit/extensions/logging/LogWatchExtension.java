package org.nanoir.junit.extensions.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.extension.AfterAllCallback;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.helpers.MessageFormatter;

import java.lang.reflect.AnnotatedElement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Fails a test that logs at WARN or above unless the event is covered by {@link AllowLog}
 * or {@link ExpectLog}, and fails it when an {@link ExpectLog} is not met.
 * <p>
 * Rules are read from the test class and the test method; method rules add to class rules.
 * A Logback turbo filter captures the events and suppresses the tolerated ones from the
 * console.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String FILTER_KEY = "filter";

    @Override
    public void beforeAll(ExtensionContext context) {
        CapturingFilter filter = new CapturingFilter(Rules.resolve(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put(FILTER_KEY, filter);
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingFilter filter = filter(context);
        if (filter != null) {
            filter.clear();
            filter.rules = Rules.resolve(context);
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = filter(context);
        if (filter == null) return;

        Rules rules = filter.rules;
        List<Event> events = filter.events();
        List<String> problems = new ArrayList<>();
        if (!rules.disabled) {
            for (Event event : events) {
                if (event.level.isGreaterOrEqual(rules.minLevel) && !rules.tolerates(event)) {
                    problems.add("Unexpected log: " + event);
                }
            }
        }
        for (ExpectLog expect : rules.expects) {
            long count = events.stream().filter(e -> matches(e, expect.level(), expect.loggerPattern(), expect.messagePattern())).count();
            if (count < expect.occurrences()) {
                problems.add(String.format("Missing expected log: %d x [%s] logger=\"%s\" message=\"%s\", found %d",
                        expect.occurrences(), expect.level(), expect.loggerPattern(), expect.messagePattern(), count));
            }
        }
        filter.clear();
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    @Override
    public void afterAll(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).remove(FILTER_KEY, CapturingFilter.class);
        if (filter != null) {
            loggerContext().getTurboFilterList().remove(filter);
            filter.stop();
        }
    }

    private static CapturingFilter filter(ExtensionContext context) {
        // method contexts look up the store of their class context
        return context.getStore(NAMESPACE).get(FILTER_KEY, CapturingFilter.class);
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    static Level toLogback(LogLevel level) {
        return switch (level) {
            case DEBUG -> Level.DEBUG;
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private static boolean matches(Event event, LogLevel level, String loggerPattern, String messagePattern) {
        return event.level.isGreaterOrEqual(toLogback(level))
                && Pattern.matches(loggerPattern, event.logger)
                && Pattern.matches(messagePattern, event.message);
    }

    private static final class Rules {
        final Level minLevel;
        final boolean disabled;
        final List<AllowLog> allows;
        final List<ExpectLog> expects;

        private Rules(Level minLevel, boolean disabled, List<AllowLog> allows, List<ExpectLog> expects) {
            this.minLevel = minLevel;
            this.disabled = disabled;
            this.allows = allows;
            this.expects = expects;
        }

        static Rules resolve(ExtensionContext context) {
            Optional<AnnotatedElement> method = context.getTestMethod().map(m -> m);
            Optional<AnnotatedElement> type = context.getTestClass().map(c -> c);
            FailOnLog fail = method.map(m -> m.getAnnotation(FailOnLog.class))
                    .orElse(type.map(c -> c.getAnnotation(FailOnLog.class)).orElse(null));
            List<AllowLog> allows = new ArrayList<>();
            List<ExpectLog> expects = new ArrayList<>();
            type.ifPresent(c -> {
                allows.addAll(List.of(c.getAnnotationsByType(AllowLog.class)));
                expects.addAll(List.of(c.getAnnotationsByType(ExpectLog.class)));
            });
            method.ifPresent(m -> {
                allows.addAll(List.of(m.getAnnotationsByType(AllowLog.class)));
                expects.addAll(List.of(m.getAnnotationsByType(ExpectLog.class)));
            });
            Level minLevel = toLogback(fail != null ? fail.level() : LogLevel.WARN);
            return new Rules(minLevel, fail != null && fail.disabled(), allows, expects);
        }

        boolean tolerates(Event event) {
            return allows.stream().anyMatch(a -> matches(event, a.level(), a.loggerPattern(), a.messagePattern()))
                    || expects.stream().anyMatch(e -> matches(event, e.level(), e.loggerPattern(), e.messagePattern()));
        }
    }

    private static final class Event {
        final String logger;
        final Level level;
        final String message;

        Event(String logger, Level level, String message) {
            this.logger = logger;
            this.level = level;
            this.message = message == null ? "" : message;
        }

        @Override
        public String toString() {
            return "[" + level + "] " + logger + " - " + message;
        }
    }

    private static final class CapturingFilter extends TurboFilter {
        private final List<Event> events = new CopyOnWriteArrayList<>();
        private volatile Rules rules;

        CapturingFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level,
                                  String format, Object[] params, Throwable t) {
            Rules current = rules;
            boolean watched = level.isGreaterOrEqual(current.minLevel)
                    || current.expects.stream().anyMatch(e -> level.isGreaterOrEqual(toLogback(e.level())));
            if (!watched || format == null) {
                return FilterReply.NEUTRAL;
            }
            Event event = new Event(logger.getName(), level, MessageFormatter.arrayFormat(format, params).getMessage());
            events.add(event);
            return current.tolerates(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }

        List<Event> events() {
            return new ArrayList<>(events);
        }

        void clear() {
            events.clear();
        }
    }
}
