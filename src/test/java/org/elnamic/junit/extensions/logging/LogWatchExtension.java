package org.elnamic.junit.extensions.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.helpers.MessageFormatter;

import java.lang.reflect.AnnotatedElement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Fails a test that logs at WARN or above (or the {@link FailOnLog} level) unless the event is
 * announced with {@link AllowLog} or {@link ExpectLog}; also fails when an {@link ExpectLog}
 * event does not occur. Announced events are kept out of the test output.
 */
public class LogWatchExtension implements BeforeEachCallback, AfterEachCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);

    @Override
    public void beforeEach(ExtensionContext context) {
        Rules rules = Rules.of(context);
        CapturingFilter filter = new CapturingFilter(rules);
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put(CapturingFilter.class, filter);
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).remove(CapturingFilter.class, CapturingFilter.class);
        if (filter == null) {
            return;
        }
        loggerContext().getTurboFilterList().remove(filter);
        filter.stop();

        Rules rules = filter.rules;
        List<String> problems = new ArrayList<>();
        if (!rules.disabled) {
            for (Event event : filter.events) {
                if (!rules.announced(event)) {
                    problems.add("Unexpected log: " + event);
                }
            }
        }
        for (ExpectLog expected : rules.expects) {
            long count = filter.events.stream().filter(e -> e.matches(expected.level(), expected.loggerPattern(), expected.messagePattern())).count();
            if (count < expected.occurrences()) {
                problems.add(String.format("Missing expected log: %d x [%s] logger=\"%s\" message=\"%s\", found %d",
                        expected.occurrences(), expected.level(), expected.loggerPattern(), expected.messagePattern(), count));
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private record Event(String logger, Level level, String message) {

        boolean matches(LogLevel minLevel, String loggerPattern, String messagePattern) {
            return level.isGreaterOrEqual(minLevel.toLogback())
                    && Pattern.matches(loggerPattern, logger)
                    && Pattern.matches(messagePattern, message);
        }

        @Override
        public String toString() {
            return String.format("[%s] %s - %s", level, logger, message);
        }
    }

    private record Rules(LogLevel minLevel, boolean disabled, List<AllowLog> allows, List<ExpectLog> expects) {

        static Rules of(ExtensionContext context) {
            AnnotatedElement method = context.getElement().orElse(null);
            Class<?> testClass = context.getTestClass().orElse(null);
            FailOnLog fail = method != null ? method.getAnnotation(FailOnLog.class) : null;
            if (fail == null && testClass != null) {
                fail = testClass.getAnnotation(FailOnLog.class);
            }
            return new Rules(
                    fail != null ? fail.level() : LogLevel.WARN,
                    fail != null && fail.disabled(),
                    collect(testClass, method, AllowLog.class),
                    collect(testClass, method, ExpectLog.class));
        }

        private static <A extends java.lang.annotation.Annotation> List<A> collect(AnnotatedElement testClass,
                                                                                 AnnotatedElement method, Class<A> type) {
            return Stream.of(testClass, method)
                    .filter(java.util.Objects::nonNull)
                    .flatMap(element -> Arrays.stream(element.getAnnotationsByType(type)))
                    .toList();
        }

        boolean announced(Event event) {
            return allows.stream().anyMatch(a -> event.matches(a.level(), a.loggerPattern(), a.messagePattern()))
                    || expects.stream().anyMatch(e -> event.matches(e.level(), e.loggerPattern(), e.messagePattern()));
        }
    }

    private static final class CapturingFilter extends TurboFilter {
        private final Rules rules;
        private final List<Event> events = new CopyOnWriteArrayList<>();

        CapturingFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level, String format,
                                  Object[] params, Throwable t) {
            // format is null for isXxxEnabled() probes
            if (format == null || !level.isGreaterOrEqual(rules.minLevel.toLogback()) || !level.isGreaterOrEqual(logger.getEffectiveLevel())) {
                return FilterReply.NEUTRAL;
            }
            Event event = new Event(logger.getName(), level, MessageFormatter.arrayFormat(format, params).getMessage());
            events.add(event);
            return rules.announced(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }
    }
}
