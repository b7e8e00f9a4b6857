package org.archipel.junit.extensions.logging;

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
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Fails a test that logs at WARN or above unless the event is declared with {@link AllowLog}
 * or {@link ExpectLog}, and fails it when an {@link ExpectLog} event did not occur.
 *
 * <p>Declared events are suppressed so that expected failures do not clutter the build
 * output. Annotations on the class apply to every test method.</p>
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);

    @Override
    public void beforeAll(ExtensionContext context) {
        CapturingFilter filter = new CapturingFilter(Rules.resolve(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put("filter", filter);
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
        if (filter == null) {
            return;
        }
        Rules rules = filter.rules;
        List<Event> events = filter.events();
        filter.clear();

        List<String> problems = new ArrayList<>();
        for (Event event : events) {
            if (!rules.permits(event)) {
                problems.add("Unexpected log: " + event);
            }
        }
        for (ExpectLog expect : rules.expects) {
            long count = events.stream().filter(e -> e.matches(expect.level(), expect.loggerPattern(), expect.messagePattern())).count();
            if (count < expect.occurrences()) {
                problems.add(String.format("Missing expected log: %d x [%s] logger=\"%s\" message=\"%s\", found %d",
                    expect.occurrences(), expect.level(), expect.loggerPattern(), expect.messagePattern(), count));
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    @Override
    public void afterAll(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).remove("filter", CapturingFilter.class);
        if (filter != null) {
            loggerContext().getTurboFilterList().remove(filter);
            filter.stop();
        }
    }

    private static CapturingFilter filter(ExtensionContext context) {
        return context.getStore(NAMESPACE).get("filter", CapturingFilter.class);
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
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
            if (format == null || !level.isGreaterOrEqual(Level.WARN)) {
                return FilterReply.NEUTRAL;
            }
            Event event = new Event(logger.getName(), level, MessageFormatter.arrayFormat(format, params).getMessage());
            events.add(event);
            return rules.permits(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }

        List<Event> events() {
            return new ArrayList<>(events);
        }

        void clear() {
            events.clear();
        }
    }

    private record Event(String loggerName, Level level, String message) {

        boolean matches(LogLevel minimum, String loggerPattern, String messagePattern) {
            return level.isGreaterOrEqual(toLogback(minimum))
                && Pattern.matches(loggerPattern, loggerName)
                && Pattern.compile(messagePattern, Pattern.DOTALL).matcher(message == null ? "" : message).matches();
        }

        @Override
        public String toString() {
            return String.format("[%s] %s - %s", level, loggerName, message);
        }
    }

    private record Rules(List<AllowLog> allows, List<ExpectLog> expects) {

        static Rules resolve(ExtensionContext context) {
            List<AllowLog> allows = new ArrayList<>();
            List<ExpectLog> expects = new ArrayList<>();
            context.getTestClass().ifPresent(c -> collect(c, allows, expects));
            context.getTestMethod().ifPresent(m -> collect(m, allows, expects));
            return new Rules(allows, expects);
        }

        private static void collect(AnnotatedElement element, List<AllowLog> allows, List<ExpectLog> expects) {
            allows.addAll(List.of(element.getAnnotationsByType(AllowLog.class)));
            expects.addAll(List.of(element.getAnnotationsByType(ExpectLog.class)));
        }

        boolean permits(Event event) {
            return allows.stream().anyMatch(a -> event.matches(a.level(), a.loggerPattern(), a.messagePattern()))
                || expects.stream().anyMatch(e -> event.matches(e.level(), e.loggerPattern(), e.messagePattern()));
        }
    }
}
