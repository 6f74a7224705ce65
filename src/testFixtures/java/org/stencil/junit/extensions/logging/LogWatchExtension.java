package org.stencil.junit.extensions.logging;

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
 * Fails a test when it logs at WARN or above without an {@link AllowLog} or {@link ExpectLog}
 * covering the event, and when an {@link ExpectLog} is not met.
 * <p>
 * Annotations on the test class apply to every method and add to those on the method.
 * Covered events are suppressed so they do not clutter the build output.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterAllCallback, AfterEachCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);

    @Override
    public void beforeAll(ExtensionContext context) {
        WatchFilter filter = new WatchFilter(resolveRules(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put("filter", filter);
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        WatchFilter filter = context.getStore(NAMESPACE).get("filter", WatchFilter.class);
        if (filter != null) {
            filter.reset(resolveRules(context));
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        WatchFilter filter = context.getStore(NAMESPACE).get("filter", WatchFilter.class);
        if (filter == null) {
            return;
        }
        Rules rules = filter.rules;
        List<Event> events = List.copyOf(filter.events);
        filter.events.clear();

        List<String> unexpected = new ArrayList<>();
        if (!rules.disabled) {
            for (Event event : events) {
                if (rules.covers(event)) continue;
                unexpected.add(event.toString());
            }
        }
        List<String> missing = new ArrayList<>();
        for (Rule expect : rules.expects) {
            long count = events.stream().filter(expect::matches).count();
            if (count < expect.occurrences) {
                missing.add(String.format("Expected %d x %s, but found %d.", expect.occurrences, expect, count));
            }
        }
        if (unexpected.isEmpty() && missing.isEmpty()) {
            return;
        }
        StringBuilder sb = new StringBuilder();
        if (!unexpected.isEmpty()) {
            sb.append("Unexpected logs:\n");
            unexpected.forEach(msg -> sb.append("  ").append(msg).append('\n'));
        }
        if (!missing.isEmpty()) {
            sb.append("Missing expected logs:\n");
            missing.forEach(msg -> sb.append("  ").append(msg).append('\n'));
        }
        throw new AssertionError(sb.toString());
    }

    @Override
    public void afterAll(ExtensionContext context) {
        WatchFilter filter = context.getStore(NAMESPACE).remove("filter", WatchFilter.class);
        if (filter != null) {
            loggerContext().getTurboFilterList().remove(filter);
            filter.stop();
        }
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static Rules resolveRules(ExtensionContext context) {
        AnnotatedElement testClass = context.getTestClass().orElse(null);
        AnnotatedElement element = context.getElement().orElse(null);

        FailOnLog fail = element == null ? null : element.getAnnotation(FailOnLog.class);
        if (fail == null && testClass != null) {
            fail = testClass.getAnnotation(FailOnLog.class);
        }
        List<Rule> allows = new ArrayList<>();
        List<Rule> expects = new ArrayList<>();
        for (AnnotatedElement source : new AnnotatedElement[]{testClass, element == testClass ? null : element}) {
            if (source == null) continue;
            for (AllowLog a : source.getAnnotationsByType(AllowLog.class)) {
                allows.add(new Rule(a.level(), a.loggerPattern(), a.messagePattern(), 0));
            }
            for (ExpectLog e : source.getAnnotationsByType(ExpectLog.class)) {
                expects.add(new Rule(e.level(), e.loggerPattern(), e.messagePattern(), e.occurrences()));
            }
        }
        return new Rules(
                fail != null ? fail.level() : LogLevel.WARN,
                fail != null && fail.disabled(),
                allows,
                expects);
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private record Event(String loggerName, Level level, String message) {
        @Override
        public String toString() {
            return String.format("[%s] %s - %s", level, loggerName, message);
        }
    }

    private static final class Rule {
        final LogLevel level;
        final Pattern logger;
        final Pattern message;
        final int occurrences;

        Rule(LogLevel level, String loggerPattern, String messagePattern, int occurrences) {
            this.level = level;
            this.logger = Pattern.compile(loggerPattern);
            this.message = Pattern.compile(messagePattern, Pattern.DOTALL);
            this.occurrences = occurrences;
        }

        boolean matches(Event event) {
            return event.level.isGreaterOrEqual(toLogback(level))
                    && logger.matcher(event.loggerName).matches()
                    && message.matcher(event.message).matches();
        }

        @Override
        public String toString() {
            return String.format("[%s] logger=\"%s\" message=\"%s\"", level, logger.pattern(), message.pattern());
        }
    }

    private record Rules(LogLevel minLevel, boolean disabled, List<Rule> allows, List<Rule> expects) {
        boolean covers(Event event) {
            return allows.stream().anyMatch(r -> r.matches(event)) || expects.stream().anyMatch(r -> r.matches(event));
        }
    }

    private static final class WatchFilter extends TurboFilter {
        private final List<Event> events = new CopyOnWriteArrayList<>();
        private volatile Rules rules;

        WatchFilter(Rules rules) {
            this.rules = rules;
        }

        void reset(Rules newRules) {
            this.rules = newRules;
            events.clear();
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level,
                                  String format, Object[] params, Throwable t) {
            Rules current = rules;
            // A null format is an isEnabled() probe, not an event.
            if (format == null || level == null || !level.isGreaterOrEqual(toLogback(current.minLevel))) {
                return FilterReply.NEUTRAL;
            }
            String message = MessageFormatter.arrayFormat(format, params).getMessage();
            Event event = new Event(logger.getName(), level, message == null ? "" : message);
            events.add(event);
            return current.covers(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }
    }
}
