package org.macrohooks.junit.extensions.logging;

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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Fails a test when it logs at WARN or above unless the event is covered by {@link AllowLog}
 * or {@link ExpectLog}, and when an {@link ExpectLog} event does not occur.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterAllCallback, AfterEachCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);

    @Override
    public void beforeAll(ExtensionContext context) {
        ValidationRules rules = resolveRules(context);
        LoggerContext lc = (LoggerContext) LoggerFactory.getILoggerFactory();
        TestScopedTurboFilter filter = new TestScopedTurboFilter(rules);
        filter.start();
        lc.addTurboFilter(filter);
        context.getStore(NAMESPACE).put("filter", filter);
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        TestScopedTurboFilter filter = context.getStore(NAMESPACE).get("filter", TestScopedTurboFilter.class);
        if (filter != null) {
            filter.updateRules(resolveRules(context));
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        TestScopedTurboFilter filter = context.getStore(NAMESPACE).get("filter", TestScopedTurboFilter.class);
        if (filter == null) {
            return;
        }
        ValidationRules rules = resolveRules(context);
        List<CapturedEvent> events = filter.getCapturedEvents();
        filter.clearEvents();

        List<String> unexpected = new ArrayList<>();
        if (!rules.disabled) {
            for (CapturedEvent e : events) {
                if (e.level.isGreaterOrEqual(toLogback(rules.minLevel)) && !rules.permits(e)) {
                    unexpected.add(String.format("[%s] %s - %s", e.level, e.loggerName, e.message));
                }
            }
        }
        List<String> missing = new ArrayList<>();
        for (ExpectLog exp : rules.expects) {
            long count = events.stream()
                    .filter(e -> matches(e, exp.level(), exp.loggerPattern(), exp.messagePattern()))
                    .count();
            if (count < exp.occurrences()) {
                missing.add(String.format("Expected %d x [%s] logger=\"%s\" message=\"%s\", but found %d.",
                        exp.occurrences(), exp.level(), exp.loggerPattern(), exp.messagePattern(), count));
            }
        }

        if (!unexpected.isEmpty() || !missing.isEmpty()) {
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
    }

    @Override
    public void afterAll(ExtensionContext context) {
        TestScopedTurboFilter filter = context.getStore(NAMESPACE).remove("filter", TestScopedTurboFilter.class);
        if (filter != null) {
            LoggerContext lc = (LoggerContext) LoggerFactory.getILoggerFactory();
            lc.getTurboFilterList().remove(filter);
            filter.stop();
        }
    }

    private ValidationRules resolveRules(ExtensionContext context) {
        FailOnLog fail = context.getElement().map(el -> el.getAnnotation(FailOnLog.class))
                .orElse(context.getTestClass().map(c -> c.getAnnotation(FailOnLog.class)).orElse(null));
        List<AllowLog> allows = new ArrayList<>();
        List<ExpectLog> expects = new ArrayList<>();
        context.getTestClass().ifPresent(c -> {
            allows.addAll(List.of(c.getAnnotationsByType(AllowLog.class)));
            expects.addAll(List.of(c.getAnnotationsByType(ExpectLog.class)));
        });
        context.getTestMethod().ifPresent(m -> {
            allows.addAll(List.of(m.getAnnotationsByType(AllowLog.class)));
            expects.addAll(List.of(m.getAnnotationsByType(ExpectLog.class)));
        });
        LogLevel minLevel = fail != null ? fail.level() : LogLevel.WARN;
        boolean disabled = fail != null && fail.disabled();
        return new ValidationRules(minLevel, disabled, allows, expects);
    }

    private static boolean matches(CapturedEvent e, LogLevel level, String loggerPattern, String messagePattern) {
        return e.level.isGreaterOrEqual(toLogback(level))
                && Pattern.matches(loggerPattern, e.loggerName)
                && Pattern.matches(messagePattern, e.message);
    }

    private static Level toLogback(LogLevel lvl) {
        return switch (lvl) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private static class TestScopedTurboFilter extends TurboFilter {
        private final List<CapturedEvent> events = new CopyOnWriteArrayList<>();
        private volatile ValidationRules rules;

        TestScopedTurboFilter(ValidationRules rules) {
            this.rules = rules;
        }

        void updateRules(ValidationRules newRules) {
            this.rules = newRules;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level, String format, Object[] params, Throwable t) {
            if (level.isGreaterOrEqual(toLogback(rules.minLevel))) {
                String message = format == null ? "" : MessageFormatter.arrayFormat(format, params).getMessage();
                CapturedEvent ev = new CapturedEvent(logger.getName(), level, message);
                events.add(ev);
                // Keep permitted events out of the console.
                if (rules.permits(ev)) {
                    return FilterReply.DENY;
                }
            }
            return FilterReply.NEUTRAL;
        }

        List<CapturedEvent> getCapturedEvents() {
            return new ArrayList<>(events);
        }

        void clearEvents() {
            events.clear();
        }
    }

    private static final class CapturedEvent {
        final String loggerName;
        final Level level;
        final String message;

        CapturedEvent(String loggerName, Level level, String message) {
            this.loggerName = loggerName;
            this.level = level;
            this.message = message != null ? message : "";
        }
    }

    private static final class ValidationRules {
        final LogLevel minLevel;
        final boolean disabled;
        final List<AllowLog> allows;
        final List<ExpectLog> expects;

        ValidationRules(LogLevel minLevel, boolean disabled, List<AllowLog> allows, List<ExpectLog> expects) {
            this.minLevel = minLevel;
            this.disabled = disabled;
            this.allows = List.copyOf(allows);
            this.expects = List.copyOf(expects);
        }

        boolean permits(CapturedEvent e) {
            return allows.stream().anyMatch(a -> matches(e, a.level(), a.loggerPattern(), a.messagePattern()))
                    || expects.stream().anyMatch(x -> matches(e, x.level(), x.loggerPattern(), x.messagePattern()));
        }
    }
}
