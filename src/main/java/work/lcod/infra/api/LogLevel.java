package work.lcod.infra.api;

import ch.qos.logback.classic.Level;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import org.slf4j.LoggerFactory;

/**
 * Operator log levels of a run, each backed by a Logback level. Template problems are never logged
 * here; they travel as diagnostics in the {@link RunResult}.
 */
public enum LogLevel {
    TRACE(Level.TRACE),
    DEBUG(Level.DEBUG),
    INFO(Level.INFO),
    WARN(Level.WARN, "warning"),
    ERROR(Level.ERROR),
    OFF(Level.OFF, "none", "quiet");

    static final String ROOT_LOGGER = "work.lcod.infra";

    private final Level logbackLevel;
    private final List<String> aliases;

    LogLevel(Level logbackLevel, String... aliases) {
        this.logbackLevel = logbackLevel;
        this.aliases = List.of(aliases);
    }

    public Level logbackLevel() {
        return logbackLevel;
    }

    /**
     * Sets the level of every runtime logger. No-op when SLF4J is bound to something other than Logback.
     */
    public void apply() {
        if (LoggerFactory.getLogger(ROOT_LOGGER) instanceof ch.qos.logback.classic.Logger logback) {
            logback.setLevel(logbackLevel);
        }
    }

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return WARN;
        }
        var wanted = value.trim().toLowerCase(Locale.ROOT);
        for (var level : values()) {
            if (level.name().toLowerCase(Locale.ROOT).equals(wanted) || level.aliases.contains(wanted)) {
                return level;
            }
        }
        var known = Arrays.stream(values()).map(l -> l.name().toLowerCase(Locale.ROOT)).collect(Collectors.joining(", "));
        throw new IllegalArgumentException(String.format("unknown log level '%s'; expected one of %s", value, known));
    }
}
