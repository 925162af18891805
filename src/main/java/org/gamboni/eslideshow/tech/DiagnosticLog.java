package org.gamboni.eslideshow.tech;

import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.FormattingTuple;
import org.slf4j.helpers.MessageFormatter;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

import static java.util.stream.Collectors.joining;

/** Collects player initialisation and playback events so they can be shown to the user when
 * the player fails to start. Every entry is also forwarded to the SLF4J logger of its component.
 */
public class DiagnosticLog {
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss.SSS")
            .withZone(ZoneId.systemDefault());

    /** Entries beyond this count push out the oldest ones. */
    private static final int CAPACITY = 2000;

    private final Clock clock;
    private final List<Entry> entries = new ArrayList<>();

    public DiagnosticLog() {
        this(Clock.systemDefaultZone());
    }

    public DiagnosticLog(Clock clock) {
        this.clock = clock;
    }

    public record Entry(Instant timestamp, String source, String message) {
        public String format() {
            return "[" + TIME_FORMAT.format(timestamp) + "] [" + source + "] " + message;
        }
    }

    /** Return a logger tagging its entries with the simple name of the given class. */
    public Component forComponent(Class<?> component) {
        return new Component(component.getSimpleName(), LoggerFactory.getLogger(component));
    }

    public synchronized List<Entry> entries() {
        return ImmutableList.copyOf(entries);
    }

    public synchronized String formatted() {
        if (entries.isEmpty()) {
            return "No logs available";
        }
        return entries.stream()
                .map(Entry::format)
                .collect(joining("\n"));
    }

    public synchronized void clear() {
        entries.clear();
    }

    private synchronized void append(String source, String message) {
        if (entries.size() == CAPACITY) {
            entries.remove(0);
        }
        entries.add(new Entry(clock.instant(), source, message));
    }

    /** Shorten a credential to a prefix that is safe to log. */
    public static String redact(String credential) {
        if (credential == null) {
            return "(none)";
        }
        return credential.substring(0, Math.min(6, credential.length())) + "…";
    }

    public class Component {
        private final String source;
        private final Logger logger;

        private Component(String source, Logger logger) {
            this.source = source;
            this.logger = logger;
        }

        public void info(String format, Object... args) {
            FormattingTuple tuple = MessageFormatter.arrayFormat(format, args);
            logger.info(tuple.getMessage());
            append(source, tuple.getMessage());
        }

        public void warn(String format, Object... args) {
            FormattingTuple tuple = MessageFormatter.arrayFormat(format, args);
            logger.warn(tuple.getMessage(), tuple.getThrowable());
            append(source, "WARNING: " + tuple.getMessage());
        }

        public void error(String format, Object... args) {
            FormattingTuple tuple = MessageFormatter.arrayFormat(format, args);
            logger.error(tuple.getMessage(), tuple.getThrowable());
            append(source, "ERROR: " + tuple.getMessage());
        }

        /** Log to SLF4J only: for chatty traffic that would drown the user-facing log. */
        public void debug(String format, Object... args) {
            logger.debug(format, args);
        }
    }
}
