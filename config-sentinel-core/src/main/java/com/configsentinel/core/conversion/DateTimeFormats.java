package com.configsentinel.core.conversion;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Registry of date/time patterns used when a value is cast to a date/time type.
 *
 * <p>Patterns use {@link DateTimeFormatter} syntax ({@code yyyy-MM-dd}, {@code dd/MM/yyyy HH:mm}, ...)
 * and are tried in registration order; the first pattern that parses the whole text wins.
 * Parsing is strict and locale-independent: {@code 2023-02-30} is rejected rather than adjusted,
 * and month or day names are read in {@link Locale#US}. Year-of-era letters ({@code y}) are read
 * as proleptic years ({@code u}), so patterns need no era field.
 *
 * <p>The registry is append-only. Registration is safe to call concurrently with parsing:
 * readers always see a complete snapshot of the pattern list. Registering is still expected
 * to happen while the application configures itself, before validations run.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * DateTimeFormats formats = DateTimeFormats.withDefaults()
 *     .register("dd/MM/yyyy");
 *
 * Optional<LocalDate> date = formats.parse("31/12/2024", LocalDate.class);
 * }</pre>
 */
public final class DateTimeFormats {

    private static final Logger log = LoggerFactory.getLogger(DateTimeFormats.class);

    /**
     * ISO patterns registered by {@link #withDefaults()}.
     */
    public static final List<String> ISO_PATTERNS = List.of(
        "yyyy-MM-dd'T'HH:mm:ss",
        "yyyy-MM-dd'T'HH:mm:ssXXX",
        "yyyy-MM-dd'T'HH:mm",
        "yyyy-MM-dd"
    );

    private static final Set<Class<?>> DATE_TIME_TYPES = Set.of(
        LocalDate.class,
        LocalDateTime.class,
        OffsetDateTime.class
    );

    private final List<RegisteredFormat> formats = new CopyOnWriteArrayList<>();

    private DateTimeFormats() {
    }

    /**
     * Creates a registry with no patterns. Every parse fails until a pattern is registered.
     *
     * @return empty registry
     */
    public static DateTimeFormats empty() {
        return new DateTimeFormats();
    }

    /**
     * Creates a registry pre-populated with {@link #ISO_PATTERNS}.
     *
     * @return registry with ISO patterns
     */
    public static DateTimeFormats withDefaults() {
        DateTimeFormats registry = new DateTimeFormats();
        ISO_PATTERNS.forEach(registry::register);
        return registry;
    }

    /**
     * Appends a pattern to the registry. Registering a pattern twice has no effect.
     *
     * @param pattern {@link DateTimeFormatter} pattern
     * @return this registry, for chaining
     * @throws IllegalArgumentException if the pattern is blank or not a valid pattern
     */
    public synchronized DateTimeFormats register(String pattern) {
        DateTimeFormatter formatter = strictFormatter(requireValidPattern(pattern));
        if (isRegistered(pattern)) {
            return this;
        }
        formats.add(new RegisteredFormat(pattern, formatter));
        log.debug("Registered date/time pattern '{}' ({} patterns total)", pattern, formats.size());
        return this;
    }

    /**
     * Checks whether a pattern is known to this registry.
     *
     * @param pattern pattern to look up
     * @return true if the pattern was registered
     */
    public boolean isRegistered(String pattern) {
        return formats.stream().anyMatch(format -> format.pattern().equals(pattern));
    }

    /**
     * Returns the registered patterns in registration order.
     *
     * @return snapshot of the patterns
     */
    public List<String> patterns() {
        return formats.stream().map(RegisteredFormat::pattern).toList();
    }

    /**
     * Parses text into a date/time type using the first matching registered pattern.
     *
     * @param text text to parse
     * @param target one of {@link LocalDate}, {@link LocalDateTime} or {@link OffsetDateTime}
     * @param <T> target type
     * @return parsed value, or empty if no pattern matches
     */
    public <T> Optional<T> parse(String text, Class<T> target) {
        if (text == null || !isDateTimeType(target)) {
            return Optional.empty();
        }
        for (RegisteredFormat format : formats) {
            try {
                return Optional.of(target.cast(convert(format.formatter().parse(text.trim()), target)));
            } catch (DateTimeException e) {
                log.trace("Pattern '{}' does not match '{}'", format.pattern(), text);
            }
        }
        return Optional.empty();
    }

    /**
     * Checks whether a type is one of the date/time types this registry can produce.
     *
     * @param type type to check
     * @return true for supported date/time types
     */
    public static boolean isDateTimeType(Class<?> type) {
        return DATE_TIME_TYPES.contains(type);
    }

    /**
     * Checks whether text parses completely under a single pattern, independent of any registry.
     *
     * @param text text to check
     * @param pattern {@link DateTimeFormatter} pattern
     * @return true if the text matches the pattern
     * @throws IllegalArgumentException if the pattern is invalid
     */
    public static boolean matches(String text, String pattern) {
        DateTimeFormatter formatter = strictFormatter(pattern);
        try {
            formatter.parse(text);
            return true;
        } catch (DateTimeException e) {
            return false;
        }
    }

    /**
     * Checks that a pattern can be registered.
     *
     * @param pattern {@link DateTimeFormatter} pattern
     * @return the pattern
     * @throws IllegalArgumentException if the pattern is blank or not a valid pattern
     */
    public static String requireValidPattern(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("Date/time pattern must not be null or blank");
        }
        strictFormatter(pattern);
        return pattern;
    }

    private static DateTimeFormatter strictFormatter(String pattern) {
        StringBuilder proleptic = new StringBuilder(pattern.length());
        boolean quoted = false;
        for (char c : pattern.toCharArray()) {
            if (c == '\'') {
                quoted = !quoted;
            } else if (c == 'y' && !quoted) {
                c = 'u';
            }
            proleptic.append(c);
        }
        return DateTimeFormatter.ofPattern(proleptic.toString(), Locale.US)
            .withResolverStyle(ResolverStyle.STRICT);
    }

    private static Object convert(TemporalAccessor parsed, Class<?> target) {
        if (target == LocalDate.class) {
            return LocalDate.from(parsed);
        }
        if (target == LocalDateTime.class) {
            if (parsed.isSupported(ChronoField.HOUR_OF_DAY)) {
                return LocalDateTime.from(parsed);
            }
            return LocalDate.from(parsed).atStartOfDay();
        }
        return OffsetDateTime.from(parsed);
    }

    private record RegisteredFormat(String pattern, DateTimeFormatter formatter) {
    }
}
