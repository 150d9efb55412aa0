/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.config;

import java.io.IOException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;
import com.fasterxml.jackson.databind.ser.std.StdScalarSerializer;

/**
 * Jackson serde for {@link Duration}s written either in the short form used by Kubernetes tooling
 * ({@code 8760h}, {@code 1m30s}, {@code 200ms}) or as ISO-8601 ({@code PT15S}).
 */
public class DurationSerde {

    private DurationSerde() {
    }

    private record Unit(ChronoUnit unit, String groupName, String serializedUnit) {}

    private static final List<Unit> UNITS = List.of(new Unit(ChronoUnit.DAYS, "days", "d"),
            new Unit(ChronoUnit.HOURS, "hours", "h"),
            new Unit(ChronoUnit.MINUTES, "minutes", "m"),
            new Unit(ChronoUnit.SECONDS, "seconds", "s"),
            new Unit(ChronoUnit.MILLIS, "millis", "ms"));

    // micros and nanos are not meaningful for any of our timeouts
    private static final Pattern PATTERN = Pattern.compile("(?:(?<days>\\d+)d)?(?:(?<hours>\\d+)h)?(?:(?<minutes>\\d+)m)?"
            + "(?:(?<seconds>\\d+)s)?(?:(?<millis>\\d+)ms)?");

    private static final String USAGE = "Expected a duration such as \"8760h\", \"1m30s\", \"200ms\" or \"PT15S\"; supported units are d, h, m, s and ms.";

    /**
     * Parses a duration string.
     * @param text the duration
     * @return the parsed duration
     * @throws IllegalArgumentException if the text is not a duration
     */
    public static Duration parse(String text) {
        if (text.isBlank()) {
            throw new IllegalArgumentException("Invalid duration string: '" + text + "'. " + USAGE);
        }
        if (text.startsWith("P") || text.startsWith("-P")) {
            try {
                return Duration.parse(text);
            }
            catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid duration string: '" + text + "'. " + USAGE, e);
            }
        }
        Matcher matcher = PATTERN.matcher(text);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid duration string: '" + text + "'. " + USAGE);
        }
        Duration result = Duration.ZERO;
        for (Unit unit : UNITS) {
            String amount = matcher.group(unit.groupName());
            if (amount != null) {
                try {
                    result = result.plus(Duration.of(Long.parseLong(amount), unit.unit()));
                }
                catch (NumberFormatException | ArithmeticException e) {
                    throw new IllegalArgumentException("Invalid duration string: '" + text + "'. It is too large to be converted to a Duration", e);
                }
            }
        }
        return result;
    }

    /**
     * Formats a duration in the short form, e.g. {@code 1h30m}.
     */
    public static String format(Duration value) {
        if (value.isZero()) {
            return "0ms";
        }
        if (value.isNegative()) {
            return value.toString();
        }
        StringBuilder result = new StringBuilder();
        Duration remaining = value;
        for (Unit unit : UNITS) {
            long wholeUnits = remaining.dividedBy(unit.unit().getDuration());
            remaining = remaining.minus(wholeUnits, unit.unit());
            if (wholeUnits != 0) {
                result.append(wholeUnits).append(unit.serializedUnit());
            }
        }
        return result.toString();
    }

    public static class Deserializer extends StdScalarDeserializer<Duration> {

        public Deserializer() {
            super(Duration.class);
        }

        @Override
        public Duration deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (!p.hasToken(JsonToken.VALUE_STRING)) {
                throw new JsonParseException(p, "Invalid serialized duration. Expected a string value, but was " + p.currentToken());
            }
            try {
                return parse(p.getText());
            }
            catch (IllegalArgumentException e) {
                throw new JsonParseException(p, e.getMessage(), e);
            }
        }
    }

    public static class Serializer extends StdScalarSerializer<Duration> {

        public Serializer() {
            super(Duration.class);
        }

        @Override
        public void serialize(Duration value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeString(format(value));
        }
    }
}
