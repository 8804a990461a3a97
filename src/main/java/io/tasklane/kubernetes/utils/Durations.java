package io.tasklane.kubernetes.utils;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Duration strings in the format used by Kubernetes objects, e.g. {@code 10s}, {@code 1h0m0s},
 * {@code 1.5h} or {@code 300ms}.
 */
abstract public class Durations {
    private static final Pattern COMPONENT = Pattern.compile("(\\d+(?:\\.\\d*)?|\\.\\d+)(ns|us|µs|ms|s|m|h)");

    private static final Map<String, Long> UNITS = Map.of(
        "ns", 1L,
        "us", 1_000L,
        "µs", 1_000L,
        "ms", 1_000_000L,
        "s", 1_000_000_000L,
        "m", 60_000_000_000L,
        "h", 3_600_000_000_000L
    );

    public static Duration parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Invalid duration: empty string");
        }

        String text = value.trim();
        boolean negative = false;
        if (text.startsWith("-") || text.startsWith("+")) {
            negative = text.startsWith("-");
            text = text.substring(1);
        }

        if (text.equals("0")) {
            return Duration.ZERO;
        }

        Matcher matcher = COMPONENT.matcher(text);
        BigDecimal nanos = BigDecimal.ZERO;
        int position = 0;

        while (matcher.find()) {
            if (matcher.start() != position) {
                throw new IllegalArgumentException("Invalid duration: '" + value + "'");
            }

            nanos = nanos.add(new BigDecimal(matcher.group(1)).multiply(BigDecimal.valueOf(UNITS.get(matcher.group(2)))));
            position = matcher.end();
        }

        if (position == 0 || position != text.length()) {
            throw new IllegalArgumentException("Invalid duration: '" + value + "'");
        }

        Duration duration = Duration.ofNanos(nanos.longValue());
        return negative ? duration.negated() : duration;
    }

    public static String format(Duration duration) {
        if (duration.isZero()) {
            return "0s";
        }

        if (duration.isNegative()) {
            return "-" + format(duration.negated());
        }

        if (duration.compareTo(Duration.ofSeconds(1)) < 0) {
            long nanos = duration.toNanos();
            if (nanos < 1_000) {
                return nanos + "ns";
            }

            if (nanos < 1_000_000) {
                return decimal(BigDecimal.valueOf(nanos).movePointLeft(3)) + "µs";
            }

            return decimal(BigDecimal.valueOf(nanos).movePointLeft(6)) + "ms";
        }

        long hours = duration.toHours();
        int minutes = duration.toMinutesPart();
        BigDecimal seconds = BigDecimal.valueOf(duration.toSecondsPart())
            .add(BigDecimal.valueOf(duration.toNanosPart()).movePointLeft(9));

        StringBuilder builder = new StringBuilder();
        if (hours > 0) {
            builder.append(hours).append("h");
        }

        if (hours > 0 || minutes > 0) {
            builder.append(minutes).append("m");
        }

        return builder.append(decimal(seconds)).append("s").toString();
    }

    private static String decimal(BigDecimal value) {
        if (value.signum() == 0) {
            return "0";
        }

        return value.stripTrailingZeros().toPlainString();
    }
}
