package com.example.webvttlayer.parser;

/**
 * A cue timestamp, always held in normalized form.
 * <p>
 * The presentation value is the whole timestamp expressed in milliseconds,
 * which is what the ordering and arithmetic operate on.
 */
public record Time(int hours, int minutes, int seconds, int milliseconds) implements Comparable<Time> {

    public static final Time ZERO = new Time(0, 0, 0, 0);

    private static final long MILLIS_PER_SECOND = 1000L;
    private static final long MILLIS_PER_MINUTE = 60L * MILLIS_PER_SECOND;
    private static final long MILLIS_PER_HOUR = 60L * MILLIS_PER_MINUTE;

    public Time {
        if (hours < 0) {
            throw new IllegalArgumentException("Hours must not be negative: " + hours);
        }
        if (minutes < 0 || minutes > 59) {
            throw new IllegalArgumentException("Minutes out of range: " + minutes);
        }
        if (seconds < 0 || seconds > 59) {
            throw new IllegalArgumentException("Seconds out of range: " + seconds);
        }
        if (milliseconds < 0 || milliseconds > 999) {
            throw new IllegalArgumentException("Milliseconds out of range: " + milliseconds);
        }
    }

    /**
     * Converts a millisecond count back into a timestamp.
     * Negative counts give {@link #ZERO}.
     *
     * @throws IllegalArgumentException if the hour count does not fit in an int
     */
    public static Time ofPresentation(long millis) {
        if (millis <= 0) {
            return ZERO;
        }
        long totalHours = millis / MILLIS_PER_HOUR;
        if (totalHours > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Time out of range: " + millis + " ms");
        }
        int hours = (int) totalHours;
        long rest = millis % MILLIS_PER_HOUR;
        int minutes = (int) (rest / MILLIS_PER_MINUTE);
        rest %= MILLIS_PER_MINUTE;
        int seconds = (int) (rest / MILLIS_PER_SECOND);
        int milliseconds = (int) (rest % MILLIS_PER_SECOND);
        return new Time(hours, minutes, seconds, milliseconds);
    }

    /**
     * Builds a timestamp from a plain seconds count, carrying the overflow
     * into minutes and hours.
     */
    static Time ofSeconds(int totalSeconds, int milliseconds) {
        int minutes = totalSeconds / 60;
        int seconds = totalSeconds - minutes * 60;
        int hours = minutes / 60;
        minutes -= hours * 60;
        return new Time(hours, minutes, seconds, milliseconds);
    }

    /**
     * Total duration in milliseconds.
     */
    public long presentation() {
        return hours * MILLIS_PER_HOUR
                + minutes * MILLIS_PER_MINUTE
                + seconds * MILLIS_PER_SECOND
                + milliseconds;
    }

    /**
     * Shifts this time by a (possibly negative) number of milliseconds.
     * Results before zero clamp to {@link #ZERO}.
     *
     * @throws IllegalArgumentException if the result is too large to represent
     */
    public Time plus(long millis) {
        long sum;
        try {
            sum = Math.addExact(presentation(), millis);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Offset " + millis + " ms overflows " + this, e);
        }
        return ofPresentation(sum);
    }

    public Time minus(long millis) {
        if (millis == Long.MIN_VALUE) {
            throw new IllegalArgumentException("Offset " + millis + " ms cannot be negated");
        }
        return plus(-millis);
    }

    /**
     * Signed distance from {@code other} to this time, in milliseconds.
     */
    public long minus(Time other) {
        return presentation() - other.presentation();
    }

    public boolean isBefore(Time other) {
        return compareTo(other) < 0;
    }

    public boolean isAfter(Time other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(Time other) {
        return Long.compare(presentation(), other.presentation());
    }

    /**
     * Formats as {@code HH:MM:SS.mmm}.
     */
    @Override
    public String toString() {
        return String.format("%02d:%02d:%02d.%03d", hours, minutes, seconds, milliseconds);
    }
}
