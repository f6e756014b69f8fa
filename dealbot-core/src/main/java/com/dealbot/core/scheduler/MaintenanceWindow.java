package com.dealbot.core.scheduler;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Daily UTC windows during which no deal or retrieval work is started. Each window opens at a
 * configured {@code HH:MM} and lasts the same number of minutes; a window may run past midnight.
 */
@Component
public class MaintenanceWindow {

    private static final Pattern TIME_PATTERN = Pattern.compile("^([01]\\d|2[0-3]):([0-5]\\d)$");
    private static final int MINUTES_PER_DAY = 24 * 60;

    private final List<Start> starts;
    private final int durationMinutes;

    @Autowired
    public MaintenanceWindow(
            @Value("${dealbot.scheduling.maintenance-windows-utc:}") String windowsUtc,
            @Value("${dealbot.scheduling.maintenance-window-minutes:20}") int durationMinutes) {
        this(Arrays.asList(windowsUtc.split(",")), durationMinutes);
    }

    public MaintenanceWindow(List<String> windowsUtc, int durationMinutes) {
        this.starts = parse(windowsUtc);
        this.durationMinutes = durationMinutes;
    }

    /** A window opening at {@code HH:MM} UTC. */
    public record Start(String label, int startMinutes) {
    }

    /** An open window and the instant it closes. */
    public record Active(Start window, int durationMinutes, Instant resumeAt) {
    }

    /**
     * Parses {@code HH:MM} entries. Blank entries are skipped.
     *
     * @throws IllegalArgumentException for anything else that is not a 24h time
     */
    static List<Start> parse(List<String> windowsUtc) {
        List<Start> parsed = new ArrayList<>();
        for (String raw : windowsUtc) {
            String value = raw.trim();
            if (value.isEmpty()) {
                continue;
            }
            Matcher matcher = TIME_PATTERN.matcher(value);
            if (!matcher.matches()) {
                throw new IllegalArgumentException("Invalid maintenance window time \"" + raw
                    + "\". Expected HH:MM in 24h UTC (e.g., \"07:00\").");
            }
            int hours = Integer.parseInt(matcher.group(1));
            int minutes = Integer.parseInt(matcher.group(2));
            parsed.add(new Start(value, hours * 60 + minutes));
        }
        return List.copyOf(parsed);
    }

    /**
     * The first configured window open at {@code now}, if any.
     */
    public Optional<Active> activeAt(Instant now) {
        if (starts.isEmpty() || durationMinutes <= 0) {
            return Optional.empty();
        }
        ZonedDateTime utc = now.atZone(ZoneOffset.UTC);
        LocalTime time = utc.toLocalTime();
        double nowMinutes = time.getHour() * 60 + time.getMinute() + time.getSecond() / 60.0;
        Instant startOfDay = utc.truncatedTo(ChronoUnit.DAYS).toInstant();

        for (Start window : starts) {
            int start = window.startMinutes();
            int end = start + durationMinutes;
            if (end < MINUTES_PER_DAY) {
                if (nowMinutes >= start && nowMinutes < end) {
                    return Optional.of(new Active(window, durationMinutes, startOfDay.plus(Duration.ofMinutes(end))));
                }
            } else {
                int wrappedEnd = end - MINUTES_PER_DAY;
                if (nowMinutes >= start) {
                    Instant resumeAt = startOfDay.plus(Duration.ofDays(1)).plus(Duration.ofMinutes(wrappedEnd));
                    return Optional.of(new Active(window, durationMinutes, resumeAt));
                }
                if (nowMinutes < wrappedEnd) {
                    return Optional.of(new Active(window, durationMinutes, startOfDay.plus(Duration.ofMinutes(wrappedEnd))));
                }
            }
        }
        return Optional.empty();
    }

    public List<Start> getStarts() {
        return starts;
    }

    public int getDurationMinutes() {
        return durationMinutes;
    }
}
