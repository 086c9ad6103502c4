package com.easycashflows.domain.model;

import com.easycashflows.domain.enums.TimingType;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.DayOfWeek;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Timing block of a notification rule as stored in jsonb. {@code schedule_days} holds day numbers
 * with 0 for Sunday through 6 for Saturday; day names in any case are read as well.
 */
public record NotificationTiming(
        TimingType type,
        @JsonProperty("schedule_days") Set<DayOfWeek> scheduleDays,
        @JsonProperty("schedule_time") String scheduleTime,
        @JsonProperty("delay_minutes") Integer delayMinutes
) {

    public static NotificationTiming immediate() {
        return new NotificationTiming(TimingType.IMMEDIATE, null, null, null);
    }

    /**
     * Unknown timing types read as {@code null}; unreadable day entries are dropped.
     */
    @JsonCreator
    public static NotificationTiming fromJson(
            @JsonProperty("type") String type,
            @JsonProperty("schedule_days") JsonNode scheduleDays,
            @JsonProperty("schedule_time") String scheduleTime,
            @JsonProperty("delay_minutes") Integer delayMinutes
    ) {
        return new NotificationTiming(TimingType.fromWire(type), readDays(scheduleDays), scheduleTime, delayMinutes);
    }

    private static Set<DayOfWeek> readDays(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        if (node.isArray()) {
            node.forEach(element -> addDay(element, days));
        } else {
            addDay(node, days);
        }
        return days;
    }

    private static void addDay(JsonNode element, Set<DayOfWeek> days) {
        if (element.isIntegralNumber()) {
            addDayNumber(element.asInt(), days);
            return;
        }
        if (!element.isTextual()) {
            return;
        }
        String text = element.asText().trim();
        if (text.isEmpty()) {
            return;
        }
        if (text.chars().allMatch(Character::isDigit)) {
            addDayNumber(Integer.parseInt(text), days);
            return;
        }
        for (DayOfWeek day : DayOfWeek.values()) {
            if (day.name().equals(text.toUpperCase(Locale.ROOT))) {
                days.add(day);
                return;
            }
        }
    }

    private static void addDayNumber(int number, Set<DayOfWeek> days) {
        if (number == 0) {
            days.add(DayOfWeek.SUNDAY);
        } else if (number >= 1 && number <= 6) {
            days.add(DayOfWeek.of(number));
        }
    }
}
