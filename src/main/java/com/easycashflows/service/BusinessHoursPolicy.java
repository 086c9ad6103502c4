package com.easycashflows.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZonedDateTime;

/**
 * Office hours: Monday to Friday, 09:00 inclusive to 18:00 exclusive, in the clock's zone.
 */
@Component
@RequiredArgsConstructor
public class BusinessHoursPolicy {

    static final int OPENING_HOUR = 9;
    static final int CLOSING_HOUR = 18;

    private static final String OPEN_MESSAGE = "Siamo online! Il nostro team ti risponderà a breve.";
    private static final String CLOSED_MESSAGE = "Grazie per il tuo messaggio! Il nostro orario di ufficio è "
            + "Lun-Ven 9:00-18:00. Ti ricontatteremo appena possibile.";

    private final Clock clock;

    public boolean isOpen() {
        return isOpen(ZonedDateTime.now(clock));
    }

    public boolean isOpen(ZonedDateTime at) {
        DayOfWeek day = at.getDayOfWeek();
        int hour = at.getHour();
        return day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY
                && hour >= OPENING_HOUR && hour < CLOSING_HOUR;
    }

    public ZonedDateTime nextBusinessDay() {
        return nextBusinessDay(ZonedDateTime.now(clock));
    }

    public ZonedDateTime nextBusinessDay(ZonedDateTime now) {
        int daysAhead = switch (now.getDayOfWeek()) {
            case FRIDAY -> now.getHour() >= CLOSING_HOUR ? 3 : 0;
            case SATURDAY -> 2;
            case SUNDAY -> 1;
            default -> now.getHour() >= CLOSING_HOUR ? 1 : 0;
        };
        return now.plusDays(daysAhead)
                .with(LocalTime.of(OPENING_HOUR, 0));
    }

    public String statusMessage() {
        return isOpen() ? OPEN_MESSAGE : CLOSED_MESSAGE;
    }
}
