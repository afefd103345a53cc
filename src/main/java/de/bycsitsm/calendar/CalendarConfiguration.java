package de.bycsitsm.calendar;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Provides the clock every calendar component reads "now" and "today" from.
 */
@Configuration
class CalendarConfiguration {

    @Bean
    Clock calendarClock(CalendarProperties properties) {
        return Clock.system(properties.zoneId());
    }
}
