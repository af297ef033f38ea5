package com.slotbook.booking.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Clock in the venues' local zone. "Today" for past-date checks and hold expiry is
 * decided here, never from the client.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock clock(@Value("${booking.zone-id:Asia/Kolkata}") String zoneId) {
        return Clock.system(ZoneId.of(zoneId));
    }
}
