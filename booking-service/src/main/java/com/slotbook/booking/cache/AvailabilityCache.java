package com.slotbook.booking.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.slotbook.booking.api.dto.AvailabilityResponse;
import com.slotbook.common.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Short-lived Redis copy of computed availability per (venue, date).
 *
 * Entries live for {@code booking.availability.cache-ttl-seconds} at most and are evicted
 * after every settlement, so readers never see a sold slot as open for longer than the TTL.
 * Redis is optional: any failure falls back to computing from the database.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AvailabilityCache {

    private final ObjectMapper objectMapper;

    @Autowired(required = false)
    private StringRedisTemplate stringRedisTemplate;

    @Value("${booking.availability.cache-enabled:true}")
    private boolean cacheEnabled;

    @Value("${booking.availability.cache-ttl-seconds:5}")
    private long ttlSeconds;

    public Optional<AvailabilityResponse> get(Long venueId, String date) {
        if (!isActive()) return Optional.empty();
        try {
            String json = stringRedisTemplate.opsForValue().get(key(venueId, date));
            if (json == null) return Optional.empty();
            return Optional.of(objectMapper.readValue(json, AvailabilityResponse.class));
        } catch (Exception e) {
            log.debug("Availability cache read failed for venue {} on {}, computing: {}", venueId, date, e.getMessage());
            return Optional.empty();
        }
    }

    public void put(AvailabilityResponse availability) {
        if (!isActive()) return;
        try {
            stringRedisTemplate.opsForValue().set(key(availability.venueId(), availability.date()),
                    objectMapper.writeValueAsString(availability), Duration.ofSeconds(ttlSeconds));
        } catch (Exception e) {
            log.warn("Failed to cache availability for venue {} on {} (non-fatal)",
                    availability.venueId(), availability.date(), e);
        }
    }

    public void evict(Long venueId, String date) {
        if (!isActive()) return;
        try {
            stringRedisTemplate.delete(key(venueId, date));
        } catch (Exception e) {
            log.warn("Failed to evict availability for venue {} on {}; entry expires within {}s",
                    venueId, date, ttlSeconds, e);
        }
    }

    private boolean isActive() {
        return cacheEnabled && stringRedisTemplate != null;
    }

    private static String key(Long venueId, String date) {
        return Constants.CACHE_AVAILABILITY_PREFIX + venueId + ":" + date;
    }
}
