package com.slotbook.booking.events;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes settled bookings to Kafka for receipt rendering and notifications.
 * Delivery is fire-and-forget: the booking is already paid when this runs.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingEventPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;

    @Value("${booking.events.settled-topic:booking-settled}")
    private String settledTopic;

    public void publishBookingSettled(BookingSettledEvent event) {
        publishEvent(settledTopic, String.valueOf(event.getBookingId()), event);
    }

    private void publishEvent(String topic, String key, Object event) {
        log.info("Publishing event to topic {}: {}", topic, event);

        CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, key, event);

        future.whenComplete((result, ex) -> {
            if (ex == null) {
                log.info("Event published to topic {}: key={}, offset={}",
                        topic, key, result.getRecordMetadata().offset());
            } else {
                log.error("Failed to publish event to topic {} for key {}", topic, key, ex);
            }
        });
    }
}
