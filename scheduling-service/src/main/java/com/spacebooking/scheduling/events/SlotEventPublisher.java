package com.spacebooking.scheduling.events;

import com.spacebooking.common.util.Constants;
import com.spacebooking.scheduling.domain.interval.Intervals;
import com.spacebooking.scheduling.domain.interval.TimeInterval;
import com.spacebooking.scheduling.domain.model.Slot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Kafka publisher for slot lifecycle events, consumed by notification and audit services.
 * <p>
 * Events published:
 * - SlotsCommittedEvent: interval committed to a booking
 * - SlotsReleasedEvent: a booking's slots returned to supply
 * <p>
 * Called after the slot transaction has committed. Publishing is best effort: failures are logged
 * and never undo the slot change.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SlotEventPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;

    @Value("${scheduling.events.enabled:true}")
    private boolean eventsEnabled;

    public void publishSlotsCommitted(String resourceId, TimeInterval interval, String bookingId, List<Slot> slots) {
        SlotsCommittedEvent event = SlotsCommittedEvent.builder()
                .resourceId(resourceId)
                .date(interval.date())
                .startTime(Intervals.formatMinutes(interval.startMinute()))
                .endTime(Intervals.formatMinutes(interval.endMinute()))
                .bookingId(bookingId)
                .slotIds(slots.stream().map(Slot::getId).toList())
                .timestamp(Instant.now())
                .build();

        publishEvent(Constants.TOPIC_SLOTS_COMMITTED, resourceId, event);
    }

    public void publishSlotsReleased(String resourceId, TimeInterval interval, String bookingId, List<Slot> slots) {
        SlotsReleasedEvent event = SlotsReleasedEvent.builder()
                .resourceId(resourceId)
                .date(interval.date())
                .bookingId(bookingId)
                .slotIds(slots.stream().map(Slot::getId).toList())
                .timestamp(Instant.now())
                .build();

        publishEvent(Constants.TOPIC_SLOTS_RELEASED, resourceId, event);
    }

    private void publishEvent(String topic, String key, Object event) {
        if (!eventsEnabled) {
            return;
        }
        log.info("Publishing event to topic {}: {}", topic, event);

        CompletableFuture<SendResult<String, Object>> future;
        try {
            future = kafkaTemplate.send(topic, key, event);
        } catch (RuntimeException e) {
            log.warn("Failed to hand event to Kafka for topic {} (slot change already committed)", topic, e);
            return;
        }

        future.whenComplete((result, ex) -> {
            if (ex == null) {
                log.info("Event published successfully to topic {}: offset={}",
                        topic, result.getRecordMetadata().offset());
            } else {
                log.error("Failed to publish event to topic {}", topic, ex);
            }
        });
    }
}
