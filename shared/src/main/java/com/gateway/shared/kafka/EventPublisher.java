package com.gateway.shared.kafka;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gateway.shared.events.DomainEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;

/**
 * Kafka producer for domain events.
 *
 * Wraps Spring's KafkaTemplate with:
 *  - JSON serialization of the event
 *  - Event metadata propagated as Kafka headers
 *  - Publish rate and latency metrics
 *
 * The partition key decides ordering: events sharing a key land on one partition.
 */
@Slf4j
public class EventPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final Counter publishSuccessCounter;
    private final Counter publishErrorCounter;
    private final Timer publishTimer;

    public EventPublisher(KafkaTemplate<String, String> kafkaTemplate,
                          ObjectMapper objectMapper,
                          MeterRegistry meterRegistry) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.publishSuccessCounter = Counter.builder("kafka.messages.published")
                .tag("status", "success")
                .description("Total Kafka messages published successfully")
                .register(meterRegistry);
        this.publishErrorCounter = Counter.builder("kafka.messages.published")
                .tag("status", "error")
                .description("Total Kafka message publish failures")
                .register(meterRegistry);
        this.publishTimer = Timer.builder("kafka.publish.duration")
                .description("Time to publish a message to Kafka")
                .register(meterRegistry);
    }

    /**
     * Publish a domain event to the given topic.
     *
     * @param topic        Kafka topic name (use EventTypes constants)
     * @param event        the event to serialize
     * @param partitionKey key that keeps related events ordered
     * @return future completed when the broker acknowledges
     */
    public CompletableFuture<SendResult<String, String>> publish(String topic, DomainEvent event, String partitionKey) {
        Timer.Sample sample = Timer.start();
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize event: eventId={}, type={}", event.getId(), event.getType(), e);
            publishErrorCounter.increment();
            return CompletableFuture.failedFuture(new EventPublishException("Failed to serialize event " + event.getId(), e));
        }

        ProducerRecord<String, String> record = new ProducerRecord<>(topic, partitionKey, payload);
        record.headers()
                .add(new RecordHeader("event-type", event.getType().getBytes(StandardCharsets.UTF_8)))
                .add(new RecordHeader("event-id", event.getId().getBytes(StandardCharsets.UTF_8)))
                .add(new RecordHeader("correlation-id", event.getCorrelationId().getBytes(StandardCharsets.UTF_8)));

        return kafkaTemplate.send(record)
                .whenComplete((result, ex) -> {
                    sample.stop(publishTimer);
                    if (ex == null) {
                        publishSuccessCounter.increment();
                        log.debug("Event published: topic={}, eventId={}, type={}, key={}, partition={}, offset={}",
                                topic, event.getId(), event.getType(), partitionKey,
                                result.getRecordMetadata().partition(),
                                result.getRecordMetadata().offset());
                    } else {
                        publishErrorCounter.increment();
                        log.error("Failed to publish event: topic={}, eventId={}, type={}, error={}",
                                topic, event.getId(), event.getType(), ex.getMessage(), ex);
                    }
                });
    }

    public static class EventPublishException extends RuntimeException {
        public EventPublishException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
