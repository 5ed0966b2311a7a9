package com.confluencesentinel.monitor;

import com.confluencesentinel.core.alert.AlertDeliveryException;
import com.confluencesentinel.core.alert.AlertPayload;
import com.confluencesentinel.core.alert.AlertSink;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes alerts as JSON to a Kafka topic, keyed by scope key.
 *
 * <p>
 * {@link #deliver(AlertPayload)} blocks until the broker acknowledges the
 * record or the send timeout elapses. Retries happen inside the producer
 * (idempotent, {@code acks=all}); anything that still fails is reported as
 * an {@link AlertDeliveryException}.
 * </p>
 *
 * @since 1.0.0
 */
public class KafkaAlertSink implements AlertSink {

    private static final Logger LOG = LoggerFactory.getLogger(KafkaAlertSink.class);

    private final Producer<String, AlertPayload> producer;
    private final String topic;
    private final Duration sendTimeout;

    /**
     * @param producerProperties connection and delivery settings, see
     *                           {@link ServiceConfig#kafkaProducerProperties()}
     * @param topic              alerts topic
     */
    public KafkaAlertSink(Properties producerProperties, String topic) {
        this(new KafkaProducer<>(producerProperties, new StringSerializer(), new AlertPayloadSerializer()),
                topic, Duration.ofSeconds(30));
    }

    KafkaAlertSink(Producer<String, AlertPayload> producer, String topic, Duration sendTimeout) {
        this.producer = Objects.requireNonNull(producer, "producer must not be null");
        this.topic = Objects.requireNonNull(topic, "topic must not be null");
        this.sendTimeout = Objects.requireNonNull(sendTimeout, "sendTimeout must not be null");
    }

    @Override
    public void deliver(AlertPayload payload) throws AlertDeliveryException {
        ProducerRecord<String, AlertPayload> record = new ProducerRecord<>(topic, payload.getScopeKey(), payload);
        try {
            RecordMetadata metadata = producer.send(record).get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
            LOG.debug("Alert {} published to {}-{}@{}",
                    payload.getScopeKey(), metadata.topic(), metadata.partition(), metadata.offset());
        } catch (ExecutionException e) {
            throw new AlertDeliveryException("Kafka rejected alert for " + payload.getScopeKey()
                    + ": " + e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            throw new AlertDeliveryException("No ack for alert " + payload.getScopeKey()
                    + " within " + sendTimeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AlertDeliveryException("Interrupted publishing alert " + payload.getScopeKey(), e);
        } catch (KafkaException e) {
            throw new AlertDeliveryException("Failed to publish alert " + payload.getScopeKey()
                    + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        producer.close(Duration.ofSeconds(10));
        LOG.info("Kafka alert sink closed");
    }
}
