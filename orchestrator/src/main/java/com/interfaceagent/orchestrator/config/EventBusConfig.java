package com.interfaceagent.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.interfaceagent.orchestrator.event.DomainEvent;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.support.serializer.ErrorHandlingDeserializer;
import org.springframework.kafka.support.serializer.JsonDeserializer;
import org.springframework.kafka.support.serializer.JsonSerializer;
import org.springframework.util.backoff.FixedBackOff;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka wiring for the event bus.
 * <ul>
 *   <li>Idempotent JSON producer with {@code acks=all}; publish waits for the acknowledgement.</li>
 *   <li>JSON consumer with manual offset commits per record, so an event is only
 *       committed after every consumer has handled it.</li>
 *   <li>Three redelivery attempts one second apart, then the record goes to
 *       {@code <topic>.DLT}.</li>
 * </ul>
 * Connection settings come from the standard {@code spring.kafka.*} keys.
 */
@Configuration
public class EventBusConfig {

    private final KafkaProperties kafkaProperties;
    private final ObjectMapper    objectMapper;

    public EventBusConfig(KafkaProperties kafkaProperties, ObjectMapper objectMapper) {
        this.kafkaProperties = kafkaProperties;
        this.objectMapper    = objectMapper;
    }

    // ------------------------------------------------------------------
    // Producer
    // ------------------------------------------------------------------

    @Bean
    public ProducerFactory<String, DomainEvent> eventProducerFactory() {
        Map<String, Object> props = new HashMap<>(kafkaProperties.buildProducerProperties(null));
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, 5);
        props.put(ProducerConfig.RETRIES_CONFIG, Integer.MAX_VALUE);
        props.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, 30000);
        props.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, 10000);
        props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, 5000);

        JsonSerializer<DomainEvent> valueSerializer = new JsonSerializer<>(objectMapper);
        valueSerializer.setAddTypeInfo(false);
        return new DefaultKafkaProducerFactory<>(props, new StringSerializer(), valueSerializer);
    }

    @Bean
    public KafkaTemplate<String, DomainEvent> eventKafkaTemplate(ProducerFactory<String, DomainEvent> eventProducerFactory) {
        KafkaTemplate<String, DomainEvent> template = new KafkaTemplate<>(eventProducerFactory);
        template.setObservationEnabled(true);
        return template;
    }

    // ------------------------------------------------------------------
    // Consumer
    // ------------------------------------------------------------------

    @Bean
    public ConsumerFactory<String, DomainEvent> eventConsumerFactory() {
        Map<String, Object> props = new HashMap<>(kafkaProperties.buildConsumerProperties(null));
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.ISOLATION_LEVEL_CONFIG, "read_committed");

        JsonDeserializer<DomainEvent> json = new JsonDeserializer<>(DomainEvent.class, objectMapper, false);
        return new DefaultKafkaConsumerFactory<>(props,
                new ErrorHandlingDeserializer<>(new StringDeserializer()),
                new ErrorHandlingDeserializer<>(json));
    }

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, DomainEvent> kafkaListenerContainerFactory(
            ConsumerFactory<String, DomainEvent> eventConsumerFactory,
            KafkaTemplate<String, DomainEvent> eventKafkaTemplate,
            @Value("${interface-agent.events.listener-concurrency:3}") int concurrency) {
        ConcurrentKafkaListenerContainerFactory<String, DomainEvent> factory =
                new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(eventConsumerFactory);
        factory.setConcurrency(concurrency);
        factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.RECORD);
        factory.getContainerProperties().setObservationEnabled(true);
        factory.setCommonErrorHandler(new DefaultErrorHandler(
                new DeadLetterPublishingRecoverer(eventKafkaTemplate),
                new FixedBackOff(1000L, 3)));
        return factory;
    }

    // ------------------------------------------------------------------
    // Topics
    // ------------------------------------------------------------------

    @Bean
    public NewTopic eventsTopic(@Value("${interface-agent.events.topic:interface-agent.events}") String topic,
                                @Value("${interface-agent.events.partitions:6}") int partitions) {
        return TopicBuilder.name(topic)
                .partitions(partitions)
                .replicas(1)
                .config("retention.ms", "604800000") // 7 days
                .build();
    }

    @Bean
    public NewTopic eventsDeadLetterTopic(@Value("${interface-agent.events.topic:interface-agent.events}") String topic,
                                          @Value("${interface-agent.events.partitions:6}") int partitions) {
        // DeadLetterPublishingRecoverer keeps the partition number, so the DLT needs as many.
        return TopicBuilder.name(topic + ".DLT")
                .partitions(partitions)
                .replicas(1)
                .config("retention.ms", "2592000000") // 30 days
                .build();
    }
}
