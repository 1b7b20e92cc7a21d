package com.loanorigination.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.*;
import org.springframework.kafka.support.serializer.JsonDeserializer;
import org.springframework.kafka.support.serializer.JsonSerializer;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka wiring for lifecycle events.
 *
 * TOPICS:
 * =======
 * One topic per event record (see {@link KafkaTopics}), all with the same
 * partition count. Records are keyed by application ID, so the events of one
 * application stay ordered whatever the partition count.
 *
 * SERIALIZATION:
 * ==============
 * Event records travel as JSON with type headers; the listener side rebuilds
 * the record type from the header and only trusts the event package.
 *
 * The producer waits for all in-sync replicas and is idempotent: the outbox
 * publisher only marks a row sent after that acknowledgement.
 */
@Configuration
@EnableKafka
public class KafkaConfig {

    static final String TRUSTED_EVENT_PACKAGE = "com.loanorigination.event";

    @Value("${spring.kafka.bootstrap-servers}")
    private String bootstrapServers;

    @Value("${spring.kafka.consumer.group-id:loan-origination-group}")
    private String groupId;

    @Value("${lending.kafka.listener-concurrency:3}")
    private int listenerConcurrency;

    @Value("${lending.kafka.topic-partitions:6}")
    private int topicPartitions;

    @Value("${lending.kafka.topic-replicas:1}")
    private int topicReplicas;

    // ==================== TOPICS ====================

    @Bean
    public NewTopic applicationStatusChangedTopic() {
        return lifecycleTopic(KafkaTopics.APPLICATION_STATUS_CHANGED);
    }

    @Bean
    public NewTopic counterOfferSentTopic() {
        return lifecycleTopic(KafkaTopics.COUNTER_OFFER_SENT);
    }

    @Bean
    public NewTopic counterOfferRespondedTopic() {
        return lifecycleTopic(KafkaTopics.COUNTER_OFFER_RESPONDED);
    }

    private NewTopic lifecycleTopic(String name) {
        return TopicBuilder.name(name)
                .partitions(topicPartitions)
                .replicas(topicReplicas)
                .build();
    }

    // ==================== PRODUCER ====================

    @Bean
    public ProducerFactory<String, Object> producerFactory() {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, JsonSerializer.class);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        props.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, 5);
        props.put(JsonSerializer.ADD_TYPE_INFO_HEADERS, true);
        return new DefaultKafkaProducerFactory<>(props);
    }

    @Bean
    public KafkaTemplate<String, Object> kafkaTemplate(ProducerFactory<String, Object> producerFactory) {
        return new KafkaTemplate<>(producerFactory);
    }

    // ==================== CONSUMER ====================

    @Bean
    public ConsumerFactory<String, Object> consumerFactory() {
        Map<String, Object> props = new HashMap<>();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, JsonDeserializer.class);
        props.put(JsonDeserializer.TRUSTED_PACKAGES, TRUSTED_EVENT_PACKAGE);
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        return new DefaultKafkaConsumerFactory<>(props);
    }

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, Object> kafkaListenerContainerFactory(
            ConsumerFactory<String, Object> consumerFactory) {
        ConcurrentKafkaListenerContainerFactory<String, Object> factory =
                new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(consumerFactory);
        factory.setConcurrency(listenerConcurrency);
        return factory;
    }
}
