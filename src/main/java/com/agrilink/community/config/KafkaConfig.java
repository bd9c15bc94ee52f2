package com.agrilink.community.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

import java.util.Map;

/**
 * Kafka producer and topic configuration.
 *
 * <p>The service only publishes. Order, consultation and community events feed analytics; the
 * notifications topic is read by the mailer that sends OTPs and booking updates. Events for one
 * order, consultation or message share a key and therefore a partition.
 *
 * @author AgriLink Team
 */
@Configuration
public class KafkaConfig {

    private static final String CLIENT_ID = "agrilink-community";

    private final String bootstrapServers;
    private final int partitions;
    private final int replicas;

    public KafkaConfig(
            @Value("${spring.kafka.bootstrap-servers:localhost:9092}") String bootstrapServers,
            @Value("${agrilink.kafka.partitions:3}") int partitions,
            @Value("${agrilink.kafka.replicas:1}") int replicas
    ) {
        this.bootstrapServers = bootstrapServers;
        this.partitions = partitions;
        this.replicas = replicas;
    }

    @Bean
    public ProducerFactory<String, String> producerFactory(
            @Value("${spring.kafka.producer.acks:all}") String acks,
            @Value("${spring.kafka.producer.retries:3}") int retries,
            @Value("${spring.kafka.producer.linger-ms:10}") int lingerMs,
            @Value("${spring.kafka.producer.max-block-ms:5000}") int maxBlockMs
    ) {
        Map<String, Object> config = Map.of(
                ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers,
                ProducerConfig.CLIENT_ID_CONFIG, CLIENT_ID,
                ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class,
                ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class,
                ProducerConfig.ACKS_CONFIG, acks,
                ProducerConfig.RETRIES_CONFIG, retries,
                ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true,
                ProducerConfig.LINGER_MS_CONFIG, lingerMs,
                // A request thread must not hang on metadata while the broker is down
                ProducerConfig.MAX_BLOCK_MS_CONFIG, maxBlockMs);
        return new DefaultKafkaProducerFactory<>(config);
    }

    @Bean
    public KafkaTemplate<String, String> kafkaTemplate(ProducerFactory<String, String> producerFactory) {
        return new KafkaTemplate<>(producerFactory);
    }

    /**
     * Declares every topic the service writes to; KafkaAdmin creates missing ones at startup.
     */
    @Bean
    public KafkaAdmin.NewTopics agrilinkTopics(
            @Value("${agrilink.kafka.topics.orders:agrilink-orders}") String orders,
            @Value("${agrilink.kafka.topics.consultations:agrilink-consultations}") String consultations,
            @Value("${agrilink.kafka.topics.notifications:agrilink-notifications}") String notifications,
            @Value("${agrilink.kafka.topics.community:agrilink-community}") String community
    ) {
        return new KafkaAdmin.NewTopics(
                topic(orders),
                topic(consultations),
                topic(notifications),
                topic(community));
    }

    private NewTopic topic(String name) {
        return TopicBuilder.name(name)
                .partitions(partitions)
                .replicas(replicas)
                .build();
    }
}
