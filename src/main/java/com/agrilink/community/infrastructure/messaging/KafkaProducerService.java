package com.agrilink.community.infrastructure.messaging;

import com.agrilink.community.infrastructure.messaging.events.CommunityEvent;
import com.agrilink.community.infrastructure.messaging.events.ConsultationEvent;
import com.agrilink.community.infrastructure.messaging.events.NotificationEvent;
import com.agrilink.community.infrastructure.messaging.events.OrderEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Kafka producer service for publishing domain events.
 *
 * Publishing is best-effort: serialization and broker failures are logged and never propagate to
 * the request that triggered the event.
 *
 * Topic partitioning strategy:
 * - Key: id of the aggregate (order, consultation, user, message), so events of one aggregate stay ordered
 *
 * @author AgriLink Team
 */
@Service
public class KafkaProducerService {

    private static final Logger logger = LoggerFactory.getLogger(KafkaProducerService.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;

    private final String orderTopic;
    private final String consultationTopic;
    private final String notificationTopic;
    private final String communityTopic;

    public KafkaProducerService(
            KafkaTemplate<String, String> kafkaTemplate,
            ObjectMapper objectMapper,
            @Value("${agrilink.kafka.topics.orders:agrilink-orders}") String orderTopic,
            @Value("${agrilink.kafka.topics.consultations:agrilink-consultations}") String consultationTopic,
            @Value("${agrilink.kafka.topics.notifications:agrilink-notifications}") String notificationTopic,
            @Value("${agrilink.kafka.topics.community:agrilink-community}") String communityTopic
    ) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.orderTopic = orderTopic;
        this.consultationTopic = consultationTopic;
        this.notificationTopic = notificationTopic;
        this.communityTopic = communityTopic;
    }

    public void publishOrderEvent(OrderEvent event) {
        publish(orderTopic, String.valueOf(event.getOrderId()), event,
                "order " + event.getEventType() + " event for order " + event.getOrderId());
    }

    public void publishConsultationEvent(ConsultationEvent event) {
        publish(consultationTopic, String.valueOf(event.getConsultationId()), event,
                "consultation " + event.getEventType() + " event for consultation " + event.getConsultationId());
    }

    /**
     * Publish a notification request. The payload may carry secrets (OTP), so it is never logged.
     *
     * @param event Notification event
     */
    public void publishNotification(NotificationEvent event) {
        publish(notificationTopic, String.valueOf(event.getUserId()), event,
                event.getType() + " notification for user " + event.getUserId());
    }

    public void publishCommunityEvent(CommunityEvent event) {
        publish(communityTopic, String.valueOf(event.getMessageId()), event,
                "community " + event.getEventType() + " event for message " + event.getMessageId());
    }

    private void publish(String topic, String key, Object event, String description) {
        try {
            String payload = objectMapper.writeValueAsString(event);
            CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(topic, key, payload);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.info("Published {} to {}, partition: {}",
                            description, topic, result.getRecordMetadata().partition());
                } else {
                    logger.error("Failed to publish {} to {}", description, topic, ex);
                }
            });
        } catch (JsonProcessingException e) {
            logger.error("Error serializing {}", description, e);
        } catch (RuntimeException e) {
            logger.error("Error sending {} to {}", description, topic, e);
        }
    }
}
