package com.agrilink.community.infrastructure.messaging.events;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Request for the notification service to send a message to a user.
 * The mailer renders the template named by the type with the given attributes.
 *
 * @author AgriLink Team
 */
@Data
@NoArgsConstructor
public class NotificationEvent {

    private NotificationType type;
    private Long userId;
    private String recipientEmail;
    private String recipientName;
    private Map<String, Object> attributes = new HashMap<>();
    private Instant timestamp;

    public NotificationEvent(NotificationType type, Long userId, String recipientEmail, String recipientName) {
        this.type = type;
        this.userId = userId;
        this.recipientEmail = recipientEmail;
        this.recipientName = recipientName;
        this.timestamp = Instant.now();
    }

    public NotificationEvent withAttribute(String key, Object value) {
        this.attributes.put(key, value);
        return this;
    }

    public enum NotificationType {
        PASSWORD_RESET_OTP
    }
}
