package com.agrilink.community.infrastructure.messaging.events;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Discussion board activity event.
 *
 * @author AgriLink Team
 */
@Data
@NoArgsConstructor
public class CommunityEvent {

    private Long messageId;
    private Long replyId;
    private Long userId;
    private EventType eventType;
    private Instant timestamp;

    public CommunityEvent(Long messageId, Long replyId, Long userId, EventType eventType) {
        this.messageId = messageId;
        this.replyId = replyId;
        this.userId = userId;
        this.eventType = eventType;
        this.timestamp = Instant.now();
    }

    public enum EventType {
        MESSAGE_POSTED,
        REPLY_ADDED
    }
}
