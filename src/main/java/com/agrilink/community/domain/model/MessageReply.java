package com.agrilink.community.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Instant;

/**
 * Reply to a community message. Replies with a parent form a tree under a top-level reply.
 *
 * @author AgriLink Team
 */
@Entity
@DynamicUpdate
@Table(name = "message_replies", indexes = {
    @Index(name = "idx_replies_message", columnList = "message_id"),
    @Index(name = "idx_replies_parent", columnList = "parent_reply_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageReply {

    public static final int MAX_CONTENT_LENGTH = 5000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "message_id", nullable = false)
    private Long messageId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "content", nullable = false, columnDefinition = "TEXT")
    private String content;

    @Column(name = "parent_reply_id")
    private Long parentReplyId;

    @Column(name = "likes_count", nullable = false, updatable = false)
    @Builder.Default
    private Integer likesCount = 0;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = Instant.now();
        if (likesCount == null) {
            likesCount = 0;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isTopLevel() {
        return parentReplyId == null;
    }

    public boolean isOwnedBy(Long candidateUserId) {
        return userId != null && userId.equals(candidateUserId);
    }
}
