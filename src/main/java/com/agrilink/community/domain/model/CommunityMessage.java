package com.agrilink.community.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Post on the community discussion board.
 * Counters are maintained by the reply and like operations.
 *
 * @author AgriLink Team
 */
@Entity
@DynamicUpdate
@Table(name = "community_messages", indexes = {
    @Index(name = "idx_messages_user", columnList = "user_id"),
    @Index(name = "idx_messages_category", columnList = "category"),
    @Index(name = "idx_messages_pinned_created", columnList = "is_pinned, created_at"),
    @Index(name = "idx_messages_updated_at", columnList = "updated_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommunityMessage {

    public static final int MAX_CONTENT_LENGTH = 10000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "title", length = 255)
    private String title;

    @Column(name = "content", nullable = false, columnDefinition = "TEXT")
    private String content;

    @Column(name = "category", length = 100)
    private String category;

    @Convert(converter = StringListConverter.class)
    @Column(name = "tags", columnDefinition = "TEXT")
    @Builder.Default
    private List<String> tags = new ArrayList<>();

    @Column(name = "is_pinned", nullable = false)
    @Builder.Default
    private Boolean pinned = false;

    @Column(name = "is_announcement", nullable = false)
    @Builder.Default
    private Boolean announcement = false;

    @Column(name = "views_count", nullable = false, updatable = false)
    @Builder.Default
    private Integer viewsCount = 0;

    @Column(name = "likes_count", nullable = false, updatable = false)
    @Builder.Default
    private Integer likesCount = 0;

    @Column(name = "replies_count", nullable = false, updatable = false)
    @Builder.Default
    private Integer repliesCount = 0;

    @Column(name = "last_reply_at", updatable = false)
    private Instant lastReplyAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = Instant.now();
        if (pinned == null) {
            pinned = false;
        }
        if (announcement == null) {
            announcement = false;
        }
        if (viewsCount == null) {
            viewsCount = 0;
        }
        if (likesCount == null) {
            likesCount = 0;
        }
        if (repliesCount == null) {
            repliesCount = 0;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isOwnedBy(Long candidateUserId) {
        return userId != null && userId.equals(candidateUserId);
    }
}
