package com.agrilink.community.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.DynamicUpdate;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Success story shared by a community member, with optional yield figures and images.
 *
 * @author AgriLink Team
 */
@Entity
@DynamicUpdate
@Table(name = "success_stories", indexes = {
    @Index(name = "idx_stories_user", columnList = "user_id"),
    @Index(name = "idx_stories_crop_type", columnList = "crop_type")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SuccessStory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "title", nullable = false, length = 255)
    private String title;

    @Column(name = "content", nullable = false, columnDefinition = "TEXT")
    private String content;

    @Column(name = "location", length = 255)
    private String location;

    @Column(name = "crop_type", length = 255)
    private String cropType;

    @Column(name = "yield_improvement", precision = 10, scale = 2)
    private BigDecimal yieldImprovement;

    @Column(name = "yield_unit", length = 50)
    private String yieldUnit;

    @Column(name = "is_featured", nullable = false)
    @Builder.Default
    private Boolean featured = false;

    @Column(name = "views_count", nullable = false, updatable = false)
    @Builder.Default
    private Integer viewsCount = 0;

    @Column(name = "likes_count", nullable = false, updatable = false)
    @Builder.Default
    private Integer likesCount = 0;

    @Column(name = "comments_count", nullable = false, updatable = false)
    @Builder.Default
    private Integer commentsCount = 0;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = Instant.now();
        if (featured == null) {
            featured = false;
        }
        if (viewsCount == null) {
            viewsCount = 0;
        }
        if (likesCount == null) {
            likesCount = 0;
        }
        if (commentsCount == null) {
            commentsCount = 0;
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
