package com.agrilink.community.service;

import com.agrilink.community.api.dto.ToggleResponse;
import com.agrilink.community.infrastructure.metrics.CloudWatchMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.function.IntConsumer;
import java.util.function.IntSupplier;
import java.util.function.Supplier;

/**
 * Toggle routine shared by tip, story, message and reply likes and by tip saves.
 *
 * <p>An existing row for (target, user) is deleted, otherwise one is inserted. The target's
 * counter moves by one in a single UPDATE and the stored count is read back. Callers run it
 * inside their transaction; a concurrent double insert fails on the unique constraint.
 *
 * @author AgriLink Team
 */
@Component
public class LikeToggler {

    private static final Logger logger = LoggerFactory.getLogger(LikeToggler.class);

    private final CloudWatchMetricsService metricsService;

    public LikeToggler(CloudWatchMetricsService metricsService) {
        this.metricsService = metricsService;
    }

    /**
     * Toggle a like.
     *
     * @param targetType Target name for logs and metrics (tip, story, message, reply)
     * @param targetId Target ID
     * @param userId Acting user
     * @param unlike Deletes the like row, returning the number of rows deleted
     * @param like Inserts the like row
     * @param adjustCounter Moves the target's likes_count by the given delta
     * @param readCount Reads the stored likes_count
     * @return New like state and count
     */
    public ToggleResponse toggleLike(String targetType, Long targetId, Long userId,
                                     IntSupplier unlike, Runnable like,
                                     IntConsumer adjustCounter, Supplier<Integer> readCount) {
        boolean liked;
        if (unlike.getAsInt() > 0) {
            adjustCounter.accept(-1);
            liked = false;
        } else {
            like.run();
            adjustCounter.accept(1);
            liked = true;
        }

        Integer count = readCount.get();
        int likesCount = count == null ? 0 : Math.max(count, 0);

        metricsService.recordLikeToggle(targetType, liked);
        logger.debug("User {} {} {} {} ({} likes)", userId, liked ? "liked" : "unliked", targetType, targetId, likesCount);

        return ToggleResponse.liked(liked, likesCount);
    }

    /**
     * Toggle a counterless flag such as a saved tip.
     */
    public ToggleResponse toggleSave(String targetType, Long targetId, Long userId,
                                     IntSupplier unsave, Runnable save) {
        boolean saved;
        if (unsave.getAsInt() > 0) {
            saved = false;
        } else {
            save.run();
            saved = true;
        }
        logger.debug("User {} {} {} {}", userId, saved ? "saved" : "unsaved", targetType, targetId);
        return ToggleResponse.saved(saved);
    }
}
