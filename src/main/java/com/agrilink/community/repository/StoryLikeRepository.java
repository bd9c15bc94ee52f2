package com.agrilink.community.repository;

import com.agrilink.community.domain.model.StoryLike;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface StoryLikeRepository extends JpaRepository<StoryLike, Long> {

    @Modifying
    @Query("DELETE FROM StoryLike l WHERE l.storyId = :storyId AND l.userId = :userId")
    int deleteByStoryIdAndUserId(@Param("storyId") Long storyId, @Param("userId") Long userId);

    @Query("SELECT l.storyId FROM StoryLike l WHERE l.userId = :userId AND l.storyId IN :storyIds")
    List<Long> findLikedStoryIds(@Param("userId") Long userId, @Param("storyIds") Collection<Long> storyIds);

    @Modifying
    @Query("DELETE FROM StoryLike l WHERE l.storyId = :storyId")
    int deleteByStoryId(@Param("storyId") Long storyId);

    long countByStoryId(Long storyId);
}
