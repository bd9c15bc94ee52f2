package com.agrilink.community.repository;

import com.agrilink.community.domain.model.StoryComment;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface StoryCommentRepository extends JpaRepository<StoryComment, Long> {

    List<StoryComment> findByStoryIdOrderByCreatedAtAscIdAsc(Long storyId);

    Page<StoryComment> findByStoryIdAndParentIdIsNull(Long storyId, Pageable pageable);

    long countByStoryId(Long storyId);

    @Modifying
    @Query("DELETE FROM StoryComment c WHERE c.storyId = :storyId")
    int deleteByStoryId(@Param("storyId") Long storyId);
}
