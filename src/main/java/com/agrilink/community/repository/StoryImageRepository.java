package com.agrilink.community.repository;

import com.agrilink.community.domain.model.StoryImage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface StoryImageRepository extends JpaRepository<StoryImage, Long> {

    List<StoryImage> findByStoryIdOrderBySortOrderAsc(Long storyId);

    List<StoryImage> findByStoryIdInOrderBySortOrderAsc(Collection<Long> storyIds);

    @Query("SELECT COALESCE(MAX(i.sortOrder), -1) FROM StoryImage i WHERE i.storyId = :storyId")
    int findMaxSortOrder(@Param("storyId") Long storyId);
}
