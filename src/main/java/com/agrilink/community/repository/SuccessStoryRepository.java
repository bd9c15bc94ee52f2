package com.agrilink.community.repository;

import com.agrilink.community.domain.model.SuccessStory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * Repository interface for SuccessStory entity.
 *
 * @author AgriLink Team
 */
@Repository
public interface SuccessStoryRepository extends JpaRepository<SuccessStory, Long> {

    /**
     * Page through stories matching the optional filters. Sorting comes from the pageable.
     *
     * @param pattern Lower-case LIKE pattern matched against title, content and crop type, or null
     * @param cropType Exact crop type filter, or null
     * @param featured Featured filter, or null
     * @param pageable Page request with sort
     * @return Page of stories
     */
    @Query("SELECT s FROM SuccessStory s WHERE " +
           "(:cropType IS NULL OR s.cropType = :cropType) AND " +
           "(:featured IS NULL OR s.featured = :featured) AND " +
           "(:pattern IS NULL OR LOWER(s.title) LIKE :pattern OR LOWER(s.content) LIKE :pattern " +
           "OR LOWER(s.cropType) LIKE :pattern)")
    Page<SuccessStory> search(@Param("pattern") String pattern,
                              @Param("cropType") String cropType,
                              @Param("featured") Boolean featured,
                              Pageable pageable);

    Page<SuccessStory> findByUserId(Long userId, Pageable pageable);

    @Modifying
    @Query("UPDATE SuccessStory s SET s.viewsCount = s.viewsCount + 1 WHERE s.id = :id")
    int incrementViews(@Param("id") Long id);

    @Modifying
    @Query("UPDATE SuccessStory s SET s.likesCount = s.likesCount + :delta WHERE s.id = :id")
    int adjustLikes(@Param("id") Long id, @Param("delta") int delta);

    @Query("SELECT s.likesCount FROM SuccessStory s WHERE s.id = :id")
    Integer findLikesCount(@Param("id") Long id);

    @Modifying
    @Query("UPDATE SuccessStory s SET s.commentsCount = :count WHERE s.id = :id")
    int updateCommentsCount(@Param("id") Long id, @Param("count") int count);
}
