package com.agrilink.community.repository;

import com.agrilink.community.domain.model.Tip;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository interface for Tip entity.
 *
 * @author AgriLink Team
 */
@Repository
public interface TipRepository extends JpaRepository<Tip, Long> {

    /**
     * Page through tips matching the optional filters. Sorting comes from the pageable.
     *
     * @param categoryId Category filter, or null
     * @param pattern Lower-case LIKE pattern matched against title, content and tags, or null
     * @param featured Featured filter, or null
     * @param pageable Page request with sort
     * @return Page of tips
     */
    @Query("SELECT t FROM Tip t WHERE " +
           "(:categoryId IS NULL OR t.categoryId = :categoryId) AND " +
           "(:featured IS NULL OR t.featured = :featured) AND " +
           "(:pattern IS NULL OR LOWER(t.title) LIKE :pattern OR LOWER(t.content) LIKE :pattern " +
           "OR LOWER(t.tags) LIKE :pattern)")
    Page<Tip> search(@Param("categoryId") Long categoryId,
                     @Param("pattern") String pattern,
                     @Param("featured") Boolean featured,
                     Pageable pageable);

    Page<Tip> findByFeaturedTrue(Pageable pageable);

    Page<Tip> findByUserId(Long userId, Pageable pageable);

    @Query("SELECT t FROM Tip t WHERE t.id IN (SELECT s.tipId FROM SavedTip s WHERE s.userId = :userId)")
    Page<Tip> findSavedByUser(@Param("userId") Long userId, Pageable pageable);

    List<Tip> findByCategoryId(Long categoryId);

    boolean existsBySlug(String slug);

    boolean existsBySlugAndIdNot(String slug, Long id);

    /**
     * Count tips per category.
     *
     * @return Rows of [categoryId, count]
     */
    @Query("SELECT t.categoryId, COUNT(t) FROM Tip t GROUP BY t.categoryId")
    List<Object[]> countByCategory();

    @Modifying
    @Query("UPDATE Tip t SET t.viewsCount = t.viewsCount + 1 WHERE t.id = :id")
    int incrementViews(@Param("id") Long id);

    @Modifying
    @Query("UPDATE Tip t SET t.likesCount = t.likesCount + :delta WHERE t.id = :id")
    int adjustLikes(@Param("id") Long id, @Param("delta") int delta);

    @Query("SELECT t.likesCount FROM Tip t WHERE t.id = :id")
    Integer findLikesCount(@Param("id") Long id);
}
