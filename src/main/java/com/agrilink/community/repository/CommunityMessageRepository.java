package com.agrilink.community.repository;

import com.agrilink.community.domain.model.CommunityMessage;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository interface for CommunityMessage entity.
 * Ids are monotonic, which the polling queries rely on.
 *
 * @author AgriLink Team
 */
@Repository
public interface CommunityMessageRepository extends JpaRepository<CommunityMessage, Long> {

    /**
     * Page through messages matching the optional filters. Sorting comes from the pageable.
     *
     * @param category Category filter, or null
     * @param pattern Lower-case LIKE pattern matched against title, content and tags, or null
     * @param pinned Pinned filter, or null
     * @param announcement Announcement filter, or null
     * @param updatedAfter Only messages updated strictly after this instant, or null
     * @param pageable Page request with sort
     * @return Page of messages
     */
    @Query("SELECT m FROM CommunityMessage m WHERE " +
           "(:category IS NULL OR m.category = :category) AND " +
           "(:pinned IS NULL OR m.pinned = :pinned) AND " +
           "(:announcement IS NULL OR m.announcement = :announcement) AND " +
           "(:updatedAfter IS NULL OR m.updatedAt > :updatedAfter) AND " +
           "(:pattern IS NULL OR LOWER(m.title) LIKE :pattern OR LOWER(m.content) LIKE :pattern " +
           "OR LOWER(m.tags) LIKE :pattern)")
    Page<CommunityMessage> search(@Param("category") String category,
                                  @Param("pattern") String pattern,
                                  @Param("pinned") Boolean pinned,
                                  @Param("announcement") Boolean announcement,
                                  @Param("updatedAfter") Instant updatedAfter,
                                  Pageable pageable);

    /**
     * Messages posted after the given id, newest first.
     */
    List<CommunityMessage> findTop10ByIdGreaterThanOrderByIdDesc(Long lastId);

    /**
     * Messages for the polling endpoint. Both conditions apply when both are given.
     *
     * @param lastId Only ids strictly greater than this one, or null
     * @param updatedAfter Only messages updated strictly after this instant, or null
     * @param pageable Limit and sort
     * @return Matching messages
     */
    @Query("SELECT m FROM CommunityMessage m WHERE " +
           "(:lastId IS NULL OR m.id > :lastId) AND " +
           "(:updatedAfter IS NULL OR m.updatedAt > :updatedAfter)")
    List<CommunityMessage> findForPolling(@Param("lastId") Long lastId,
                                          @Param("updatedAfter") Instant updatedAfter,
                                          Pageable pageable);

    @Modifying
    @Query("UPDATE CommunityMessage m SET m.viewsCount = m.viewsCount + 1 WHERE m.id = :id")
    int incrementViews(@Param("id") Long id);

    @Modifying
    @Query("UPDATE CommunityMessage m SET m.likesCount = m.likesCount + :delta WHERE m.id = :id")
    int adjustLikes(@Param("id") Long id, @Param("delta") int delta);

    @Query("SELECT m.likesCount FROM CommunityMessage m WHERE m.id = :id")
    Integer findLikesCount(@Param("id") Long id);

    /**
     * Store recomputed reply statistics. Also bumps updated_at so pollers see the change.
     */
    @Modifying
    @Query("UPDATE CommunityMessage m SET m.repliesCount = :count, m.lastReplyAt = :lastReplyAt, " +
           "m.updatedAt = :now WHERE m.id = :id")
    int updateReplyStats(@Param("id") Long id,
                         @Param("count") int count,
                         @Param("lastReplyAt") Instant lastReplyAt,
                         @Param("now") Instant now);
}
