package com.agrilink.community.repository;

import com.agrilink.community.domain.model.MessageReply;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Repository interface for MessageReply entity.
 *
 * @author AgriLink Team
 */
@Repository
public interface MessageReplyRepository extends JpaRepository<MessageReply, Long> {

    /**
     * All replies of a message, oldest first. Used to assemble the reply tree in memory.
     */
    List<MessageReply> findByMessageIdOrderByCreatedAtAscIdAsc(Long messageId);

    Page<MessageReply> findByMessageIdAndParentReplyIdIsNull(Long messageId, Pageable pageable);

    long countByMessageId(Long messageId);

    @Query("SELECT MAX(r.createdAt) FROM MessageReply r WHERE r.messageId = :messageId")
    Instant findLatestReplyTime(@Param("messageId") Long messageId);

    @Modifying
    @Query("DELETE FROM MessageReply r WHERE r.id IN :ids")
    int deleteByIdIn(@Param("ids") Collection<Long> ids);

    @Modifying
    @Query("DELETE FROM MessageReply r WHERE r.messageId = :messageId")
    int deleteByMessageId(@Param("messageId") Long messageId);

    @Query("SELECT r.id FROM MessageReply r WHERE r.messageId = :messageId")
    List<Long> findIdsByMessageId(@Param("messageId") Long messageId);

    @Modifying
    @Query("UPDATE MessageReply r SET r.likesCount = r.likesCount + :delta WHERE r.id = :id")
    int adjustLikes(@Param("id") Long id, @Param("delta") int delta);

    @Query("SELECT r.likesCount FROM MessageReply r WHERE r.id = :id")
    Integer findLikesCount(@Param("id") Long id);
}
