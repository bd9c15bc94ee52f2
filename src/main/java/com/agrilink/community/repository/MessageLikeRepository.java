package com.agrilink.community.repository;

import com.agrilink.community.domain.model.MessageLike;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface MessageLikeRepository extends JpaRepository<MessageLike, Long> {

    @Modifying
    @Query("DELETE FROM MessageLike l WHERE l.messageId = :messageId AND l.userId = :userId")
    int deleteByMessageIdAndUserId(@Param("messageId") Long messageId, @Param("userId") Long userId);

    boolean existsByMessageIdAndUserId(Long messageId, Long userId);

    @Modifying
    @Query("DELETE FROM MessageLike l WHERE l.messageId = :messageId")
    int deleteByMessageId(@Param("messageId") Long messageId);

    long countByMessageId(Long messageId);
}
