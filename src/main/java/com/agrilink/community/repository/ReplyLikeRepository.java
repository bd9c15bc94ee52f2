package com.agrilink.community.repository;

import com.agrilink.community.domain.model.ReplyLike;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface ReplyLikeRepository extends JpaRepository<ReplyLike, Long> {

    @Modifying
    @Query("DELETE FROM ReplyLike l WHERE l.replyId = :replyId AND l.userId = :userId")
    int deleteByReplyIdAndUserId(@Param("replyId") Long replyId, @Param("userId") Long userId);

    @Query("SELECT l.replyId FROM ReplyLike l WHERE l.userId = :userId AND l.replyId IN :replyIds")
    List<Long> findLikedReplyIds(@Param("userId") Long userId, @Param("replyIds") Collection<Long> replyIds);

    @Modifying
    @Query("DELETE FROM ReplyLike l WHERE l.replyId IN :replyIds")
    int deleteByReplyIdIn(@Param("replyIds") Collection<Long> replyIds);
}
