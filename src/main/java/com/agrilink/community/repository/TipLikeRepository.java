package com.agrilink.community.repository;

import com.agrilink.community.domain.model.TipLike;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface TipLikeRepository extends JpaRepository<TipLike, Long> {

    @Modifying
    @Query("DELETE FROM TipLike l WHERE l.tipId = :tipId AND l.userId = :userId")
    int deleteByTipIdAndUserId(@Param("tipId") Long tipId, @Param("userId") Long userId);

    @Query("SELECT l.tipId FROM TipLike l WHERE l.userId = :userId AND l.tipId IN :tipIds")
    List<Long> findLikedTipIds(@Param("userId") Long userId, @Param("tipIds") Collection<Long> tipIds);

    @Modifying
    @Query("DELETE FROM TipLike l WHERE l.tipId IN :tipIds")
    int deleteByTipIdIn(@Param("tipIds") Collection<Long> tipIds);

    long countByTipId(Long tipId);
}
