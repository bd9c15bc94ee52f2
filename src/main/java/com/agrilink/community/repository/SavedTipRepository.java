package com.agrilink.community.repository;

import com.agrilink.community.domain.model.SavedTip;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface SavedTipRepository extends JpaRepository<SavedTip, Long> {

    @Modifying
    @Query("DELETE FROM SavedTip s WHERE s.tipId = :tipId AND s.userId = :userId")
    int deleteByTipIdAndUserId(@Param("tipId") Long tipId, @Param("userId") Long userId);

    @Query("SELECT s.tipId FROM SavedTip s WHERE s.userId = :userId AND s.tipId IN :tipIds")
    List<Long> findSavedTipIds(@Param("userId") Long userId, @Param("tipIds") Collection<Long> tipIds);

    @Modifying
    @Query("DELETE FROM SavedTip s WHERE s.tipId IN :tipIds")
    int deleteByTipIdIn(@Param("tipIds") Collection<Long> tipIds);
}
