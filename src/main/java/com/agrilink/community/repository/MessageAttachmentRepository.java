package com.agrilink.community.repository;

import com.agrilink.community.domain.model.MessageAttachment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface MessageAttachmentRepository extends JpaRepository<MessageAttachment, Long> {

    List<MessageAttachment> findByMessageIdOrderBySortOrderAsc(Long messageId);

    List<MessageAttachment> findByMessageIdInOrderBySortOrderAsc(Collection<Long> messageIds);
}
