package com.agrilink.community.service;

import com.agrilink.community.api.dto.AttachmentResponse;
import com.agrilink.community.api.dto.CommunityMessageResponse;
import com.agrilink.community.api.dto.LatestMessagesResponse;
import com.agrilink.community.api.dto.MessageForm;
import com.agrilink.community.api.dto.MessagePageResponse;
import com.agrilink.community.api.dto.PollResponse;
import com.agrilink.community.api.dto.ToggleResponse;
import com.agrilink.community.api.dto.UserSummary;
import com.agrilink.community.domain.model.CommunityMessage;
import com.agrilink.community.domain.model.MessageAttachment;
import com.agrilink.community.domain.model.MessageAttachment.FileType;
import com.agrilink.community.domain.model.MessageLike;
import com.agrilink.community.exception.ResourceNotFoundException;
import com.agrilink.community.infrastructure.messaging.KafkaProducerService;
import com.agrilink.community.infrastructure.messaging.events.CommunityEvent;
import com.agrilink.community.infrastructure.storage.FileStorageService;
import com.agrilink.community.infrastructure.storage.StorageFolder;
import com.agrilink.community.infrastructure.storage.StoredFile;
import com.agrilink.community.infrastructure.storage.UploadPolicy;
import com.agrilink.community.repository.CommunityMessageRepository;
import com.agrilink.community.repository.MessageAttachmentRepository;
import com.agrilink.community.repository.MessageLikeRepository;
import com.agrilink.community.security.AuthenticatedUser;
import com.agrilink.community.security.SecurityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Service for the community discussion board.
 *
 * <p>Clients poll for changes: listings carry the server time and the suggested polling
 * interval, and message ids only grow, so "newer than id X" is a stable cursor.
 *
 * @author AgriLink Team
 */
@Service
public class CommunityMessageService {

    private static final Logger logger = LoggerFactory.getLogger(CommunityMessageService.class);

    static final int LATEST_LIMIT = 10;
    static final int POLL_LIMIT = 50;

    private static final Sort BOARD_ORDER = Sort.by(
            Sort.Order.desc("pinned"), Sort.Order.desc("createdAt"), Sort.Order.desc("id"));

    private final CommunityMessageRepository messageRepository;
    private final MessageAttachmentRepository attachmentRepository;
    private final MessageLikeRepository likeRepository;
    private final MessageReplyService replyService;
    private final UserDirectory userDirectory;
    private final FileStorageService fileStorageService;
    private final LikeToggler likeToggler;
    private final KafkaProducerService kafkaProducerService;
    private final int pageSize;
    private final long pollingIntervalMs;

    public CommunityMessageService(
            CommunityMessageRepository messageRepository,
            MessageAttachmentRepository attachmentRepository,
            MessageLikeRepository likeRepository,
            MessageReplyService replyService,
            UserDirectory userDirectory,
            FileStorageService fileStorageService,
            LikeToggler likeToggler,
            KafkaProducerService kafkaProducerService,
            @Value("${agrilink.pagination.messages:20}") int pageSize,
            @Value("${agrilink.community.polling-interval-ms:3000}") long pollingIntervalMs
    ) {
        this.messageRepository = messageRepository;
        this.attachmentRepository = attachmentRepository;
        this.likeRepository = likeRepository;
        this.replyService = replyService;
        this.userDirectory = userDirectory;
        this.fileStorageService = fileStorageService;
        this.likeToggler = likeToggler;
        this.kafkaProducerService = kafkaProducerService;
        this.pageSize = pageSize;
        this.pollingIntervalMs = pollingIntervalMs;
    }

    /**
     * Page through the board, pinned messages first, then newest.
     *
     * @param updatedAfter Only messages updated strictly after this instant, or null
     */
    @Transactional(readOnly = true)
    public MessagePageResponse listMessages(String category, String search, Boolean pinned, Boolean announcement,
                                            Instant updatedAfter, Integer page) {
        String categoryFilter = category == null || category.isBlank() ? null : category.trim();
        Page<CommunityMessage> messages = messageRepository.search(categoryFilter, Paging.likePattern(search),
                pinned, announcement, updatedAfter, Paging.page(page, pageSize, BOARD_ORDER));
        return new MessagePageResponse(toResponses(messages.getContent()),
                messages.getNumber() + 1, messages.getSize(), messages.getTotalElements(),
                Instant.now(), pollingIntervalMs);
    }

    /**
     * Read a message with its attachments and reply tree, counting the view.
     */
    @Transactional
    public CommunityMessageResponse viewMessage(Long id, Long viewerId) {
        if (messageRepository.incrementViews(id) == 0) {
            throw new ResourceNotFoundException("Community message", id);
        }
        CommunityMessage message = findMessage(id);

        boolean liked = viewerId != null && likeRepository.existsByMessageIdAndUserId(id, viewerId);
        CommunityMessageResponse response = CommunityMessageResponse.fromEntity(message,
                userDirectory.summary(message.getUserId()), attachmentsOf(id), liked);
        response.setReplies(replyService.replyTree(id, viewerId));
        return response;
    }

    /**
     * Up to ten messages posted after the given id, newest first.
     */
    @Transactional(readOnly = true)
    public LatestMessagesResponse latest(Long lastId) {
        long cursor = lastId == null ? 0L : lastId;
        List<CommunityMessage> messages = messageRepository.findTop10ByIdGreaterThanOrderByIdDesc(cursor);
        return new LatestMessagesResponse(toResponses(messages), maxId(messages, cursor));
    }

    /**
     * Messages newer than the cursor id and/or updated after the given instant.
     * When both are given a message must satisfy both.
     */
    @Transactional(readOnly = true)
    public PollResponse poll(Long lastId, Instant updatedAfter) {
        long cursor = lastId == null ? 0L : lastId;
        List<CommunityMessage> messages = messageRepository.findForPolling(
                cursor > 0 ? cursor : null, updatedAfter, PageRequest.of(0, POLL_LIMIT, BOARD_ORDER));

        logger.debug("Poll after id {} / {} returned {} messages", cursor, updatedAfter, messages.size());
        return PollResponse.builder()
                .data(toResponses(messages))
                .lastId(maxId(messages, cursor))
                .serverTime(Instant.now())
                .hasNewMessages(!messages.isEmpty())
                .pollingInterval(pollingIntervalMs)
                .build();
    }

    /**
     * Post a message. Pinned and announcement flags are only honoured for administrators.
     */
    @Transactional
    public CommunityMessageResponse createMessage(AuthenticatedUser actor, MessageForm form) {
        CommunityMessage message = CommunityMessage.builder()
                .userId(actor.getId())
                .title(form.getTitle())
                .content(form.getContent())
                .category(form.getCategory())
                .tags(form.getTags() == null ? new ArrayList<>() : form.getTags())
                .pinned(actor.isAdmin() && Boolean.TRUE.equals(form.getPinned()))
                .announcement(actor.isAdmin() && Boolean.TRUE.equals(form.getAnnouncement()))
                .build();
        message = messageRepository.save(message);

        storeAttachments(message.getId(), form.getAttachments(), form.getCaptions(), 0);

        kafkaProducerService.publishCommunityEvent(new CommunityEvent(
                message.getId(), null, actor.getId(), CommunityEvent.EventType.MESSAGE_POSTED));
        logger.info("User {} posted community message {}", actor.getId(), message.getId());

        return CommunityMessageResponse.fromEntity(message, userDirectory.summary(actor.getId()),
                attachmentsOf(message.getId()), false);
    }

    /**
     * Replace the text of a message. Tags and flags are kept when absent; new attachments are appended.
     */
    @Transactional
    public CommunityMessageResponse updateMessage(AuthenticatedUser actor, Long id, MessageForm form) {
        CommunityMessage message = findMessage(id);
        SecurityUtils.verifyOwnerOrAdmin(actor, message.getUserId(), "edit this message");

        message.setTitle(form.getTitle());
        message.setContent(form.getContent());
        message.setCategory(form.getCategory());
        if (form.getTags() != null) {
            message.setTags(form.getTags());
        }
        if (actor.isAdmin() && form.getPinned() != null) {
            message.setPinned(form.getPinned());
        }
        if (actor.isAdmin() && form.getAnnouncement() != null) {
            message.setAnnouncement(form.getAnnouncement());
        }
        message = messageRepository.save(message);

        List<MessageAttachment> existing = attachmentRepository.findByMessageIdOrderBySortOrderAsc(id);
        int nextSortOrder = existing.stream().mapToInt(MessageAttachment::getSortOrder).max().orElse(-1) + 1;
        storeAttachments(id, form.getAttachments(), form.getCaptions(), nextSortOrder);

        boolean liked = likeRepository.existsByMessageIdAndUserId(id, actor.getId());
        logger.info("User {} updated community message {}", actor.getId(), id);
        return CommunityMessageResponse.fromEntity(message, userDirectory.summary(message.getUserId()),
                attachmentsOf(id), liked);
    }

    /**
     * Delete a message with its replies, likes and attachments.
     */
    @Transactional
    public void deleteMessage(AuthenticatedUser actor, Long id) {
        CommunityMessage message = findMessage(id);
        SecurityUtils.verifyOwnerOrAdmin(actor, message.getUserId(), "delete this message");

        List<MessageAttachment> attachments = attachmentRepository.findByMessageIdOrderBySortOrderAsc(id);
        int replies = replyService.deleteAllForMessage(id);
        likeRepository.deleteByMessageId(id);
        attachmentRepository.deleteAll(attachments);
        messageRepository.delete(message);

        List<String> paths = attachments.stream().map(MessageAttachment::getFilePath).collect(Collectors.toList());
        AfterTransaction.commit(() -> paths.forEach(fileStorageService::delete));

        logger.info("User {} deleted community message {} with {} replies and {} attachments",
                actor.getId(), id, replies, attachments.size());
    }

    @Transactional
    public ToggleResponse toggleLike(AuthenticatedUser actor, Long id) {
        findMessage(id);
        Long userId = actor.getId();
        return likeToggler.toggleLike("message", id, userId,
                () -> likeRepository.deleteByMessageIdAndUserId(id, userId),
                () -> likeRepository.save(MessageLike.builder().messageId(id).userId(userId).build()),
                delta -> messageRepository.adjustLikes(id, delta),
                () -> messageRepository.findLikesCount(id));
    }

    private CommunityMessage findMessage(Long id) {
        return messageRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Community message", id));
    }

    private void storeAttachments(Long messageId, List<MultipartFile> files, List<String> captions, int firstSortOrder) {
        if (files == null) {
            return;
        }
        List<String> stored = new ArrayList<>();
        AfterTransaction.rollback(() -> stored.forEach(fileStorageService::delete));

        int sortOrder = firstSortOrder;
        for (int i = 0; i < files.size(); i++) {
            MultipartFile file = files.get(i);
            if (file == null || file.isEmpty()) {
                continue;
            }
            StoredFile storedFile = fileStorageService.store(file, StorageFolder.COMMUNITY_FILES, UploadPolicy.ATTACHMENT);
            stored.add(storedFile.relativePath());
            attachmentRepository.save(MessageAttachment.builder()
                    .messageId(messageId)
                    .fileName(storedFile.originalName())
                    .filePath(storedFile.relativePath())
                    .fileType(FileType.fromMimeType(storedFile.mimeType()))
                    .mimeType(storedFile.mimeType())
                    .fileSize(storedFile.size())
                    .caption(captions != null && i < captions.size() ? captions.get(i) : null)
                    .sortOrder(sortOrder++)
                    .build());
        }
    }

    private List<AttachmentResponse> attachmentsOf(Long messageId) {
        return attachmentRepository.findByMessageIdOrderBySortOrderAsc(messageId).stream()
                .map(AttachmentResponse::fromEntity)
                .collect(Collectors.toList());
    }

    /**
     * Listing rows carry author and attachments; is_liked is only resolved on the detail view.
     */
    private List<CommunityMessageResponse> toResponses(List<CommunityMessage> messages) {
        if (messages.isEmpty()) {
            return new ArrayList<>();
        }
        List<Long> ids = messages.stream().map(CommunityMessage::getId).collect(Collectors.toList());
        Map<Long, UserSummary> authors = userDirectory.summaries(
                messages.stream().map(CommunityMessage::getUserId).collect(Collectors.toSet()));
        Map<Long, List<AttachmentResponse>> attachments = attachmentRepository.findByMessageIdInOrderBySortOrderAsc(ids)
                .stream()
                .collect(Collectors.groupingBy(MessageAttachment::getMessageId,
                        Collectors.mapping(AttachmentResponse::fromEntity, Collectors.toList())));

        return messages.stream()
                .map(message -> CommunityMessageResponse.fromEntity(message, authors.get(message.getUserId()),
                        attachments.getOrDefault(message.getId(), Collections.emptyList()), false))
                .collect(Collectors.toList());
    }

    private static long maxId(List<CommunityMessage> messages, long fallback) {
        return messages.stream().mapToLong(CommunityMessage::getId).max().orElse(fallback);
    }
}
