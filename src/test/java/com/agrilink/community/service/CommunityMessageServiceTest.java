package com.agrilink.community.service;

import com.agrilink.community.api.dto.CommunityMessageResponse;
import com.agrilink.community.api.dto.LatestMessagesResponse;
import com.agrilink.community.api.dto.MessageForm;
import com.agrilink.community.api.dto.PollResponse;
import com.agrilink.community.api.dto.ToggleResponse;
import com.agrilink.community.domain.model.CommunityMessage;
import com.agrilink.community.domain.model.MessageAttachment;
import com.agrilink.community.domain.model.MessageAttachment.FileType;
import com.agrilink.community.domain.model.MessageLike;
import com.agrilink.community.domain.model.User.Role;
import com.agrilink.community.exception.ResourceNotFoundException;
import com.agrilink.community.infrastructure.messaging.KafkaProducerService;
import com.agrilink.community.infrastructure.messaging.events.CommunityEvent;
import com.agrilink.community.infrastructure.metrics.CloudWatchMetricsService;
import com.agrilink.community.infrastructure.storage.FileStorageService;
import com.agrilink.community.infrastructure.storage.StorageFolder;
import com.agrilink.community.infrastructure.storage.StoredFile;
import com.agrilink.community.infrastructure.storage.UploadPolicy;
import com.agrilink.community.repository.CommunityMessageRepository;
import com.agrilink.community.repository.MessageAttachmentRepository;
import com.agrilink.community.repository.MessageLikeRepository;
import com.agrilink.community.security.AuthenticatedUser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.security.access.AccessDeniedException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.agrilink.community.testutil.TestDataBuilder.actor;
import static com.agrilink.community.testutil.TestDataBuilder.message;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for CommunityMessageService.
 * Covers posting, polling cursors, admin-only flags and cascading deletes.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("CommunityMessageService Unit Tests")
class CommunityMessageServiceTest {

    @Mock
    private CommunityMessageRepository messageRepository;

    @Mock
    private MessageAttachmentRepository attachmentRepository;

    @Mock
    private MessageLikeRepository likeRepository;

    @Mock
    private MessageReplyService replyService;

    @Mock
    private UserDirectory userDirectory;

    @Mock
    private FileStorageService fileStorageService;

    @Mock
    private KafkaProducerService kafkaProducerService;

    @Mock
    private CloudWatchMetricsService metricsService;

    private CommunityMessageService messageService;

    private final AuthenticatedUser member = actor(1L, Role.FARMER);
    private final AuthenticatedUser admin = actor(99L, Role.ADMIN);

    @BeforeEach
    void setUp() {
        messageService = new CommunityMessageService(messageRepository, attachmentRepository, likeRepository,
                replyService, userDirectory, fileStorageService, new LikeToggler(metricsService),
                kafkaProducerService, 20, 3000L);
    }

    private void echoSavedMessage() {
        when(messageRepository.save(any(CommunityMessage.class))).thenAnswer(invocation -> {
            CommunityMessage saved = invocation.getArgument(0);
            if (saved.getId() == null) {
                saved.setId(400L);
            }
            return saved;
        });
    }

    // ========================================
    // createMessage() Tests
    // ========================================

    @Test
    @DisplayName("createMessage - Success: Non-admin flags are ignored and the post is published")
    void createMessage_IgnoresFlagsForMembers() {
        // Given
        echoSavedMessage();
        MessageForm form = MessageForm.builder()
                .content("Looking for certified maize seed")
                .tags(List.of("seed", "maize"))
                .pinned(true)
                .announcement(true)
                .build();

        // When
        CommunityMessageResponse result = messageService.createMessage(member, form);

        // Then
        assertThat(result.getId()).isEqualTo(400L);
        assertThat(result.getIsPinned()).isFalse();
        assertThat(result.getIsAnnouncement()).isFalse();
        assertThat(result.getTags()).containsExactly("seed", "maize");

        ArgumentCaptor<CommunityEvent> event = ArgumentCaptor.forClass(CommunityEvent.class);
        verify(kafkaProducerService).publishCommunityEvent(event.capture());
        assertThat(event.getValue().getEventType()).isEqualTo(CommunityEvent.EventType.MESSAGE_POSTED);
    }

    @Test
    @DisplayName("createMessage - Success: Admin can pin and announce")
    void createMessage_AdminFlags() {
        // Given
        echoSavedMessage();
        MessageForm form = MessageForm.builder().content("Field day on Saturday").pinned(true).announcement(true).build();

        // When
        CommunityMessageResponse result = messageService.createMessage(admin, form);

        // Then
        assertThat(result.getIsPinned()).isTrue();
        assertThat(result.getIsAnnouncement()).isTrue();
    }

    @Test
    @DisplayName("createMessage - Success: Attachments are stored with type from MIME and positional captions")
    void createMessage_StoresAttachments() {
        // Given
        echoSavedMessage();
        MockMultipartFile photo = new MockMultipartFile("attachments", "field.jpg", "image/jpeg", new byte[]{1, 2, 3});
        MockMultipartFile report = new MockMultipartFile("attachments", "soil.pdf", "application/pdf", new byte[]{4, 5});
        when(fileStorageService.store(photo, StorageFolder.COMMUNITY_FILES, UploadPolicy.ATTACHMENT))
                .thenReturn(new StoredFile("communityfiles/a.jpg", "field.jpg", "image/jpeg", 3L));
        when(fileStorageService.store(report, StorageFolder.COMMUNITY_FILES, UploadPolicy.ATTACHMENT))
                .thenReturn(new StoredFile("communityfiles/b.pdf", "soil.pdf", "application/pdf", 2L));

        MessageForm form = MessageForm.builder()
                .content("Soil test results")
                .attachments(List.of(photo, report))
                .captions(List.of("My field"))
                .build();

        // When
        messageService.createMessage(member, form);

        // Then
        ArgumentCaptor<MessageAttachment> saved = ArgumentCaptor.forClass(MessageAttachment.class);
        verify(attachmentRepository, times(2)).save(saved.capture());
        List<MessageAttachment> attachments = saved.getAllValues();
        assertThat(attachments.get(0).getFileType()).isEqualTo(FileType.IMAGE);
        assertThat(attachments.get(0).getCaption()).isEqualTo("My field");
        assertThat(attachments.get(0).getSortOrder()).isZero();
        assertThat(attachments.get(1).getFileType()).isEqualTo(FileType.DOCUMENT);
        assertThat(attachments.get(1).getCaption()).isNull();
        assertThat(attachments.get(1).getSortOrder()).isEqualTo(1);
    }

    // ========================================
    // updateMessage() Tests
    // ========================================

    @Test
    @DisplayName("updateMessage - Success: Absent tags are kept, content replaced")
    void updateMessage_KeepsTagsWhenAbsent() {
        // Given
        CommunityMessage existing = message().id(400L).author(1L).build();
        existing.setTags(new ArrayList<>(List.of("irrigation")));
        when(messageRepository.findById(400L)).thenReturn(Optional.of(existing));
        echoSavedMessage();

        // When
        CommunityMessageResponse result = messageService.updateMessage(member, 400L,
                MessageForm.builder().content("Edited question").pinned(true).build());

        // Then
        assertThat(result.getContent()).isEqualTo("Edited question");
        assertThat(result.getTags()).containsExactly("irrigation");
        assertThat(result.getIsPinned()).isFalse();
    }

    @Test
    @DisplayName("updateMessage - Failure: Only the author or an admin may edit")
    void updateMessage_NotOwner() {
        // Given
        when(messageRepository.findById(400L)).thenReturn(Optional.of(message().id(400L).author(5L).build()));

        // When / Then
        assertThatThrownBy(() -> messageService.updateMessage(member, 400L,
                MessageForm.builder().content("Hijack").build()))
                .isInstanceOf(AccessDeniedException.class);
        verify(messageRepository, never()).save(any());
    }

    // ========================================
    // deleteMessage() Tests
    // ========================================

    @Test
    @DisplayName("deleteMessage - Success: Admin removes replies, likes, attachments and files")
    void deleteMessage_Cascades() {
        // Given
        CommunityMessage existing = message().id(400L).author(5L).build();
        MessageAttachment attachment = MessageAttachment.builder()
                .messageId(400L).fileName("a.jpg").filePath("communityfiles/a.jpg")
                .fileType(FileType.IMAGE).mimeType("image/jpeg").fileSize(3L).build();
        when(messageRepository.findById(400L)).thenReturn(Optional.of(existing));
        when(attachmentRepository.findByMessageIdOrderBySortOrderAsc(400L)).thenReturn(List.of(attachment));

        // When
        messageService.deleteMessage(admin, 400L);

        // Then
        verify(replyService).deleteAllForMessage(400L);
        verify(likeRepository).deleteByMessageId(400L);
        verify(attachmentRepository).deleteAll(List.of(attachment));
        verify(messageRepository).delete(existing);
        verify(fileStorageService).delete("communityfiles/a.jpg");
    }

    // ========================================
    // viewMessage() / toggleLike() Tests
    // ========================================

    @Test
    @DisplayName("viewMessage - Failure: Unknown id is not found")
    void viewMessage_NotFound() {
        // Given
        when(messageRepository.incrementViews(404L)).thenReturn(0);

        // When / Then
        assertThatThrownBy(() -> messageService.viewMessage(404L, null))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("viewMessage - Success: Counts the view and attaches the reply tree")
    void viewMessage_Success() {
        // Given
        CommunityMessage existing = message().id(400L).build();
        when(messageRepository.incrementViews(400L)).thenReturn(1);
        when(messageRepository.findById(400L)).thenReturn(Optional.of(existing));
        when(likeRepository.existsByMessageIdAndUserId(400L, 1L)).thenReturn(true);
        when(replyService.replyTree(400L, 1L)).thenReturn(new ArrayList<>());

        // When
        CommunityMessageResponse result = messageService.viewMessage(400L, 1L);

        // Then
        assertThat(result.getIsLiked()).isTrue();
        assertThat(result.getReplies()).isEmpty();
    }

    @Test
    @DisplayName("toggleLike - Success: First toggle likes, counter incremented")
    void toggleLike_Likes() {
        // Given
        when(messageRepository.findById(400L)).thenReturn(Optional.of(message().id(400L).build()));
        when(likeRepository.deleteByMessageIdAndUserId(400L, 1L)).thenReturn(0);
        when(messageRepository.findLikesCount(400L)).thenReturn(1);

        // When
        ToggleResponse result = messageService.toggleLike(member, 400L);

        // Then
        assertThat(result.getIsLiked()).isTrue();
        assertThat(result.getLikesCount()).isEqualTo(1);
        verify(likeRepository).save(any(MessageLike.class));
        verify(messageRepository).adjustLikes(400L, 1);
    }

    // ========================================
    // latest() / poll() Tests
    // ========================================

    @Test
    @DisplayName("latest - Returns the highest id as the new cursor")
    void latest_AdvancesCursor() {
        // Given
        when(messageRepository.findTop10ByIdGreaterThanOrderByIdDesc(5L))
                .thenReturn(List.of(message().id(8L).build(), message().id(7L).build()));

        // When
        LatestMessagesResponse result = messageService.latest(5L);

        // Then
        assertThat(result.getLastId()).isEqualTo(8L);
        assertThat(result.getData()).hasSize(2);
    }

    @Test
    @DisplayName("latest - Keeps the given cursor when nothing is new")
    void latest_NothingNew() {
        // Given
        when(messageRepository.findTop10ByIdGreaterThanOrderByIdDesc(9L)).thenReturn(List.of());

        // When
        LatestMessagesResponse result = messageService.latest(9L);

        // Then
        assertThat(result.getLastId()).isEqualTo(9L);
        assertThat(result.getData()).isEmpty();
    }

    @Test
    @DisplayName("poll - Cursor of zero disables the id filter and limits to fifty")
    void poll_ZeroCursor() {
        // Given
        Instant since = Instant.parse("2024-05-01T10:00:00Z");
        when(messageRepository.findForPolling(isNull(), eq(since), any(Pageable.class))).thenReturn(List.of());

        // When
        PollResponse result = messageService.poll(0L, since);

        // Then
        assertThat(result.isHasNewMessages()).isFalse();
        assertThat(result.getLastId()).isZero();
        assertThat(result.getPollingInterval()).isEqualTo(3000L);

        ArgumentCaptor<Pageable> page = ArgumentCaptor.forClass(Pageable.class);
        verify(messageRepository).findForPolling(isNull(), eq(since), page.capture());
        assertThat(page.getValue().getPageSize()).isEqualTo(50);
    }

    @Test
    @DisplayName("poll - New messages advance the cursor")
    void poll_NewMessages() {
        // Given
        when(messageRepository.findForPolling(eq(10L), isNull(), any(Pageable.class)))
                .thenReturn(List.of(message().id(12L).pinned().build(), message().id(11L).build()));

        // When
        PollResponse result = messageService.poll(10L, null);

        // Then
        assertThat(result.isHasNewMessages()).isTrue();
        assertThat(result.getLastId()).isEqualTo(12L);
        assertThat(result.getData()).extracting(CommunityMessageResponse::getId).containsExactly(12L, 11L);
    }
}
