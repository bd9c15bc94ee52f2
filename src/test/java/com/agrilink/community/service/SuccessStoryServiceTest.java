package com.agrilink.community.service;

import com.agrilink.community.api.dto.CommentRequest;
import com.agrilink.community.api.dto.StoryCommentResponse;
import com.agrilink.community.api.dto.StoryForm;
import com.agrilink.community.api.dto.StoryResponse;
import com.agrilink.community.domain.model.StoryComment;
import com.agrilink.community.domain.model.StoryImage;
import com.agrilink.community.domain.model.SuccessStory;
import com.agrilink.community.domain.model.User.Role;
import com.agrilink.community.exception.FieldValidationException;
import com.agrilink.community.infrastructure.metrics.CloudWatchMetricsService;
import com.agrilink.community.infrastructure.storage.FileStorageService;
import com.agrilink.community.infrastructure.storage.StorageFolder;
import com.agrilink.community.infrastructure.storage.StoredFile;
import com.agrilink.community.infrastructure.storage.UploadPolicy;
import com.agrilink.community.repository.StoryCommentRepository;
import com.agrilink.community.repository.StoryImageRepository;
import com.agrilink.community.repository.StoryLikeRepository;
import com.agrilink.community.repository.SuccessStoryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.web.multipart.MultipartFile;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.agrilink.community.testutil.TestDataBuilder.actor;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for SuccessStoryService.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("SuccessStoryService Unit Tests")
class SuccessStoryServiceTest {

    private static final Long STORY_ID = 500L;

    @Mock
    private SuccessStoryRepository storyRepository;

    @Mock
    private StoryImageRepository imageRepository;

    @Mock
    private StoryCommentRepository commentRepository;

    @Mock
    private StoryLikeRepository likeRepository;

    @Mock
    private UserDirectory userDirectory;

    @Mock
    private FileStorageService fileStorageService;

    @Mock
    private CloudWatchMetricsService metricsService;

    private SuccessStoryService storyService;

    @BeforeEach
    void setUp() {
        storyService = new SuccessStoryService(storyRepository, imageRepository, commentRepository, likeRepository,
                userDirectory, fileStorageService, new LikeToggler(metricsService), 10);
    }

    private static SuccessStory story(Long userId) {
        SuccessStory story = SuccessStory.builder()
                .userId(userId)
                .title("Doubled my maize harvest")
                .content("Switching to certified seed made the difference.")
                .cropType("Maize")
                .build();
        story.setId(STORY_ID);
        story.setCreatedAt(Instant.now());
        return story;
    }

    private static StoryComment comment(Long id, Long storyId, Long parentId) {
        StoryComment comment = StoryComment.builder()
                .storyId(storyId)
                .userId(1L)
                .comment("Comment " + id)
                .parentId(parentId)
                .build();
        comment.setId(id);
        return comment;
    }

    // ========================================
    // createStory() Tests
    // ========================================

    @Test
    @DisplayName("createStory - Success: Images keep their positional captions, empty uploads are skipped")
    void createStory_WithImages() {
        // Given
        MockMultipartFile first = new MockMultipartFile("images[]", "a.jpg", "image/jpeg", new byte[]{1});
        MockMultipartFile empty = new MockMultipartFile("images[]", "", "image/jpeg", new byte[0]);
        MockMultipartFile third = new MockMultipartFile("images[]", "c.jpg", "image/jpeg", new byte[]{3});
        StoryForm form = new StoryForm();
        form.setTitle(" Doubled my maize harvest ");
        form.setContent("Switching to certified seed made the difference.");
        form.setImages(new ArrayList<MultipartFile>(List.of(first, empty, third)));
        form.setCaptions(new ArrayList<>(List.of("Before", "Skipped", "After")));

        when(storyRepository.save(any(SuccessStory.class))).thenAnswer(invocation -> {
            SuccessStory saved = invocation.getArgument(0);
            saved.setId(STORY_ID);
            return saved;
        });
        when(fileStorageService.store(first, StorageFolder.SUCCESS_STORIES, UploadPolicy.IMAGE))
                .thenReturn(new StoredFile("success_stories/a.jpg", "a.jpg", "image/jpeg", 1));
        when(fileStorageService.store(third, StorageFolder.SUCCESS_STORIES, UploadPolicy.IMAGE))
                .thenReturn(new StoredFile("success_stories/c.jpg", "c.jpg", "image/jpeg", 1));

        // When
        StoryResponse response = storyService.createStory(actor(1L, Role.FARMER), form);

        // Then
        assertThat(response.getTitle()).isEqualTo("Doubled my maize harvest");
        ArgumentCaptor<StoryImage> images = ArgumentCaptor.forClass(StoryImage.class);
        verify(imageRepository, times(2)).save(images.capture());
        assertThat(images.getAllValues()).extracting(StoryImage::getCaption).containsExactly("Before", "After");
        assertThat(images.getAllValues()).extracting(StoryImage::getSortOrder).containsExactly(0, 1);
    }

    // ========================================
    // addComment() Tests
    // ========================================

    @Test
    @DisplayName("addComment - Success: Reply to a comment of the same story updates the count")
    void addComment_Reply() {
        // Given
        when(storyRepository.findById(STORY_ID)).thenReturn(Optional.of(story(2L)));
        when(commentRepository.findById(7L)).thenReturn(Optional.of(comment(7L, STORY_ID, null)));
        when(commentRepository.save(any(StoryComment.class))).thenAnswer(invocation -> {
            StoryComment saved = invocation.getArgument(0);
            saved.setId(8L);
            return saved;
        });
        when(commentRepository.countByStoryId(STORY_ID)).thenReturn(2L);

        CommentRequest request = new CommentRequest();
        request.setComment(" Congratulations! ");
        request.setParentId(7L);

        // When
        StoryCommentResponse response = storyService.addComment(actor(1L, Role.FARMER), STORY_ID, request);

        // Then
        assertThat(response.getId()).isEqualTo(8L);
        assertThat(response.getComment()).isEqualTo("Congratulations!");
        assertThat(response.getParentId()).isEqualTo(7L);
        verify(storyRepository).updateCommentsCount(STORY_ID, 2);
    }

    @Test
    @DisplayName("addComment - Failure: Parent comment from another story is a parent_id error")
    void addComment_ParentFromOtherStory() {
        // Given
        when(storyRepository.findById(STORY_ID)).thenReturn(Optional.of(story(2L)));
        when(commentRepository.findById(7L)).thenReturn(Optional.of(comment(7L, 501L, null)));

        CommentRequest request = new CommentRequest();
        request.setComment("Nice");
        request.setParentId(7L);

        // When / Then
        assertThatThrownBy(() -> storyService.addComment(actor(1L, Role.FARMER), STORY_ID, request))
                .isInstanceOf(FieldValidationException.class)
                .satisfies(e -> assertThat(((FieldValidationException) e).getFieldErrors()).containsKey("parent_id"));
        verify(commentRepository, never()).save(any());
    }

    // ========================================
    // viewStory() / deleteStory() Tests
    // ========================================

    @Test
    @DisplayName("viewStory - Comments come back as a tree")
    void viewStory_CommentTree() {
        // Given
        when(storyRepository.incrementViews(STORY_ID)).thenReturn(1);
        when(storyRepository.findById(STORY_ID)).thenReturn(Optional.of(story(2L)));
        when(commentRepository.findByStoryIdOrderByCreatedAtAscIdAsc(STORY_ID)).thenReturn(List.of(
                comment(1L, STORY_ID, null),
                comment(2L, STORY_ID, 1L),
                comment(3L, STORY_ID, null)));

        // When
        StoryResponse response = storyService.viewStory(STORY_ID, null);

        // Then
        assertThat(response.getComments()).extracting(StoryCommentResponse::getId).containsExactly(1L, 3L);
        assertThat(response.getComments().get(0).getReplies()).extracting(StoryCommentResponse::getId)
                .containsExactly(2L);
    }

    @Test
    @DisplayName("deleteStory - Success: Owner removes rows and then image files")
    void deleteStory_Owner() {
        // Given
        SuccessStory story = story(1L);
        StoryImage image = StoryImage.builder().storyId(STORY_ID).imagePath("success_stories/a.jpg").build();
        when(storyRepository.findById(STORY_ID)).thenReturn(Optional.of(story));
        when(imageRepository.findByStoryIdOrderBySortOrderAsc(STORY_ID)).thenReturn(List.of(image));

        // When
        storyService.deleteStory(actor(1L, Role.FARMER), STORY_ID);

        // Then
        verify(likeRepository).deleteByStoryId(STORY_ID);
        verify(commentRepository).deleteByStoryId(STORY_ID);
        verify(storyRepository).delete(story);
        verify(fileStorageService).delete("success_stories/a.jpg");
    }
}
