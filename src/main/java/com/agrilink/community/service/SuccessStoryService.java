package com.agrilink.community.service;

import com.agrilink.community.api.dto.CommentRequest;
import com.agrilink.community.api.dto.PageResponse;
import com.agrilink.community.api.dto.StoryCommentResponse;
import com.agrilink.community.api.dto.StoryForm;
import com.agrilink.community.api.dto.StoryImageResponse;
import com.agrilink.community.api.dto.StoryResponse;
import com.agrilink.community.api.dto.ToggleResponse;
import com.agrilink.community.api.dto.UserSummary;
import com.agrilink.community.domain.model.StoryComment;
import com.agrilink.community.domain.model.StoryImage;
import com.agrilink.community.domain.model.StoryLike;
import com.agrilink.community.domain.model.SuccessStory;
import com.agrilink.community.exception.FieldValidationException;
import com.agrilink.community.exception.ResourceNotFoundException;
import com.agrilink.community.infrastructure.storage.FileStorageService;
import com.agrilink.community.infrastructure.storage.StorageFolder;
import com.agrilink.community.infrastructure.storage.StoredFile;
import com.agrilink.community.infrastructure.storage.UploadPolicy;
import com.agrilink.community.repository.StoryCommentRepository;
import com.agrilink.community.repository.StoryImageRepository;
import com.agrilink.community.repository.StoryLikeRepository;
import com.agrilink.community.repository.SuccessStoryRepository;
import com.agrilink.community.security.AuthenticatedUser;
import com.agrilink.community.security.SecurityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Service for farmers' success stories with their images, threaded comments and likes.
 *
 * @author AgriLink Team
 */
@Service
public class SuccessStoryService {

    private static final Logger logger = LoggerFactory.getLogger(SuccessStoryService.class);

    private final SuccessStoryRepository storyRepository;
    private final StoryImageRepository imageRepository;
    private final StoryCommentRepository commentRepository;
    private final StoryLikeRepository likeRepository;
    private final UserDirectory userDirectory;
    private final FileStorageService fileStorageService;
    private final LikeToggler likeToggler;
    private final int pageSize;

    public SuccessStoryService(
            SuccessStoryRepository storyRepository,
            StoryImageRepository imageRepository,
            StoryCommentRepository commentRepository,
            StoryLikeRepository likeRepository,
            UserDirectory userDirectory,
            FileStorageService fileStorageService,
            LikeToggler likeToggler,
            @Value("${agrilink.pagination.stories:10}") int pageSize
    ) {
        this.storyRepository = storyRepository;
        this.imageRepository = imageRepository;
        this.commentRepository = commentRepository;
        this.likeRepository = likeRepository;
        this.userDirectory = userDirectory;
        this.fileStorageService = fileStorageService;
        this.likeToggler = likeToggler;
        this.pageSize = pageSize;
    }

    /**
     * Page through stories.
     *
     * @param search Matched against title, content and crop type, or null
     * @param cropType Exact crop type filter, or null
     * @param featured Featured filter, or null
     * @param sort popular, views or latest
     * @param page 1-based page number
     * @param viewerId Caller for is_liked, or null
     */
    @Transactional(readOnly = true)
    public PageResponse<StoryResponse> listStories(String search, String cropType, Boolean featured, String sort,
                                                   Integer page, Long viewerId) {
        String crop = cropType == null || cropType.isBlank() ? null : cropType.trim();
        Page<SuccessStory> stories = storyRepository.search(Paging.likePattern(search), crop, featured,
                Paging.page(page, pageSize, ListingSort.fromValue(sort).toSort()));
        return PageResponse.of(stories, toResponses(stories.getContent(), viewerId));
    }

    @Transactional(readOnly = true)
    public PageResponse<StoryResponse> listMyStories(AuthenticatedUser actor, Integer page) {
        Page<SuccessStory> stories = storyRepository.findByUserId(actor.getId(),
                Paging.page(page, pageSize, ListingSort.LATEST.toSort()));
        return PageResponse.of(stories, toResponses(stories.getContent(), actor.getId()));
    }

    /**
     * Read a story with its images and full comment tree, counting the view.
     */
    @Transactional
    public StoryResponse viewStory(Long id, Long viewerId) {
        if (storyRepository.incrementViews(id) == 0) {
            throw new ResourceNotFoundException("Success story", id);
        }
        SuccessStory story = findStory(id);

        StoryResponse response = toResponses(List.of(story), viewerId).get(0);
        List<StoryComment> comments = commentRepository.findByStoryIdOrderByCreatedAtAscIdAsc(id);
        response.setComments(buildTree(comments, comments.stream()
                .filter(comment -> comment.getParentId() == null)
                .collect(Collectors.toList())));
        return response;
    }

    /**
     * Publish a story. Captions are matched to images by position.
     */
    @Transactional
    public StoryResponse createStory(AuthenticatedUser actor, StoryForm form) {
        SuccessStory story = SuccessStory.builder()
                .userId(actor.getId())
                .title(form.getTitle().trim())
                .content(form.getContent())
                .location(form.getLocation())
                .cropType(form.getCropType())
                .yieldImprovement(form.getYieldImprovement())
                .yieldUnit(form.getYieldUnit())
                .build();
        story = storyRepository.save(story);

        storeImages(story.getId(), form.getImages(), form.getCaptions(), 0);

        logger.info("User {} created success story {}", actor.getId(), story.getId());
        return toResponses(List.of(story), actor.getId()).get(0);
    }

    /**
     * Apply the present fields of a story update. New images go after the existing ones.
     */
    @Transactional
    public StoryResponse updateStory(AuthenticatedUser actor, Long id, StoryForm form) {
        SuccessStory story = findStory(id);
        SecurityUtils.verifyOwnerOrAdmin(actor, story.getUserId(), "update this story");

        if (form.getTitle() != null) {
            story.setTitle(form.getTitle().trim());
        }
        if (form.getContent() != null) {
            story.setContent(form.getContent());
        }
        if (form.getLocation() != null) {
            story.setLocation(form.getLocation());
        }
        if (form.getCropType() != null) {
            story.setCropType(form.getCropType());
        }
        if (form.getYieldImprovement() != null) {
            story.setYieldImprovement(form.getYieldImprovement());
        }
        if (form.getYieldUnit() != null) {
            story.setYieldUnit(form.getYieldUnit());
        }
        story = storyRepository.save(story);

        storeImages(id, form.getImages(), form.getCaptions(), imageRepository.findMaxSortOrder(id) + 1);

        logger.info("User {} updated success story {}", actor.getId(), id);
        return toResponses(List.of(story), actor.getId()).get(0);
    }

    /**
     * Delete a story with its comments, likes and images. Image files go once the rows are gone.
     */
    @Transactional
    public void deleteStory(AuthenticatedUser actor, Long id) {
        SuccessStory story = findStory(id);
        SecurityUtils.verifyOwnerOrAdmin(actor, story.getUserId(), "delete this story");

        List<StoryImage> images = imageRepository.findByStoryIdOrderBySortOrderAsc(id);
        likeRepository.deleteByStoryId(id);
        commentRepository.deleteByStoryId(id);
        imageRepository.deleteAll(images);
        storyRepository.delete(story);

        List<String> paths = images.stream().map(StoryImage::getImagePath).collect(Collectors.toList());
        AfterTransaction.commit(() -> paths.forEach(fileStorageService::delete));

        logger.info("User {} deleted success story {} with {} images", actor.getId(), id, images.size());
    }

    @Transactional
    public ToggleResponse toggleLike(AuthenticatedUser actor, Long id) {
        findStory(id);
        Long userId = actor.getId();
        return likeToggler.toggleLike("story", id, userId,
                () -> likeRepository.deleteByStoryIdAndUserId(id, userId),
                () -> likeRepository.save(StoryLike.builder().storyId(id).userId(userId).build()),
                delta -> storyRepository.adjustLikes(id, delta),
                () -> storyRepository.findLikesCount(id));
    }

    /**
     * Page through top-level comments, oldest first, each with its replies.
     */
    @Transactional(readOnly = true)
    public PageResponse<StoryCommentResponse> listComments(Long storyId, Integer page) {
        findStory(storyId);
        Page<StoryComment> topLevel = commentRepository.findByStoryIdAndParentIdIsNull(storyId,
                Paging.page(page, pageSize, Sort.by(Sort.Order.asc("createdAt"), Sort.Order.asc("id"))));
        List<StoryComment> all = commentRepository.findByStoryIdOrderByCreatedAtAscIdAsc(storyId);
        return PageResponse.of(topLevel, buildTree(all, topLevel.getContent()));
    }

    /**
     * Comment on a story or reply to one of its comments.
     *
     * @throws FieldValidationException if the parent comment is missing or belongs to another story
     */
    @Transactional
    public StoryCommentResponse addComment(AuthenticatedUser actor, Long storyId, CommentRequest request) {
        findStory(storyId);

        if (request.getParentId() != null) {
            StoryComment parent = commentRepository.findById(request.getParentId())
                    .orElseThrow(() -> new FieldValidationException("parent_id", "The selected parent id is invalid."));
            if (!parent.getStoryId().equals(storyId)) {
                throw new FieldValidationException("parent_id", "The parent comment belongs to another story.");
            }
        }

        StoryComment comment = StoryComment.builder()
                .storyId(storyId)
                .userId(actor.getId())
                .comment(request.getComment().trim())
                .parentId(request.getParentId())
                .build();
        comment = commentRepository.save(comment);

        storyRepository.updateCommentsCount(storyId, (int) commentRepository.countByStoryId(storyId));

        logger.info("User {} commented on success story {} (comment {})", actor.getId(), storyId, comment.getId());
        return StoryCommentResponse.fromEntity(comment, userDirectory.summary(actor.getId()));
    }

    private SuccessStory findStory(Long id) {
        return storyRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Success story", id));
    }

    private void storeImages(Long storyId, List<MultipartFile> images, List<String> captions, int firstSortOrder) {
        if (images == null) {
            return;
        }
        List<String> stored = new ArrayList<>();
        AfterTransaction.rollback(() -> stored.forEach(fileStorageService::delete));

        int sortOrder = firstSortOrder;
        for (int i = 0; i < images.size(); i++) {
            MultipartFile image = images.get(i);
            if (image == null || image.isEmpty()) {
                continue;
            }
            StoredFile file = fileStorageService.store(image, StorageFolder.SUCCESS_STORIES, UploadPolicy.IMAGE);
            stored.add(file.relativePath());
            imageRepository.save(StoryImage.builder()
                    .storyId(storyId)
                    .imagePath(file.relativePath())
                    .caption(captions != null && i < captions.size() ? captions.get(i) : null)
                    .sortOrder(sortOrder++)
                    .build());
        }
    }

    /**
     * Attach each comment's replies below it, recursively.
     *
     * @param all Every comment of the story, oldest first
     * @param roots Comments to return at the top
     */
    private List<StoryCommentResponse> buildTree(List<StoryComment> all, List<StoryComment> roots) {
        Map<Long, List<StoryComment>> children = new HashMap<>();
        for (StoryComment comment : all) {
            if (comment.getParentId() != null) {
                children.computeIfAbsent(comment.getParentId(), key -> new ArrayList<>()).add(comment);
            }
        }
        Map<Long, UserSummary> authors = userDirectory.summaries(
                all.stream().map(StoryComment::getUserId).collect(Collectors.toSet()));

        List<StoryCommentResponse> result = new ArrayList<>();
        for (StoryComment root : roots) {
            result.add(toTree(root, children, authors, new HashSet<>()));
        }
        return result;
    }

    private StoryCommentResponse toTree(StoryComment comment, Map<Long, List<StoryComment>> children,
                                        Map<Long, UserSummary> authors, Set<Long> visited) {
        StoryCommentResponse node = StoryCommentResponse.fromEntity(comment, authors.get(comment.getUserId()));
        if (visited.add(comment.getId())) {
            for (StoryComment child : children.getOrDefault(comment.getId(), Collections.emptyList())) {
                node.getReplies().add(toTree(child, children, authors, visited));
            }
        }
        return node;
    }

    private List<StoryResponse> toResponses(List<SuccessStory> stories, Long viewerId) {
        if (stories.isEmpty()) {
            return new ArrayList<>();
        }
        List<Long> storyIds = stories.stream().map(SuccessStory::getId).collect(Collectors.toList());

        Map<Long, UserSummary> authors = userDirectory.summaries(
                stories.stream().map(SuccessStory::getUserId).collect(Collectors.toSet()));
        Map<Long, List<StoryImageResponse>> images = imageRepository.findByStoryIdInOrderBySortOrderAsc(storyIds).stream()
                .collect(Collectors.groupingBy(StoryImage::getStoryId,
                        Collectors.mapping(StoryImageResponse::fromEntity, Collectors.toList())));
        Set<Long> liked = viewerId == null ? Collections.emptySet()
                : new HashSet<>(likeRepository.findLikedStoryIds(viewerId, storyIds));

        return stories.stream()
                .map(story -> StoryResponse.fromEntity(story, authors.get(story.getUserId()),
                        images.getOrDefault(story.getId(), new ArrayList<>()), liked.contains(story.getId())))
                .collect(Collectors.toList());
    }
}
