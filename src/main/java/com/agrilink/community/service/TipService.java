package com.agrilink.community.service;

import com.agrilink.community.api.dto.PageResponse;
import com.agrilink.community.api.dto.TipCategoryResponse;
import com.agrilink.community.api.dto.TipRequest;
import com.agrilink.community.api.dto.TipResponse;
import com.agrilink.community.api.dto.ToggleResponse;
import com.agrilink.community.api.dto.UserSummary;
import com.agrilink.community.domain.model.SavedTip;
import com.agrilink.community.domain.model.Tip;
import com.agrilink.community.domain.model.TipCategory;
import com.agrilink.community.domain.model.TipLike;
import com.agrilink.community.exception.FieldValidationException;
import com.agrilink.community.exception.ResourceNotFoundException;
import com.agrilink.community.repository.SavedTipRepository;
import com.agrilink.community.repository.TipCategoryRepository;
import com.agrilink.community.repository.TipLikeRepository;
import com.agrilink.community.repository.TipRepository;
import com.agrilink.community.security.AuthenticatedUser;
import com.agrilink.community.security.SecurityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Service for expert tips: listing, reading, authoring, likes and saves.
 *
 * @author AgriLink Team
 */
@Service
public class TipService {

    private static final Logger logger = LoggerFactory.getLogger(TipService.class);

    private final TipRepository tipRepository;
    private final TipCategoryRepository tipCategoryRepository;
    private final TipLikeRepository tipLikeRepository;
    private final SavedTipRepository savedTipRepository;
    private final UserDirectory userDirectory;
    private final LikeToggler likeToggler;
    private final int pageSize;

    public TipService(
            TipRepository tipRepository,
            TipCategoryRepository tipCategoryRepository,
            TipLikeRepository tipLikeRepository,
            SavedTipRepository savedTipRepository,
            UserDirectory userDirectory,
            LikeToggler likeToggler,
            @Value("${agrilink.pagination.tips:10}") int pageSize
    ) {
        this.tipRepository = tipRepository;
        this.tipCategoryRepository = tipCategoryRepository;
        this.tipLikeRepository = tipLikeRepository;
        this.savedTipRepository = savedTipRepository;
        this.userDirectory = userDirectory;
        this.likeToggler = likeToggler;
        this.pageSize = pageSize;
    }

    /**
     * Page through tips.
     *
     * @param categoryId Category filter, or null
     * @param search Matched against title, content and tags, or null
     * @param featured Featured filter, or null
     * @param sort popular, views or latest
     * @param page 1-based page number
     * @param viewerId Caller for is_liked / is_saved, or null
     */
    @Transactional(readOnly = true)
    public PageResponse<TipResponse> listTips(Long categoryId, String search, Boolean featured, String sort,
                                              Integer page, Long viewerId) {
        Page<Tip> tips = tipRepository.search(categoryId, Paging.likePattern(search), featured,
                Paging.page(page, pageSize, ListingSort.fromValue(sort).toSort()));
        return PageResponse.of(tips, toResponses(tips.getContent(), viewerId));
    }

    @Transactional(readOnly = true)
    public PageResponse<TipResponse> listFeatured(Integer page, Long viewerId) {
        Page<Tip> tips = tipRepository.findByFeaturedTrue(Paging.page(page, pageSize, ListingSort.LATEST.toSort()));
        return PageResponse.of(tips, toResponses(tips.getContent(), viewerId));
    }

    /**
     * Read a tip and count the view.
     */
    @Transactional
    public TipResponse viewTip(Long id, Long viewerId) {
        if (tipRepository.incrementViews(id) == 0) {
            throw new ResourceNotFoundException("Tip", id);
        }
        Tip tip = findTip(id);
        return toResponses(List.of(tip), viewerId).get(0);
    }

    /**
     * Publish a tip. Only experts write tips.
     */
    @Transactional
    public TipResponse createTip(AuthenticatedUser actor, TipRequest request) {
        if (!actor.isExpert()) {
            throw new AccessDeniedException("Only experts can create tips");
        }
        requireCategory(request.getCategoryId());

        String title = request.getTitle().trim();
        Tip tip = Tip.builder()
                .userId(actor.getId())
                .categoryId(request.getCategoryId())
                .title(title)
                .slug(Slugs.uniqueSlug(title, tipRepository::existsBySlug))
                .content(request.getContent())
                .tags(normalizeTags(request.getTags()))
                .featured(Boolean.TRUE.equals(request.getIsFeatured()))
                .build();
        tip = tipRepository.save(tip);

        logger.info("Expert {} created tip {} ({})", actor.getId(), tip.getId(), tip.getSlug());
        return toResponses(List.of(tip), actor.getId()).get(0);
    }

    @Transactional
    public TipResponse updateTip(AuthenticatedUser actor, Long id, TipRequest request) {
        Tip tip = findTip(id);
        SecurityUtils.verifyOwnerOrAdmin(actor, tip.getUserId(), "update this tip");

        if (request.getCategoryId() != null) {
            requireCategory(request.getCategoryId());
            tip.setCategoryId(request.getCategoryId());
        }
        if (request.getTitle() != null) {
            String title = request.getTitle().trim();
            if (!title.equals(tip.getTitle())) {
                tip.setTitle(title);
                tip.setSlug(Slugs.uniqueSlug(title, slug -> tipRepository.existsBySlugAndIdNot(slug, id)));
            }
        }
        if (request.getContent() != null) {
            tip.setContent(request.getContent());
        }
        if (request.getTags() != null) {
            tip.setTags(normalizeTags(request.getTags()));
        }
        if (request.getIsFeatured() != null) {
            tip.setFeatured(request.getIsFeatured());
        }
        tip = tipRepository.save(tip);

        logger.info("User {} updated tip {}", actor.getId(), id);
        return toResponses(List.of(tip), actor.getId()).get(0);
    }

    @Transactional
    public void deleteTip(AuthenticatedUser actor, Long id) {
        Tip tip = findTip(id);
        SecurityUtils.verifyOwnerOrAdmin(actor, tip.getUserId(), "delete this tip");

        tipLikeRepository.deleteByTipIdIn(List.of(id));
        savedTipRepository.deleteByTipIdIn(List.of(id));
        tipRepository.delete(tip);

        logger.info("User {} deleted tip {}", actor.getId(), id);
    }

    @Transactional
    public ToggleResponse toggleLike(AuthenticatedUser actor, Long id) {
        findTip(id);
        Long userId = actor.getId();
        return likeToggler.toggleLike("tip", id, userId,
                () -> tipLikeRepository.deleteByTipIdAndUserId(id, userId),
                () -> tipLikeRepository.save(TipLike.builder().tipId(id).userId(userId).build()),
                delta -> tipRepository.adjustLikes(id, delta),
                () -> tipRepository.findLikesCount(id));
    }

    @Transactional
    public ToggleResponse toggleSave(AuthenticatedUser actor, Long id) {
        findTip(id);
        Long userId = actor.getId();
        return likeToggler.toggleSave("tip", id, userId,
                () -> savedTipRepository.deleteByTipIdAndUserId(id, userId),
                () -> savedTipRepository.save(SavedTip.builder().tipId(id).userId(userId).build()));
    }

    @Transactional(readOnly = true)
    public PageResponse<TipResponse> listSaved(AuthenticatedUser actor, Integer page) {
        Page<Tip> tips = tipRepository.findSavedByUser(actor.getId(),
                Paging.page(page, pageSize, ListingSort.LATEST.toSort()));
        return PageResponse.of(tips, toResponses(tips.getContent(), actor.getId()));
    }

    /**
     * Tips written by the calling expert.
     */
    @Transactional(readOnly = true)
    public PageResponse<TipResponse> listMyTips(AuthenticatedUser actor, Integer page) {
        if (!actor.isExpert()) {
            throw new AccessDeniedException("Only experts have their own tips");
        }
        Page<Tip> tips = tipRepository.findByUserId(actor.getId(),
                Paging.page(page, pageSize, Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id"))));
        return PageResponse.of(tips, toResponses(tips.getContent(), actor.getId()));
    }

    private Tip findTip(Long id) {
        return tipRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Tip", id));
    }

    private void requireCategory(Long categoryId) {
        if (!tipCategoryRepository.existsById(categoryId)) {
            throw new FieldValidationException("category_id", "The selected category id is invalid.");
        }
    }

    private static List<String> normalizeTags(List<String> tags) {
        if (tags == null) {
            return new ArrayList<>();
        }
        return tags.stream()
                .filter(tag -> tag != null && !tag.isBlank())
                .map(String::trim)
                .distinct()
                .collect(Collectors.toList());
    }

    private List<TipResponse> toResponses(List<Tip> tips, Long viewerId) {
        if (tips.isEmpty()) {
            return new ArrayList<>();
        }
        List<Long> tipIds = tips.stream().map(Tip::getId).collect(Collectors.toList());

        Map<Long, UserSummary> authors = userDirectory.summaries(
                tips.stream().map(Tip::getUserId).collect(Collectors.toSet()));
        Map<Long, TipCategoryResponse> categories = tipCategoryRepository.findAllById(
                        tips.stream().map(Tip::getCategoryId).collect(Collectors.toSet()))
                .stream()
                .collect(Collectors.toMap(TipCategory::getId, category -> TipCategoryResponse.fromEntity(category, null)));

        Set<Long> liked = viewerId == null ? Collections.emptySet()
                : new HashSet<>(tipLikeRepository.findLikedTipIds(viewerId, tipIds));
        Set<Long> saved = viewerId == null ? Collections.emptySet()
                : new HashSet<>(savedTipRepository.findSavedTipIds(viewerId, tipIds));

        return tips.stream()
                .map(tip -> TipResponse.fromEntity(tip, authors.get(tip.getUserId()),
                        categories.get(tip.getCategoryId()),
                        liked.contains(tip.getId()), saved.contains(tip.getId())))
                .collect(Collectors.toList());
    }
}
