package com.agrilink.community.service;

import com.agrilink.community.api.dto.TipCategoryListResponse;
import com.agrilink.community.api.dto.TipCategoryRequest;
import com.agrilink.community.api.dto.TipCategoryResponse;
import com.agrilink.community.domain.model.Tip;
import com.agrilink.community.domain.model.TipCategory;
import com.agrilink.community.exception.FieldValidationException;
import com.agrilink.community.exception.ResourceNotFoundException;
import com.agrilink.community.repository.SavedTipRepository;
import com.agrilink.community.repository.TipCategoryRepository;
import com.agrilink.community.repository.TipLikeRepository;
import com.agrilink.community.repository.TipRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Service for tip categories. Names are unique; the slug follows the name.
 *
 * @author AgriLink Team
 */
@Service
public class TipCategoryService {

    private static final Logger logger = LoggerFactory.getLogger(TipCategoryService.class);

    private final TipCategoryRepository tipCategoryRepository;
    private final TipRepository tipRepository;
    private final TipLikeRepository tipLikeRepository;
    private final SavedTipRepository savedTipRepository;

    public TipCategoryService(
            TipCategoryRepository tipCategoryRepository,
            TipRepository tipRepository,
            TipLikeRepository tipLikeRepository,
            SavedTipRepository savedTipRepository
    ) {
        this.tipCategoryRepository = tipCategoryRepository;
        this.tipRepository = tipRepository;
        this.tipLikeRepository = tipLikeRepository;
        this.savedTipRepository = savedTipRepository;
    }

    /**
     * All categories by name with their tip counts and the overall totals.
     */
    @Transactional(readOnly = true)
    public TipCategoryListResponse listCategories() {
        Map<Long, Long> counts = tipCounts();
        List<TipCategoryResponse> categories = tipCategoryRepository.findAllByOrderByNameAsc().stream()
                .map(category -> TipCategoryResponse.fromEntity(category, counts.getOrDefault(category.getId(), 0L)))
                .collect(Collectors.toList());
        long totalTips = counts.values().stream().mapToLong(Long::longValue).sum();
        return new TipCategoryListResponse(categories, categories.size(), totalTips);
    }

    @Transactional(readOnly = true)
    public TipCategoryResponse getCategory(Long id) {
        return TipCategoryResponse.fromEntity(findCategory(id), tipCounts().getOrDefault(id, 0L));
    }

    /**
     * @throws FieldValidationException if the name is already used
     */
    @Transactional
    public TipCategoryResponse createCategory(TipCategoryRequest request) {
        String name = request.getName().trim();
        if (tipCategoryRepository.existsByNameIgnoreCase(name)) {
            throw new FieldValidationException("name", "The name has already been taken.");
        }

        TipCategory category = TipCategory.builder()
                .name(name)
                .slug(Slugs.uniqueSlug(name, tipCategoryRepository::existsBySlug))
                .description(request.getDescription())
                .icon(request.getIcon())
                .build();
        category = tipCategoryRepository.save(category);

        logger.info("Created tip category {} ({})", category.getId(), category.getSlug());
        return TipCategoryResponse.fromEntity(category, 0L);
    }

    @Transactional
    public TipCategoryResponse updateCategory(Long id, TipCategoryRequest request) {
        TipCategory category = findCategory(id);

        if (request.getName() != null) {
            String name = request.getName().trim();
            if (tipCategoryRepository.existsByNameIgnoreCaseAndIdNot(name, id)) {
                throw new FieldValidationException("name", "The name has already been taken.");
            }
            if (!name.equals(category.getName())) {
                category.setName(name);
                category.setSlug(Slugs.uniqueSlug(name, slug -> tipCategoryRepository.existsBySlugAndIdNot(slug, id)));
            }
        }
        if (request.getDescription() != null) {
            category.setDescription(request.getDescription());
        }
        if (request.getIcon() != null) {
            category.setIcon(request.getIcon());
        }
        category = tipCategoryRepository.save(category);

        logger.info("Updated tip category {}", id);
        return TipCategoryResponse.fromEntity(category, tipCounts().getOrDefault(id, 0L));
    }

    /**
     * Delete a category with its tips and their likes and saves.
     */
    @Transactional
    public void deleteCategory(Long id) {
        TipCategory category = findCategory(id);

        List<Tip> tips = tipRepository.findByCategoryId(id);
        if (!tips.isEmpty()) {
            List<Long> tipIds = tips.stream().map(Tip::getId).collect(Collectors.toList());
            tipLikeRepository.deleteByTipIdIn(tipIds);
            savedTipRepository.deleteByTipIdIn(tipIds);
            tipRepository.deleteAll(tips);
        }
        tipCategoryRepository.delete(category);

        logger.info("Deleted tip category {} and {} tips", id, tips.size());
    }

    TipCategory findCategory(Long id) {
        return tipCategoryRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Tip category", id));
    }

    private Map<Long, Long> tipCounts() {
        Map<Long, Long> counts = new HashMap<>();
        for (Object[] row : tipRepository.countByCategory()) {
            counts.put((Long) row[0], ((Number) row[1]).longValue());
        }
        return counts;
    }
}
