package com.agrilink.community.infrastructure.seed;

import com.agrilink.community.domain.model.Category;
import com.agrilink.community.repository.CategoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Inserts the default marketplace categories when the table is empty.
 *
 * @author AgriLink Team
 */
@Component
@ConditionalOnProperty(name = "agrilink.seed.categories.enabled", havingValue = "true", matchIfMissing = true)
public class CategorySeeder implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(CategorySeeder.class);

    static final List<Category> DEFAULTS = List.of(
            Category.builder().name("Vegetables").description("Fresh and organic vegetables.").build(),
            Category.builder().name("Fruits").description("Seasonal and tropical fruits.").build(),
            Category.builder().name("Grains").description("Rice, wheat, maize, and more.").build(),
            Category.builder().name("Legumes").description("Beans, lentils, peas, and more.").build(),
            Category.builder().name("Roots & Tubers").description("Potatoes, yams, cassava, etc.").build()
    );

    private final CategoryRepository categoryRepository;

    public CategorySeeder(CategoryRepository categoryRepository) {
        this.categoryRepository = categoryRepository;
    }

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        if (categoryRepository.count() > 0) {
            logger.debug("Categories already present, skipping seed");
            return;
        }
        for (Category template : DEFAULTS) {
            categoryRepository.save(Category.builder()
                    .name(template.getName())
                    .description(template.getDescription())
                    .build());
        }
        logger.info("Seeded {} default categories", DEFAULTS.size());
    }
}
