package com.agrilink.community.service;

import com.agrilink.community.api.dto.AdminStatsResponse;
import com.agrilink.community.domain.model.Consultation.ConsultationStatus;
import com.agrilink.community.domain.model.Order.OrderStatus;
import com.agrilink.community.domain.model.User.Role;
import com.agrilink.community.repository.CommunityMessageRepository;
import com.agrilink.community.repository.ConsultationRepository;
import com.agrilink.community.repository.OrderRepository;
import com.agrilink.community.repository.ProductRepository;
import com.agrilink.community.repository.SuccessStoryRepository;
import com.agrilink.community.repository.TipRepository;
import com.agrilink.community.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate counts for the admin dashboard.
 *
 * @author AgriLink Team
 */
@Service
public class AdminStatsService {

    private static final Logger logger = LoggerFactory.getLogger(AdminStatsService.class);

    private final UserRepository userRepository;
    private final ProductRepository productRepository;
    private final OrderRepository orderRepository;
    private final ConsultationRepository consultationRepository;
    private final TipRepository tipRepository;
    private final SuccessStoryRepository storyRepository;
    private final CommunityMessageRepository messageRepository;

    public AdminStatsService(
            UserRepository userRepository,
            ProductRepository productRepository,
            OrderRepository orderRepository,
            ConsultationRepository consultationRepository,
            TipRepository tipRepository,
            SuccessStoryRepository storyRepository,
            CommunityMessageRepository messageRepository
    ) {
        this.userRepository = userRepository;
        this.productRepository = productRepository;
        this.orderRepository = orderRepository;
        this.consultationRepository = consultationRepository;
        this.tipRepository = tipRepository;
        this.storyRepository = storyRepository;
        this.messageRepository = messageRepository;
    }

    @Transactional(readOnly = true)
    public AdminStatsResponse getStats() {
        Map<String, Long> usersByRole = new LinkedHashMap<>();
        for (Role role : Role.values()) {
            usersByRole.put(role.name().toLowerCase(), userRepository.countByRole(role));
        }

        Map<String, Long> ordersByStatus = new LinkedHashMap<>();
        for (OrderStatus status : OrderStatus.values()) {
            ordersByStatus.put(status.name().toLowerCase(), orderRepository.countByStatus(status));
        }

        Map<String, Long> consultationsByStatus = new LinkedHashMap<>();
        for (ConsultationStatus status : ConsultationStatus.values()) {
            consultationsByStatus.put(status.name().toLowerCase(), consultationRepository.countByStatus(status));
        }

        AdminStatsResponse stats = AdminStatsResponse.builder()
                .totalUsers(userRepository.count())
                .usersByRole(usersByRole)
                .totalProducts(productRepository.count())
                .totalOrders(orderRepository.count())
                .ordersByStatus(ordersByStatus)
                .totalConsultations(consultationRepository.count())
                .consultationsByStatus(consultationsByStatus)
                .totalTips(tipRepository.count())
                .totalSuccessStories(storyRepository.count())
                .totalCommunityMessages(messageRepository.count())
                .build();

        logger.debug("Computed admin stats: {} users, {} orders", stats.getTotalUsers(), stats.getTotalOrders());
        return stats;
    }
}
