package com.agrilink.community.service;

import com.agrilink.community.api.dto.TipRequest;
import com.agrilink.community.api.dto.TipResponse;
import com.agrilink.community.api.dto.ToggleResponse;
import com.agrilink.community.domain.model.SavedTip;
import com.agrilink.community.domain.model.Tip;
import com.agrilink.community.domain.model.TipLike;
import com.agrilink.community.domain.model.User.Role;
import com.agrilink.community.exception.FieldValidationException;
import com.agrilink.community.exception.ResourceNotFoundException;
import com.agrilink.community.infrastructure.metrics.CloudWatchMetricsService;
import com.agrilink.community.repository.SavedTipRepository;
import com.agrilink.community.repository.TipCategoryRepository;
import com.agrilink.community.repository.TipLikeRepository;
import com.agrilink.community.repository.TipRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.access.AccessDeniedException;

import java.util.List;
import java.util.Optional;

import static com.agrilink.community.testutil.TestDataBuilder.actor;
import static com.agrilink.community.testutil.TestDataBuilder.tip;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TipService.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("TipService Unit Tests")
class TipServiceTest {

    @Mock
    private TipRepository tipRepository;

    @Mock
    private TipCategoryRepository tipCategoryRepository;

    @Mock
    private TipLikeRepository tipLikeRepository;

    @Mock
    private SavedTipRepository savedTipRepository;

    @Mock
    private UserDirectory userDirectory;

    @Mock
    private CloudWatchMetricsService metricsService;

    private TipService tipService;

    @BeforeEach
    void setUp() {
        tipService = new TipService(tipRepository, tipCategoryRepository, tipLikeRepository, savedTipRepository,
                userDirectory, new LikeToggler(metricsService), 10);
    }

    private static TipRequest request(String title) {
        TipRequest request = new TipRequest();
        request.setTitle(title);
        request.setContent("Mulch keeps moisture in the soil during dry spells.");
        request.setCategoryId(1L);
        request.setTags(List.of("soil", " mulch ", "soil", ""));
        return request;
    }

    // ========================================
    // createTip() Tests
    // ========================================

    @Test
    @DisplayName("createTip - Success: Expert tip gets a unique slug and cleaned tags")
    void createTip_Success() {
        // Given
        when(tipCategoryRepository.existsById(1L)).thenReturn(true);
        when(tipRepository.existsBySlug("mulching-basics")).thenReturn(true);
        when(tipRepository.existsBySlug("mulching-basics-2")).thenReturn(false);
        when(tipRepository.save(any(Tip.class))).thenAnswer(invocation -> {
            Tip saved = invocation.getArgument(0);
            saved.setId(301L);
            return saved;
        });

        // When
        TipResponse response = tipService.createTip(actor(3L, Role.EXPERT), request("Mulching Basics"));

        // Then
        assertThat(response.getId()).isEqualTo(301L);
        assertThat(response.getSlug()).isEqualTo("mulching-basics-2");
        assertThat(response.getTags()).containsExactly("soil", "mulch");
        assertThat(response.getIsLiked()).isFalse();
        assertThat(response.getIsSaved()).isFalse();
    }

    @Test
    @DisplayName("createTip - Failure: Farmers cannot write tips")
    void createTip_NotExpert() {
        // When / Then
        assertThatThrownBy(() -> tipService.createTip(actor(1L, Role.FARMER), request("Mulching Basics")))
                .isInstanceOf(AccessDeniedException.class);
        verify(tipRepository, never()).save(any());
    }

    @Test
    @DisplayName("createTip - Failure: Unknown category is a field error")
    void createTip_UnknownCategory() {
        // Given
        when(tipCategoryRepository.existsById(1L)).thenReturn(false);

        // When / Then
        assertThatThrownBy(() -> tipService.createTip(actor(3L, Role.EXPERT), request("Mulching Basics")))
                .isInstanceOf(FieldValidationException.class);
    }

    // ========================================
    // updateTip() / deleteTip() Tests
    // ========================================

    @Test
    @DisplayName("updateTip - Failure: Another expert cannot edit the tip")
    void updateTip_NotOwner() {
        // Given
        when(tipRepository.findById(300L)).thenReturn(Optional.of(tip().author(3L).build()));

        // When / Then
        assertThatThrownBy(() -> tipService.updateTip(actor(4L, Role.EXPERT), 300L, new TipRequest()))
                .isInstanceOf(AccessDeniedException.class);
    }

    @Test
    @DisplayName("deleteTip - Success: Admin removes the tip with its likes and saves")
    void deleteTip_Admin() {
        // Given
        Tip tip = tip().author(3L).build();
        when(tipRepository.findById(300L)).thenReturn(Optional.of(tip));

        // When
        tipService.deleteTip(actor(9L, Role.ADMIN), 300L);

        // Then
        verify(tipLikeRepository).deleteByTipIdIn(List.of(300L));
        verify(savedTipRepository).deleteByTipIdIn(List.of(300L));
        verify(tipRepository).delete(tip);
    }

    @Test
    @DisplayName("viewTip - Failure: Missing tip is not found")
    void viewTip_NotFound() {
        // Given
        when(tipRepository.incrementViews(999L)).thenReturn(0);

        // When / Then
        assertThatThrownBy(() -> tipService.viewTip(999L, null))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    // ========================================
    // toggleLike() / toggleSave() Tests
    // ========================================

    @Test
    @DisplayName("toggleLike - First toggle likes and increments the counter")
    void toggleLike_Like() {
        // Given
        when(tipRepository.findById(300L)).thenReturn(Optional.of(tip().build()));
        when(tipLikeRepository.deleteByTipIdAndUserId(300L, 1L)).thenReturn(0);
        when(tipRepository.findLikesCount(300L)).thenReturn(1);

        // When
        ToggleResponse response = tipService.toggleLike(actor(1L, Role.FARMER), 300L);

        // Then
        assertThat(response.getIsLiked()).isTrue();
        assertThat(response.getLikesCount()).isEqualTo(1);
        ArgumentCaptor<TipLike> like = ArgumentCaptor.forClass(TipLike.class);
        verify(tipLikeRepository).save(like.capture());
        assertThat(like.getValue().getUserId()).isEqualTo(1L);
        verify(tipRepository).adjustLikes(300L, 1);
    }

    @Test
    @DisplayName("toggleLike - Second toggle unlikes and decrements the counter")
    void toggleLike_Unlike() {
        // Given
        when(tipRepository.findById(300L)).thenReturn(Optional.of(tip().likesCount(1).build()));
        when(tipLikeRepository.deleteByTipIdAndUserId(300L, 1L)).thenReturn(1);
        when(tipRepository.findLikesCount(300L)).thenReturn(0);

        // When
        ToggleResponse response = tipService.toggleLike(actor(1L, Role.FARMER), 300L);

        // Then
        assertThat(response.getIsLiked()).isFalse();
        assertThat(response.getLikesCount()).isZero();
        verify(tipLikeRepository, never()).save(any());
        verify(tipRepository).adjustLikes(300L, -1);
    }

    @Test
    @DisplayName("toggleSave - Saves when not yet saved")
    void toggleSave_Save() {
        // Given
        when(tipRepository.findById(300L)).thenReturn(Optional.of(tip().build()));
        when(savedTipRepository.deleteByTipIdAndUserId(300L, 1L)).thenReturn(0);

        // When
        ToggleResponse response = tipService.toggleSave(actor(1L, Role.FARMER), 300L);

        // Then
        assertThat(response.getIsSaved()).isTrue();
        assertThat(response.getIsLiked()).isNull();
        verify(savedTipRepository).save(any(SavedTip.class));
    }

    @Test
    @DisplayName("listMyTips - Failure: Only experts have their own tips")
    void listMyTips_NotExpert() {
        assertThatThrownBy(() -> tipService.listMyTips(actor(1L, Role.FARMER), 1))
                .isInstanceOf(AccessDeniedException.class);
    }
}
