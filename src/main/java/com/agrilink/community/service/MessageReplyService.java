package com.agrilink.community.service;

import com.agrilink.community.api.dto.PageResponse;
import com.agrilink.community.api.dto.ReplyRequest;
import com.agrilink.community.api.dto.ReplyResponse;
import com.agrilink.community.api.dto.ToggleResponse;
import com.agrilink.community.api.dto.UserSummary;
import com.agrilink.community.domain.model.MessageReply;
import com.agrilink.community.domain.model.ReplyLike;
import com.agrilink.community.exception.FieldValidationException;
import com.agrilink.community.exception.ResourceNotFoundException;
import com.agrilink.community.infrastructure.messaging.KafkaProducerService;
import com.agrilink.community.infrastructure.messaging.events.CommunityEvent;
import com.agrilink.community.repository.CommunityMessageRepository;
import com.agrilink.community.repository.MessageReplyRepository;
import com.agrilink.community.repository.ReplyLikeRepository;
import com.agrilink.community.security.AuthenticatedUser;
import com.agrilink.community.security.SecurityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Service for threaded replies to community messages.
 *
 * <p>Replies nest without a depth limit. After every add or delete the message's
 * replies_count and last_reply_at are recomputed from the stored replies.
 *
 * @author AgriLink Team
 */
@Service
public class MessageReplyService {

    private static final Logger logger = LoggerFactory.getLogger(MessageReplyService.class);

    private final MessageReplyRepository replyRepository;
    private final ReplyLikeRepository replyLikeRepository;
    private final CommunityMessageRepository messageRepository;
    private final UserDirectory userDirectory;
    private final LikeToggler likeToggler;
    private final KafkaProducerService kafkaProducerService;
    private final int pageSize;

    public MessageReplyService(
            MessageReplyRepository replyRepository,
            ReplyLikeRepository replyLikeRepository,
            CommunityMessageRepository messageRepository,
            UserDirectory userDirectory,
            LikeToggler likeToggler,
            KafkaProducerService kafkaProducerService,
            @Value("${agrilink.pagination.replies:20}") int pageSize
    ) {
        this.replyRepository = replyRepository;
        this.replyLikeRepository = replyLikeRepository;
        this.messageRepository = messageRepository;
        this.userDirectory = userDirectory;
        this.likeToggler = likeToggler;
        this.kafkaProducerService = kafkaProducerService;
        this.pageSize = pageSize;
    }

    /**
     * Page through top-level replies, oldest first, each with its nested replies.
     */
    @Transactional(readOnly = true)
    public PageResponse<ReplyResponse> listReplies(Long messageId, Integer page, Long viewerId) {
        requireMessage(messageId);
        Page<MessageReply> topLevel = replyRepository.findByMessageIdAndParentReplyIdIsNull(messageId,
                Paging.page(page, pageSize, Sort.by(Sort.Order.asc("createdAt"), Sort.Order.asc("id"))));
        List<MessageReply> all = replyRepository.findByMessageIdOrderByCreatedAtAscIdAsc(messageId);
        return PageResponse.of(topLevel, buildTree(all, topLevel.getContent(), viewerId));
    }

    /**
     * Full reply tree of a message, top-level replies oldest first.
     */
    @Transactional(readOnly = true)
    public List<ReplyResponse> replyTree(Long messageId, Long viewerId) {
        List<MessageReply> all = replyRepository.findByMessageIdOrderByCreatedAtAscIdAsc(messageId);
        return buildTree(all, all.stream().filter(MessageReply::isTopLevel).collect(Collectors.toList()), viewerId);
    }

    /**
     * Reply to a message or to one of its replies.
     *
     * @throws ResourceNotFoundException if the message does not exist
     * @throws FieldValidationException if the parent reply is missing or belongs to another message
     */
    @Transactional
    public ReplyResponse addReply(AuthenticatedUser actor, Long messageId, ReplyRequest request) {
        requireMessage(messageId);

        int depth = 0;
        if (request.getParentReplyId() != null) {
            MessageReply parent = replyRepository.findById(request.getParentReplyId())
                    .orElseThrow(() -> new FieldValidationException("parent_reply_id",
                            "The selected parent reply id is invalid."));
            if (!parent.getMessageId().equals(messageId)) {
                throw new FieldValidationException("parent_reply_id",
                        "The parent reply does not belong to this message.");
            }
            depth = depthOf(parent, replyRepository.findByMessageIdOrderByCreatedAtAscIdAsc(messageId)) + 1;
        }

        MessageReply reply = MessageReply.builder()
                .messageId(messageId)
                .userId(actor.getId())
                .content(request.getContent())
                .parentReplyId(request.getParentReplyId())
                .build();
        reply = replyRepository.save(reply);

        recomputeStats(messageId);
        kafkaProducerService.publishCommunityEvent(new CommunityEvent(
                messageId, reply.getId(), actor.getId(), CommunityEvent.EventType.REPLY_ADDED));

        logger.info("User {} replied to message {} (reply {}, depth {})", actor.getId(), messageId, reply.getId(), depth);
        return ReplyResponse.fromEntity(reply, userDirectory.summary(actor.getId()), false, depth);
    }

    @Transactional
    public ReplyResponse updateReply(AuthenticatedUser actor, Long messageId, Long replyId, ReplyRequest request) {
        MessageReply reply = findReply(messageId, replyId);
        SecurityUtils.verifyOwnerOrAdmin(actor, reply.getUserId(), "update this reply");

        reply.setContent(request.getContent());
        reply = replyRepository.save(reply);

        List<MessageReply> all = replyRepository.findByMessageIdOrderByCreatedAtAscIdAsc(messageId);
        boolean liked = !replyLikeRepository.findLikedReplyIds(actor.getId(), List.of(replyId)).isEmpty();

        logger.info("User {} updated reply {} of message {}", actor.getId(), replyId, messageId);
        return ReplyResponse.fromEntity(reply, userDirectory.summary(reply.getUserId()), liked, depthOf(reply, all));
    }

    /**
     * Delete a reply with every reply below it.
     */
    @Transactional
    public void deleteReply(AuthenticatedUser actor, Long messageId, Long replyId) {
        MessageReply reply = findReply(messageId, replyId);
        SecurityUtils.verifyOwnerOrAdmin(actor, reply.getUserId(), "delete this reply");

        Set<Long> subtree = subtreeIds(replyId, replyRepository.findByMessageIdOrderByCreatedAtAscIdAsc(messageId));
        replyLikeRepository.deleteByReplyIdIn(subtree);
        replyRepository.deleteByIdIn(subtree);

        recomputeStats(messageId);
        logger.info("User {} deleted reply {} of message {} ({} replies removed)",
                actor.getId(), replyId, messageId, subtree.size());
    }

    @Transactional
    public ToggleResponse toggleLike(AuthenticatedUser actor, Long messageId, Long replyId) {
        findReply(messageId, replyId);
        Long userId = actor.getId();
        return likeToggler.toggleLike("reply", replyId, userId,
                () -> replyLikeRepository.deleteByReplyIdAndUserId(replyId, userId),
                () -> replyLikeRepository.save(ReplyLike.builder().replyId(replyId).userId(userId).build()),
                delta -> replyRepository.adjustLikes(replyId, delta),
                () -> replyRepository.findLikesCount(replyId));
    }

    /**
     * Remove every reply of a message and their likes. Used when the message is deleted.
     */
    @Transactional
    public int deleteAllForMessage(Long messageId) {
        List<Long> replyIds = replyRepository.findIdsByMessageId(messageId);
        if (replyIds.isEmpty()) {
            return 0;
        }
        replyLikeRepository.deleteByReplyIdIn(replyIds);
        return replyRepository.deleteByMessageId(messageId);
    }

    private void recomputeStats(Long messageId) {
        int count = (int) replyRepository.countByMessageId(messageId);
        Instant lastReplyAt = replyRepository.findLatestReplyTime(messageId);
        messageRepository.updateReplyStats(messageId, count, lastReplyAt, Instant.now());
        logger.debug("Message {} now has {} replies, last at {}", messageId, count, lastReplyAt);
    }

    private void requireMessage(Long messageId) {
        if (!messageRepository.existsById(messageId)) {
            throw new ResourceNotFoundException("Community message", messageId);
        }
    }

    /**
     * @throws ResourceNotFoundException if the reply is missing or not under the message
     */
    private MessageReply findReply(Long messageId, Long replyId) {
        requireMessage(messageId);
        return replyRepository.findById(replyId)
                .filter(reply -> reply.getMessageId().equals(messageId))
                .orElseThrow(() -> new ResourceNotFoundException("Message reply", replyId));
    }

    /**
     * Ids of the reply and all of its descendants.
     */
    static Set<Long> subtreeIds(Long rootId, List<MessageReply> all) {
        Map<Long, List<Long>> children = new HashMap<>();
        for (MessageReply reply : all) {
            if (reply.getParentReplyId() != null) {
                children.computeIfAbsent(reply.getParentReplyId(), key -> new ArrayList<>()).add(reply.getId());
            }
        }
        Set<Long> result = new LinkedHashSet<>();
        Deque<Long> pending = new ArrayDeque<>();
        pending.push(rootId);
        while (!pending.isEmpty()) {
            Long id = pending.pop();
            if (result.add(id)) {
                children.getOrDefault(id, Collections.emptyList()).forEach(pending::push);
            }
        }
        return result;
    }

    /**
     * Number of parent hops from the reply to a top-level reply.
     */
    static int depthOf(MessageReply reply, List<MessageReply> all) {
        Map<Long, Long> parents = new HashMap<>();
        all.forEach(candidate -> parents.put(candidate.getId(), candidate.getParentReplyId()));
        int depth = 0;
        Set<Long> seen = new HashSet<>();
        Long parentId = reply.getParentReplyId();
        while (parentId != null && seen.add(parentId)) {
            depth++;
            parentId = parents.get(parentId);
        }
        return depth;
    }

    private List<ReplyResponse> buildTree(List<MessageReply> all, List<MessageReply> roots, Long viewerId) {
        Map<Long, List<MessageReply>> children = new HashMap<>();
        for (MessageReply reply : all) {
            if (reply.getParentReplyId() != null) {
                children.computeIfAbsent(reply.getParentReplyId(), key -> new ArrayList<>()).add(reply);
            }
        }
        Map<Long, UserSummary> authors = userDirectory.summaries(
                all.stream().map(MessageReply::getUserId).collect(Collectors.toSet()));
        Set<Long> liked = viewerId == null || all.isEmpty() ? Collections.emptySet()
                : new HashSet<>(replyLikeRepository.findLikedReplyIds(viewerId,
                        all.stream().map(MessageReply::getId).collect(Collectors.toList())));

        List<ReplyResponse> result = new ArrayList<>();
        for (MessageReply root : roots) {
            result.add(toTree(root, 0, children, authors, liked, new HashSet<>()));
        }
        return result;
    }

    private ReplyResponse toTree(MessageReply reply, int depth, Map<Long, List<MessageReply>> children,
                                 Map<Long, UserSummary> authors, Set<Long> liked, Set<Long> visited) {
        ReplyResponse node = ReplyResponse.fromEntity(reply, authors.get(reply.getUserId()),
                liked.contains(reply.getId()), depth);
        if (visited.add(reply.getId())) {
            for (MessageReply child : children.getOrDefault(reply.getId(), Collections.emptyList())) {
                node.getReplies().add(toTree(child, depth + 1, children, authors, liked, visited));
            }
        }
        return node;
    }
}
