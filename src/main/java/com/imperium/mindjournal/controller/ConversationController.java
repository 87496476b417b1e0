package com.imperium.mindjournal.controller;

import com.imperium.mindjournal.ai.orchestrator.ConversationNotFoundException;
import com.imperium.mindjournal.ai.orchestrator.JournalChatOrchestrator;
import com.imperium.mindjournal.auth.AuthenticatedUser;
import com.imperium.mindjournal.auth.JwtAuthFilter;
import com.imperium.mindjournal.model.dto.request.CreateConversationRequest;
import com.imperium.mindjournal.model.dto.response.ArchiveResponse;
import com.imperium.mindjournal.model.dto.response.ConversationDetailResponse;
import com.imperium.mindjournal.model.dto.response.ConversationListItemDto;
import com.imperium.mindjournal.model.dto.response.ConversationListResponse;
import com.imperium.mindjournal.model.dto.response.ConversationResponse;
import com.imperium.mindjournal.model.dto.response.MessageInConversationDto;
import com.imperium.mindjournal.model.entity.Conversation;
import com.imperium.mindjournal.model.entity.Message;
import com.imperium.mindjournal.policy.ChatInputPolicy;
import com.imperium.mindjournal.service.ConversationService;
import com.imperium.mindjournal.service.MessageService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 会话管理接口：列表、创建、详情、消息、归档。只能访问自己的会话。
 */
@RestController
@RequestMapping("/api/v0/conversations")
@Tag(name = "Conversations", description = "会话管理接口")
public class ConversationController {

    private static final int PREVIEW_MAX_LEN = 100;

    private final ConversationService conversationService;
    private final MessageService messageService;
    private final JournalChatOrchestrator orchestrator;

    public ConversationController(ConversationService conversationService,
            MessageService messageService,
            JournalChatOrchestrator orchestrator) {
        this.conversationService = conversationService;
        this.messageService = messageService;
        this.orchestrator = orchestrator;
    }

    /**
     * 列出当前用户的会话，按更新时间倒序。archived 不传时返回全部。
     */
    @GetMapping
    @Operation(summary = "会话列表", description = "按更新时间倒序，可按归档状态过滤")
    public ResponseEntity<ConversationListResponse> list(
            @Parameter(hidden = true) @RequestAttribute(JwtAuthFilter.ATTR_USER) AuthenticatedUser user,
            @Parameter(description = "归档状态过滤：true / false，不传返回全部")
            @RequestParam(required = false) Boolean archived) {

        List<Conversation> list = conversationService.lambdaQuery()
                .eq(Conversation::getUserId, user.userId())
                .eq(archived != null, Conversation::getArchived, archived)
                .orderByDesc(Conversation::getUpdatedAt)
                .orderByDesc(Conversation::getId)
                .list();

        List<ConversationListItemDto> items = list.stream()
                .map(c -> ConversationListItemDto.builder()
                        .id(c.getId())
                        .title(c.getTitle())
                        .archived(c.getArchived())
                        .createdAt(c.getCreatedAt())
                        .updatedAt(c.getUpdatedAt())
                        .messageCount(messageService.lambdaQuery()
                                .eq(Message::getConversationId, c.getId())
                                .count())
                        .lastMessagePreview(preview(c.getId()))
                        .build())
                .collect(Collectors.toList());

        return ResponseEntity.ok(ConversationListResponse.builder().items(items).build());
    }

    @PostMapping
    @Operation(summary = "创建会话", description = "显式创建一个新会话；之后的对话消息会进入最近更新的未归档会话")
    public ResponseEntity<ConversationResponse> create(
            @Parameter(hidden = true) @RequestAttribute(JwtAuthFilter.ATTR_USER) AuthenticatedUser user,
            @Valid @RequestBody(required = false) CreateConversationRequest body) {
        String title = body != null ? body.getTitle() : null;
        Conversation created = orchestrator.createConversation(user.userId(), title);
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(created));
    }

    @GetMapping("/{conversationId}")
    @Operation(summary = "会话详情", description = "会话基本信息及全部消息，按时间升序")
    public ResponseEntity<ConversationDetailResponse> getDetail(
            @Parameter(hidden = true) @RequestAttribute(JwtAuthFilter.ATTR_USER) AuthenticatedUser user,
            @Parameter(description = "会话 ID", required = true) @PathVariable String conversationId) {
        Conversation conversation = requireOwned(user, conversationId);
        return ResponseEntity.ok(ConversationDetailResponse.builder()
                .conversation(toResponse(conversation))
                .messages(messagesOf(conversationId))
                .build());
    }

    @GetMapping("/{conversationId}/messages")
    @Operation(summary = "会话消息", description = "会话内全部消息，按时间升序")
    public ResponseEntity<List<MessageInConversationDto>> messages(
            @Parameter(hidden = true) @RequestAttribute(JwtAuthFilter.ATTR_USER) AuthenticatedUser user,
            @Parameter(description = "会话 ID", required = true) @PathVariable String conversationId) {
        requireOwned(user, conversationId);
        return ResponseEntity.ok(messagesOf(conversationId));
    }

    @PostMapping("/{conversationId}/archive")
    @Operation(summary = "归档 / 取消归档", description = "切换会话的归档状态")
    public ResponseEntity<ArchiveResponse> archive(
            @Parameter(hidden = true) @RequestAttribute(JwtAuthFilter.ATTR_USER) AuthenticatedUser user,
            @Parameter(description = "会话 ID", required = true) @PathVariable String conversationId) {
        boolean archived = orchestrator.archiveConversation(user.userId(), conversationId);
        String status = archived ? "conversation archived" : "conversation unarchived";
        return ResponseEntity.ok(new ArchiveResponse(status, archived));
    }

    // ---------- 私有 ----------

    /** 不存在和不属于当前用户一律按 404 处理 */
    private Conversation requireOwned(AuthenticatedUser user, String conversationId) {
        Conversation conversation = conversationService.getById(conversationId);
        if (conversation == null || !Objects.equals(conversation.getUserId(), user.userId())) {
            throw new ConversationNotFoundException(conversationId);
        }
        return conversation;
    }

    private List<MessageInConversationDto> messagesOf(String conversationId) {
        return messageService.lambdaQuery()
                .eq(Message::getConversationId, conversationId)
                .orderByAsc(Message::getCreatedAt)
                .orderByAsc(Message::getId)
                .list()
                .stream()
                .map(m -> MessageInConversationDto.builder()
                        .id(m.getId())
                        .role(m.getRole())
                        .content(m.getContent())
                        .metadata(m.getMetadata())
                        .createdAt(m.getCreatedAt())
                        .build())
                .collect(Collectors.toList());
    }

    private String preview(String conversationId) {
        Message last = messageService.lambdaQuery()
                .eq(Message::getConversationId, conversationId)
                .orderByDesc(Message::getCreatedAt)
                .last("LIMIT 1")
                .one();
        if (last == null || last.getContent() == null) {
            return null;
        }
        String content = last.getContent();
        String cut = ChatInputPolicy.truncate(content, PREVIEW_MAX_LEN);
        return cut.length() < content.length() ? cut + "..." : content;
    }

    private static ConversationResponse toResponse(Conversation c) {
        return ConversationResponse.builder()
                .id(c.getId())
                .title(c.getTitle())
                .archived(c.getArchived())
                .createdAt(c.getCreatedAt())
                .updatedAt(c.getUpdatedAt())
                .build();
    }
}
