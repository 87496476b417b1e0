package com.imperium.mindjournal.controller;

import com.imperium.mindjournal.ai.orchestrator.JournalChatOrchestrator;
import com.imperium.mindjournal.auth.AuthenticatedUser;
import com.imperium.mindjournal.auth.JwtAuthFilter;
import com.imperium.mindjournal.model.dto.request.SendMessageRequest;
import com.imperium.mindjournal.model.dto.response.ChatHistoryResponse;
import com.imperium.mindjournal.model.dto.response.ChatReplyResponse;
import com.imperium.mindjournal.model.dto.response.ChatTurnDto;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 日记陪伴对话接口：发送消息、查看 / 清空内存中的对话历史。
 */
@RestController
@RequestMapping("/api/v0/chat/conversation")
@Tag(name = "Chat", description = "日记陪伴对话接口")
public class ChatController {

    private final JournalChatOrchestrator orchestrator;

    public ChatController(JournalChatOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping
    @Operation(summary = "发送消息", description = "结合最近三天的日记生成回复，用户消息与回复均会落库")
    public ResponseEntity<ChatReplyResponse> send(
            @Parameter(hidden = true) @RequestAttribute(JwtAuthFilter.ATTR_USER) AuthenticatedUser user,
            @Valid @RequestBody SendMessageRequest body) {
        String reply = orchestrator.chat(user.userId(), body.getMessage());
        return ResponseEntity.ok(new ChatReplyResponse(reply));
    }

    @GetMapping
    @Operation(summary = "对话历史", description = "返回当前进程内存中的对话历史，首条为 system prompt")
    public ResponseEntity<ChatHistoryResponse> history(
            @Parameter(hidden = true) @RequestAttribute(JwtAuthFilter.ATTR_USER) AuthenticatedUser user) {
        List<ChatTurnDto> turns = orchestrator.getHistory(user.userId()).stream()
                .map(m -> new ChatTurnDto(m.getMessageType().getValue(), m.getText()))
                .collect(Collectors.toList());
        return ResponseEntity.ok(new ChatHistoryResponse(turns));
    }

    @DeleteMapping
    @Operation(summary = "清空对话历史", description = "只清空内存历史并保留 system prompt，已落库的消息不受影响")
    public ResponseEntity<Map<String, String>> clear(
            @Parameter(hidden = true) @RequestAttribute(JwtAuthFilter.ATTR_USER) AuthenticatedUser user) {
        orchestrator.clearHistory(user.userId());
        return ResponseEntity.ok(Map.of("message", "Conversation history cleared"));
    }
}
