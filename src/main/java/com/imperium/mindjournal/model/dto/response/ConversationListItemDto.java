package com.imperium.mindjournal.model.dto.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 会话列表项，含消息数与最后一条消息摘要。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationListItemDto {

    private String id;
    private String title;
    private Boolean archived;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS")
    private LocalDateTime createdAt;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS")
    private LocalDateTime updatedAt;

    private Long messageCount;

    /** 最后一条消息的前 100 个字符 */
    private String lastMessagePreview;
}
