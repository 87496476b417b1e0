package com.imperium.mindjournal.model.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 会话详情：基本信息 + 按时间升序的消息。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationDetailResponse {

    private ConversationResponse conversation;
    private List<MessageInConversationDto> messages;
}
