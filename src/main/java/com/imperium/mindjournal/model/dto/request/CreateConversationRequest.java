package com.imperium.mindjournal.model.dto.request;

import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * 创建会话请求，对应 POST /conversations。
 */
@Data
public class CreateConversationRequest {

    /** 可选标题；为空时由首条消息派生 */
    @Size(max = 200, message = "title length must be at most 200")
    private String title;
}
