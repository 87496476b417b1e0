package com.imperium.mindjournal.model.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * 发送对话消息请求，对应 POST /chat/conversation。
 */
@Data
public class SendMessageRequest {

    /** 必填，1~2000 字符（按码点计，上限由编排层校验） */
    @NotBlank(message = "message is required")
    private String message;
}
