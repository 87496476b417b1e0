package com.imperium.mindjournal.model.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * 登录请求。identifier 可以是用户名或邮箱。
 */
@Data
public class LoginRequest {

    @NotBlank(message = "identifier is required")
    private String identifier;

    @NotBlank(message = "password is required")
    private String password;
}
