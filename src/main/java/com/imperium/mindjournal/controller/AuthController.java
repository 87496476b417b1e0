package com.imperium.mindjournal.controller;

import com.imperium.mindjournal.auth.IdentityResolver;
import com.imperium.mindjournal.auth.InvalidCredentialsException;
import com.imperium.mindjournal.auth.JwtService;
import com.imperium.mindjournal.model.dto.request.LoginRequest;
import com.imperium.mindjournal.model.dto.response.TokenResponse;
import com.imperium.mindjournal.model.entity.User;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 登录换取访问令牌。用户注册不在本服务内。
 */
@RestController
@RequestMapping("/api/v0/auth")
@Tag(name = "Auth", description = "登录与令牌")
public class AuthController {

    private static final Logger log = LoggerFactory.getLogger(AuthController.class);

    private final IdentityResolver identityResolver;
    private final PasswordEncoder passwordEncoder;
    private final JwtService jwtService;

    public AuthController(IdentityResolver identityResolver, PasswordEncoder passwordEncoder, JwtService jwtService) {
        this.identityResolver = identityResolver;
        this.passwordEncoder = passwordEncoder;
        this.jwtService = jwtService;
    }

    @PostMapping("/token")
    @Operation(summary = "登录", description = "identifier 含 @ 时按邮箱匹配，否则按用户名匹配，均忽略大小写")
    public ResponseEntity<TokenResponse> token(@Valid @RequestBody LoginRequest body) {
        User user = identityResolver.resolve(body.getIdentifier())
                .filter(User::isActive)
                .filter(u -> u.getPasswordHash() != null
                        && passwordEncoder.matches(body.getPassword(), u.getPasswordHash()))
                .orElseThrow(() -> {
                    log.info("Login rejected for identifier {}", body.getIdentifier());
                    return new InvalidCredentialsException();
                });

        log.info("User {} logged in", user.getId());
        return ResponseEntity.ok(TokenResponse.builder()
                .accessToken(jwtService.issueToken(user))
                .tokenType("Bearer")
                .expiresIn(jwtService.expiresInSeconds())
                .user(new TokenResponse.UserDto(user.getId(), user.getUsername(), user.getEmail()))
                .build());
    }
}
