package com.imperium.mindjournal.auth;

/**
 * 通过 Bearer Token 认证后的当前用户。
 */
public record AuthenticatedUser(String userId, String username) {
}
