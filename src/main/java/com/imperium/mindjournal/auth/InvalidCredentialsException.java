package com.imperium.mindjournal.auth;

/**
 * 登录标识或密码错误。不区分「用户不存在」与「密码错误」。
 */
public class InvalidCredentialsException extends RuntimeException {

    public InvalidCredentialsException() {
        super("Invalid identifier or password");
    }
}
