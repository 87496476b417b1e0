package com.imperium.mindjournal.auth;

import com.imperium.mindjournal.model.entity.User;
import com.imperium.mindjournal.service.UserService;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * 登录标识解析：含 @ 按邮箱查，否则按用户名查，均忽略大小写，只发一次查询。
 */
@Component
public class IdentityResolver {

    private final UserService userService;

    public IdentityResolver(UserService userService) {
        this.userService = userService;
    }

    public Optional<User> resolve(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return Optional.empty();
        }
        String normalized = identifier.trim().toLowerCase(Locale.ROOT);
        String column = isEmail(normalized) ? "email" : "username";
        return Optional.ofNullable(userService.lambdaQuery()
                .apply("LOWER(" + column + ") = {0}", normalized)
                .last("LIMIT 1")
                .one());
    }

    static boolean isEmail(String identifier) {
        return identifier.indexOf('@') >= 0;
    }
}
