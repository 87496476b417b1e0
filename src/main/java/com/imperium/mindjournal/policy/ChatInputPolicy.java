package com.imperium.mindjournal.policy;

/**
 * 对话输入限制。长度一律按 Unicode 码点计，emoji 等补充平面字符算 1 个字符。
 */
public final class ChatInputPolicy {

    /** 单条用户消息最大字符数 */
    public static final int MAX_MESSAGE_CHARS = 2000;

    /** 由首条消息派生标题时的最大长度 */
    public static final int DERIVED_TITLE_MAX_CHARS = 50;

    private ChatInputPolicy() {}

    public static int charCount(String text) {
        return text.codePointCount(0, text.length());
    }

    /**
     * 截取前 maxChars 个字符，不会切开代理对。
     */
    public static String truncate(String text, int maxChars) {
        if (charCount(text) <= maxChars) {
            return text;
        }
        return text.substring(0, text.offsetByCodePoints(0, maxChars));
    }
}
