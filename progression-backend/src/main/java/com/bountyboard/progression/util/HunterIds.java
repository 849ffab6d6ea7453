package com.bountyboard.progression.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 猎人 handle 的规范化与 slug 生成
 */
public final class HunterIds {

    // 首尾不是 - 的 [a-z0-9._-] 串
    private static final Pattern SAFE_SLUG = Pattern.compile("[a-z0-9._]([a-z0-9._-]*[a-z0-9._])?");

    private HunterIds() {
    }

    /**
     * 展示用 handle：去首尾空白和前导 @
     */
    public static String displayHandle(String raw) {
        if (raw == null) {
            return "";
        }
        String value = raw.trim();
        while (value.startsWith("@")) {
            value = value.substring(1).trim();
        }
        return value;
    }

    /**
     * 账本主键：displayHandle 小写（GitHub handle 不区分大小写）
     */
    public static String normalize(String raw) {
        return displayHandle(raw).toLowerCase(Locale.ROOT);
    }

    /**
     * 徽章文档地址用的 slug。
     * 规范化后本身就是合法 slug 的 id 原样使用；否则把非 [a-z0-9._-] 的连续字符替换为 -，
     * 再追加 hunterId 的短哈希，保证不同猎人的 slug 不会相同。
     */
    public static String slugify(String raw) {
        String id = normalize(raw);
        if (SAFE_SLUG.matcher(id).matches()) {
            return id;
        }
        String value = id.replaceAll("[^a-z0-9._-]+", "-");
        value = value.replaceAll("^-+", "").replaceAll("-+$", "");
        return (value.isEmpty() ? "hunter" : value) + "-" + shortHash(id);
    }

    private static String shortHash(String id) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(id.getBytes(StandardCharsets.UTF_8)), 0, 4);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
