package com.bountyboard.progression.util;

import com.bountyboard.progression.entity.ActionKind;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * 幂等键：SHA-256(hunterId | actionKind | sourceRef)，十六进制小写。
 * 同一个猎人对同一个来源做同一种动作只会被计一次。
 */
public final class IdempotencyKeys {

    private IdempotencyKeys() {
    }

    public static String compute(String normalizedHunterId, ActionKind kind, String sourceRef) {
        String material = normalizedHunterId + "|" + kind.getWireName() + "|" + sourceRef.trim();
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // 所有 JDK 都必须提供 SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
