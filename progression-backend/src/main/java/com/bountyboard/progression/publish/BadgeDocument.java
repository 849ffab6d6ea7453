package com.bountyboard.progression.publish;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

/**
 * shields.io endpoint 格式的徽章文档。字段顺序固定，保证同一状态序列化结果逐字节相同
 */
@Value
@JsonPropertyOrder({"schemaVersion", "label", "message", "color", "namedLogo", "logoColor"})
public class BadgeDocument {

    int schemaVersion;
    String label;
    String message;
    String color;
    String namedLogo;
    String logoColor;

    public static BadgeDocument of(String label, String message, String color, String namedLogo, String logoColor) {
        return new BadgeDocument(1, label, message, color, namedLogo, logoColor);
    }
}
