package com.bountyboard.progression.dto;

import com.bountyboard.progression.exception.ErrorKind;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * 通用API响应结构 DTO（徽章文档接口除外，那里直接返回 shields 格式）
 *
 * @param <T> 业务数据类型
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CommonResponse<T> implements Serializable {

    // HTTP 状态码：200, 400, 404, 409, 423, 500
    private Integer code;

    private String message;

    /**
     * 错误类别（DUPLICATE_EVENT 等），成功时为 null
     */
    private String errorKind;

    private T data;

    // 响应时间戳 (ms)
    private Long timestamp;

    public static <T> CommonResponse<T> success(T data) {
        return new CommonResponse<>(200, "请求成功", null, data, Instant.now().toEpochMilli());
    }

    public static CommonResponse<Void> success() {
        return success(null);
    }

    /**
     * 构造失败响应
     * @param code 状态码 (如 400, 500)
     * @param message 错误描述
     */
    public static <T> CommonResponse<T> error(Integer code, String message) {
        return new CommonResponse<>(code, message, null, null, Instant.now().toEpochMilli());
    }

    public static <T> CommonResponse<T> error(ErrorKind kind, String message) {
        return new CommonResponse<>(kind.getHttpStatus(), message, kind.name(), null, Instant.now().toEpochMilli());
    }
}
