package com.bountyboard.progression.controller;

import com.bountyboard.progression.dto.CommonResponse;
import com.bountyboard.progression.exception.ErrorKind;
import com.bountyboard.progression.exception.ProgressionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 统一异常处理：业务异常按 ErrorKind 映射状态码，其余异常返回 500 且不暴露内部信息。
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ProgressionException.class)
    public ResponseEntity<CommonResponse<Void>> handleProgression(ProgressionException e) {
        ErrorKind kind = e.getKind();
        if (kind.getHttpStatus() >= 500) {
            log.error("[{}] {}", kind, e.getMessage(), e);
        } else {
            log.debug("[{}] {}", kind, e.getMessage());
        }
        return ResponseEntity.status(kind.getHttpStatus()).body(CommonResponse.error(kind, e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<CommonResponse<Void>> handleBadRequest(HttpMessageNotReadableException e) {
        log.debug("请求体无法解析: {}", e.getMessage());
        return ResponseEntity.badRequest()
                .body(CommonResponse.error(ErrorKind.INVALID_EVENT, "请求格式不正确，请检查字段类型"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<CommonResponse<Void>> handleGeneral(Exception e) {
        log.error("[GlobalExceptionHandler] 未预期的错误", e);
        return ResponseEntity.internalServerError().body(CommonResponse.error(500, "系统发生错误，请稍后重试"));
    }
}
