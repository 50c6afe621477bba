package org.policybot.exception;

import org.policybot.utils.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(CustomException.class)
    public ResponseEntity<Result<Void>> handleCustomException(CustomException ex) {
        if (ex.getStatus().is5xxServerError()) {
            logger.error("请求失败 => kind: {}, message: {}", ex.getKind(), ex.getMessage());
        } else {
            logger.warn("请求被拒绝 => kind: {}, message: {}", ex.getKind(), ex.getMessage());
        }
        return ResponseEntity.status(ex.getStatus()).body(Result.error(ex.getKind(), ex.getStatus(), ex.getMessage()));
    }

    // 请求体无法解析
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Result<Void>> handleUnreadable(HttpMessageNotReadableException ex) {
        return ResponseEntity.badRequest().body(Result.error(ErrorKind.VALIDATION, HttpStatus.BAD_REQUEST, "请求体格式错误"));
    }

    // 兜底，防止报出白页
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Result<Void>> handleGeneralException(Exception ex) {
        logger.error("未处理的异常", ex);
        return ResponseEntity.internalServerError()
                .body(Result.error(null, HttpStatus.INTERNAL_SERVER_ERROR, "服务器内部错误: " + ex.getMessage()));
    }
}
