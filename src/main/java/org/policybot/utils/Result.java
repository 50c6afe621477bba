package org.policybot.utils;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import org.policybot.exception.ErrorKind;
import org.springframework.http.HttpStatus;

/**
 * 接口统一返回体。失败时 kind 标明错误类别，调用方按类别处理，不解析 message。
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Result<T> {
    private Integer code;
    private String kind;
    private String message;
    private T data;
    private Boolean success;

    private Result(Integer code, String kind, String message, T data, Boolean success) {
        this.code = code;
        this.kind = kind;
        this.message = message;
        this.data = data;
        this.success = success;
    }

    public static <T> Result<T> success(T data) {
        return new Result<>(200, null, "操作成功", data, true);
    }

    public static <T> Result<T> success(String message, T data) {
        return new Result<>(200, null, message, data, true);
    }

    public static <T> Result<T> error(ErrorKind kind, HttpStatus status, String message) {
        return new Result<>(status.value(), kind != null ? kind.name() : null, message, null, false);
    }
}
