package org.policybot.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class CustomException extends RuntimeException {

    private final ErrorKind kind;
    private final HttpStatus status;

    public CustomException(String message, ErrorKind kind, HttpStatus status) {
        super(message);
        this.kind = kind;
        this.status = status;
    }

    public CustomException(String message, ErrorKind kind, HttpStatus status, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.status = status;
    }

    public static CustomException notFound(String message) {
        return new CustomException(message, ErrorKind.NOT_FOUND, HttpStatus.NOT_FOUND);
    }

    public static CustomException badRequest(String message) {
        return new CustomException(message, ErrorKind.VALIDATION, HttpStatus.BAD_REQUEST);
    }
}
