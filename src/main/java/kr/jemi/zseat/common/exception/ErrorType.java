package kr.jemi.zseat.common.exception;

import org.springframework.http.HttpStatus;

public enum ErrorType {

    INVALID_INPUT(HttpStatus.BAD_REQUEST),
    FORBIDDEN(HttpStatus.FORBIDDEN),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    CONFLICT(HttpStatus.CONFLICT),
    INTERNAL(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorType(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }

    /**
     * 호출자가 요청을 고쳐서 해결할 수 있는 오류인지 여부.
     * INTERNAL만 시스템 측 오류로 본다.
     */
    public boolean isClientFault() {
        return this != INTERNAL;
    }
}
