package kr.jemi.zseat.common.dto;

import kr.jemi.zseat.common.exception.ErrorCode;

public record ErrorResponse(int status, String code, String message) {

    public static ErrorResponse from(ErrorCode errorCode) {
        return of(errorCode, errorCode.getMessage());
    }

    public static ErrorResponse of(ErrorCode errorCode, String message) {
        return new ErrorResponse(
                errorCode.getStatus().value(),
                errorCode.name(),
                message
        );
    }
}
