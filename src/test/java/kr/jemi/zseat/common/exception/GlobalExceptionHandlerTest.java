package kr.jemi.zseat.common.exception;

import kr.jemi.zseat.common.dto.ErrorResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("BusinessException은 에러 유형의 HTTP 상태와 상세 메시지로 변환된다")
    void businessException() {
        ResponseEntity<ErrorResponse> response = handler.handleBusinessException(
                new BusinessException(ErrorCode.SEAT_ALREADY_BOOKED, "A2"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().code()).isEqualTo("SEAT_ALREADY_BOOKED");
        assertThat(response.getBody().message()).endsWith("A2");
    }

    @Test
    @DisplayName("처리되지 않은 예외는 내부 정보 없이 500으로 변환된다")
    void unexpectedException() {
        ResponseEntity<ErrorResponse> response = handler.handleException(
                new IllegalStateException("connection refused: db-1:3306"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().message()).doesNotContain("db-1");
    }

    @Test
    @DisplayName("INTERNAL 유형만 시스템 오류이고 나머지는 모두 클라이언트 오류다")
    void clientFaultClassification() {
        assertThat(Arrays.stream(ErrorCode.values())
                .filter(code -> !code.getType().isClientFault()))
                .containsExactlyInAnyOrder(ErrorCode.BOOKING_CONTENTION, ErrorCode.INTERNAL_ERROR);
        assertThat(ErrorCode.DUPLICATE_SEAT_IN_BATCH.getStatus()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(ErrorCode.SAME_DAY_BOOKING.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(ErrorCode.SEAT_NOT_FOUND.getStatus()).isEqualTo(HttpStatus.NOT_FOUND);
    }
}
