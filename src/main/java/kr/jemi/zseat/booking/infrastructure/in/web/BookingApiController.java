package kr.jemi.zseat.booking.infrastructure.in.web;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import kr.jemi.zseat.booking.application.port.in.BookSeatsUseCase;
import kr.jemi.zseat.booking.application.port.in.GetSeatAvailabilityUseCase;
import kr.jemi.zseat.booking.domain.ConfirmedBooking;
import kr.jemi.zseat.booking.infrastructure.in.web.dto.BookSeatsRequest;
import kr.jemi.zseat.booking.infrastructure.in.web.dto.BookingResponse;
import kr.jemi.zseat.booking.infrastructure.in.web.dto.SeatStatusResponse;
import kr.jemi.zseat.common.auth.Requester;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Tag(name = "Booking", description = "좌석 현황 조회 및 일괄 예약")
@RestController
public class BookingApiController {

    private final BookSeatsUseCase bookSeatsUseCase;
    private final GetSeatAvailabilityUseCase getSeatAvailabilityUseCase;

    public BookingApiController(BookSeatsUseCase bookSeatsUseCase,
                                GetSeatAvailabilityUseCase getSeatAvailabilityUseCase) {
        this.bookSeatsUseCase = bookSeatsUseCase;
        this.getSeatAvailabilityUseCase = getSeatAvailabilityUseCase;
    }

    @Operation(summary = "좌석 현황 조회", description = "이벤트의 전체 좌석을 행 순서로 반환합니다. 당일 이벤트는 조회할 수 없습니다.")
    @GetMapping("/api/events/{eventId}/seats")
    public ResponseEntity<List<SeatStatusResponse>> getSeats(@PathVariable long eventId) {
        List<SeatStatusResponse> response = getSeatAvailabilityUseCase.getSeats(eventId).stream()
                .map(SeatStatusResponse::from)
                .toList();
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "좌석 선택 조회", description = "요청한 좌석만 요청 순서대로 반환합니다. 없는 좌석이 하나라도 있으면 404를 반환합니다.")
    @GetMapping("/api/events/{eventId}/seats/by-ids")
    public ResponseEntity<List<SeatStatusResponse>> getSeatsByIds(
            @PathVariable long eventId,
            @Parameter(description = "쉼표로 구분한 좌석 번호 (예: A1,B2)") @RequestParam List<String> seatIds) {
        List<SeatStatusResponse> response = getSeatAvailabilityUseCase.getSeats(eventId, seatIds).stream()
                .map(SeatStatusResponse::from)
                .toList();
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "좌석 일괄 예약", description = "요청한 좌석을 모두 예약하거나 하나도 예약하지 않습니다. 마감된 이벤트는 관리자만 예약할 수 있습니다.")
    @PostMapping("/api/events/{eventId}/bookings")
    public ResponseEntity<BookingResponse> book(
            @Parameter(description = "요청자 역할 (ADMIN)") @RequestHeader(value = Requester.ROLE_HEADER, required = false) String role,
            @PathVariable long eventId,
            @Valid @RequestBody BookSeatsRequest request) {
        List<ConfirmedBooking> bookings = bookSeatsUseCase.book(eventId, request.toSeatRequests(), Requester.ofRole(role));
        return ResponseEntity.ok(BookingResponse.from(eventId, bookings));
    }
}
