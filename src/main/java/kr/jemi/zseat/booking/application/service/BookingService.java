package kr.jemi.zseat.booking.application.service;

import kr.jemi.zseat.booking.application.port.in.BookSeatsUseCase;
import kr.jemi.zseat.booking.domain.BookingBatch;
import kr.jemi.zseat.booking.domain.ConfirmedBooking;
import kr.jemi.zseat.booking.domain.SeatRequest;
import kr.jemi.zseat.common.auth.Requester;
import kr.jemi.zseat.common.exception.BusinessException;
import kr.jemi.zseat.common.exception.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class BookingService implements BookSeatsUseCase {

    private static final Logger log = LoggerFactory.getLogger(BookingService.class);

    private final BookingWriter bookingWriter;
    private final int maxAttempts;

    public BookingService(BookingWriter bookingWriter,
                          @Value("${zseat.booking.max-attempts}") int maxAttempts) {
        this.bookingWriter = bookingWriter;
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    @Override
    public List<ConfirmedBooking> book(long eventId, List<SeatRequest> requests, Requester requester) {
        BookingBatch batch = new BookingBatch(eventId, requests);

        // 1~2. 트랜잭션 전에 요청 자체를 검증
        validate(batch);

        // 3~7 + 반영은 한 트랜잭션. 잠금 대기 초과/데드락만 재시도한다
        for (int attempt = 1; ; attempt++) {
            try {
                return bookingWriter.write(batch, requester);
            } catch (BusinessException e) {
                log.warn("예약 거절: eventId={}, seats={}, reason={}", eventId, batch.seatIds(), e.getMessage());
                throw e;
            } catch (ConcurrencyFailureException e) {
                if (attempt >= maxAttempts) {
                    log.error("예약 재시도 한도 초과: eventId={}, seats={}, attempts={}",
                            eventId, batch.seatIds(), attempt, e);
                    throw new BusinessException(ErrorCode.BOOKING_CONTENTION, String.join(", ", batch.seatIds()));
                }
                log.warn("예약 트랜잭션 충돌, 재시도: eventId={}, attempt={}/{}, cause={}",
                        eventId, attempt, maxAttempts, e.getClass().getSimpleName());
            } catch (DataIntegrityViolationException e) {
                // (seat, date) 유니크 제약이 잠금을 우회한 중복 예약을 막은 경우
                log.warn("예약 중복 제약 위반: eventId={}, seats={}", eventId, batch.seatIds());
                throw new BusinessException(ErrorCode.SEAT_ALREADY_BOOKED, String.join(", ", batch.seatIds()));
            } catch (DataAccessException e) {
                log.error("예약 저장 실패: eventId={}, seats={}", eventId, batch.seatIds(), e);
                throw new BusinessException(ErrorCode.INTERNAL_ERROR);
            }
        }
    }

    private void validate(BookingBatch batch) {
        if (batch.isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_BOOKING_REQUEST, "bookings가 비어 있습니다");
        }
        for (SeatRequest request : batch.requests()) {
            if (request == null) {
                throw new BusinessException(ErrorCode.INVALID_BOOKING_REQUEST, "빈 예약 항목이 있습니다");
            }
            request.missingField().ifPresent(field -> {
                throw new BusinessException(ErrorCode.INVALID_BOOKING_REQUEST,
                        field + " 누락 (seatId=" + (request.seatId() == null ? "unknown" : request.seatId()) + ")");
            });
            if (!request.hasValidSeatId()) {
                throw new BusinessException(ErrorCode.INVALID_SEAT_ID, request.seatId());
            }
        }
        batch.duplicatedSeatId().ifPresent(seatId -> {
            throw new BusinessException(ErrorCode.DUPLICATE_SEAT_IN_BATCH, seatId);
        });
    }
}
