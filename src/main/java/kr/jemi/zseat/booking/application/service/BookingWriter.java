package kr.jemi.zseat.booking.application.service;

import kr.jemi.zseat.booking.api.SeatsBookedEvent;
import kr.jemi.zseat.booking.application.port.out.EventSchedulePort;
import kr.jemi.zseat.booking.application.port.out.SeatLedgerPort;
import kr.jemi.zseat.booking.domain.BookingBatch;
import kr.jemi.zseat.booking.domain.ConfirmedBooking;
import kr.jemi.zseat.booking.domain.EventSchedule;
import kr.jemi.zseat.booking.domain.LedgerSeat;
import kr.jemi.zseat.booking.domain.RecipientGroup;
import kr.jemi.zseat.booking.domain.SeatRequest;
import kr.jemi.zseat.common.auth.Requester;
import kr.jemi.zseat.common.exception.BusinessException;
import kr.jemi.zseat.common.exception.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class BookingWriter {

    private static final Logger log = LoggerFactory.getLogger(BookingWriter.class);

    private final EventSchedulePort eventSchedulePort;
    private final SeatLedgerPort seatLedgerPort;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public BookingWriter(EventSchedulePort eventSchedulePort,
                         SeatLedgerPort seatLedgerPort,
                         ApplicationEventPublisher eventPublisher,
                         Clock clock) {
        this.eventSchedulePort = eventSchedulePort;
        this.seatLedgerPort = seatLedgerPort;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * 좌석 상태는 반드시 이 트랜잭션 안에서 잠금을 잡은 뒤 다시 읽는다.
     * 어느 단계에서든 예외가 나면 아무 좌석도 예약되지 않는다.
     */
    @Transactional
    public List<ConfirmedBooking> write(BookingBatch batch, Requester requester) {
        long eventId = batch.eventId();

        // 3. 이벤트 존재 + 마감 여부
        EventSchedule schedule = eventSchedulePort.lockSchedule(eventId)
                .orElseThrow(() -> new BusinessException(ErrorCode.EVENT_NOT_FOUND, String.valueOf(eventId)));
        if (!schedule.acceptsBookingFrom(requester.admin())) {
            throw new BusinessException(ErrorCode.REGISTRATION_CLOSED, String.valueOf(eventId));
        }

        // 4. 모든 예약 날짜 == 이벤트 날짜
        LocalDate date = schedule.date();
        Optional<SeatRequest> mismatched = batch.requests().stream()
                .filter(request -> !request.date().equals(date))
                .findFirst();
        if (mismatched.isPresent()) {
            throw new BusinessException(ErrorCode.BOOKING_DATE_MISMATCH,
                    mismatched.get().seatId() + "=" + mismatched.get().date() + ", event=" + date);
        }

        // 5. 당일 예약 금지
        if (schedule.isOn(LocalDate.now(clock))) {
            throw new BusinessException(ErrorCode.SAME_DAY_BOOKING, date.toString());
        }

        // 6. 좌석 존재 (행 잠금)
        Map<String, LedgerSeat> seats = seatLedgerPort.lockSeats(eventId, batch.seatIds()).stream()
                .collect(Collectors.toMap(LedgerSeat::seatId, Function.identity()));
        List<String> missing = batch.seatIds().stream()
                .filter(seatId -> !seats.containsKey(seatId))
                .toList();
        if (!missing.isEmpty()) {
            throw new BusinessException(ErrorCode.SEAT_NOT_FOUND, String.join(", ", missing));
        }

        // 7. 이미 예약된 좌석 (요청 순서상 첫 번째)
        batch.seatIds().stream()
                .filter(seatId -> seats.get(seatId).isBookedOn(date))
                .findFirst()
                .ifPresent(seatId -> {
                    throw new BusinessException(ErrorCode.SEAT_ALREADY_BOOKED, seatId);
                });

        // 반영
        seatLedgerPort.appendBookings(eventId, date, batch.requests());
        List<ConfirmedBooking> confirmed = batch.requests().stream()
                .map(request -> ConfirmedBooking.of(request, date))
                .toList();

        // 커밋 후 notification 모듈로 전달
        eventPublisher.publishEvent(toBookedEvent(eventId, date, confirmed));

        log.info("좌석 예약 완료: eventId={}, date={}, seats={}", eventId, date, batch.seatIds());
        return confirmed;
    }

    private static SeatsBookedEvent toBookedEvent(long eventId, LocalDate date, List<ConfirmedBooking> confirmed) {
        List<SeatsBookedEvent.Recipient> recipients = RecipientGroup.groupByEmail(confirmed).stream()
                .map(group -> new SeatsBookedEvent.Recipient(group.email(), group.name(), group.seatIds()))
                .toList();
        return new SeatsBookedEvent(eventId, date, recipients);
    }
}
