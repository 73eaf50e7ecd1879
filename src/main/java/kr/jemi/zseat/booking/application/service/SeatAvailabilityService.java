package kr.jemi.zseat.booking.application.service;

import kr.jemi.zseat.booking.application.port.in.GetSeatAvailabilityUseCase;
import kr.jemi.zseat.booking.application.port.out.EventSchedulePort;
import kr.jemi.zseat.booking.application.port.out.SeatLedgerPort;
import kr.jemi.zseat.booking.domain.EventSchedule;
import kr.jemi.zseat.booking.domain.LedgerSeat;
import kr.jemi.zseat.booking.domain.SeatAvailability;
import kr.jemi.zseat.booking.domain.SeatRequest;
import kr.jemi.zseat.common.exception.BusinessException;
import kr.jemi.zseat.common.exception.ErrorCode;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class SeatAvailabilityService implements GetSeatAvailabilityUseCase {

    private final EventSchedulePort eventSchedulePort;
    private final SeatLedgerPort seatLedgerPort;
    private final Clock clock;

    public SeatAvailabilityService(EventSchedulePort eventSchedulePort,
                                   SeatLedgerPort seatLedgerPort,
                                   Clock clock) {
        this.eventSchedulePort = eventSchedulePort;
        this.seatLedgerPort = seatLedgerPort;
        this.clock = clock;
    }

    /**
     * 조회만 한다. 좌석 수가 모자라도 여기서 다시 만들지 않는다.
     */
    @Override
    @Transactional(readOnly = true)
    public List<SeatAvailability> getSeats(long eventId) {
        EventSchedule schedule = loadViewableSchedule(eventId);

        return seatLedgerPort.findSeats(eventId).stream()
                .map(seat -> toAvailability(seat, schedule))
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<SeatAvailability> getSeats(long eventId, List<String> seatIds) {
        List<String> requested = seatIds.stream()
                .map(String::trim)
                .distinct()
                .toList();
        if (requested.isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_REQUEST, "seatIds");
        }
        List<String> malformed = requested.stream()
                .filter(seatId -> !SeatRequest.isValidSeatId(seatId))
                .toList();
        if (!malformed.isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_SEAT_ID, String.join(", ", malformed));
        }

        EventSchedule schedule = loadViewableSchedule(eventId);
        Map<String, LedgerSeat> seatsById = seatLedgerPort.findSeats(eventId).stream()
                .collect(Collectors.toMap(LedgerSeat::seatId, Function.identity()));

        List<String> missing = requested.stream()
                .filter(seatId -> !seatsById.containsKey(seatId))
                .toList();
        if (!missing.isEmpty()) {
            throw new BusinessException(ErrorCode.SEAT_NOT_FOUND, String.join(", ", missing));
        }

        return requested.stream()
                .map(seatId -> toAvailability(seatsById.get(seatId), schedule))
                .toList();
    }

    private EventSchedule loadViewableSchedule(long eventId) {
        EventSchedule schedule = eventSchedulePort.findSchedule(eventId)
                .orElseThrow(() -> new BusinessException(ErrorCode.EVENT_NOT_FOUND, String.valueOf(eventId)));
        if (schedule.isOn(LocalDate.now(clock))) {
            throw new BusinessException(ErrorCode.SAME_DAY_BOOKING, schedule.date().toString());
        }
        return schedule;
    }

    private static SeatAvailability toAvailability(LedgerSeat seat, EventSchedule schedule) {
        return new SeatAvailability(seat.seatId(), seat.price(), seat.isBookedOn(schedule.date()));
    }
}
