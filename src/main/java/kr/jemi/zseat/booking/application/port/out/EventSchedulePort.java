package kr.jemi.zseat.booking.application.port.out;

import kr.jemi.zseat.booking.domain.EventSchedule;

import java.util.Optional;

public interface EventSchedulePort {

    Optional<EventSchedule> findSchedule(long eventId);

    /**
     * 예약 트랜잭션이 끝날 때까지 마감/삭제가 끼어들지 못하도록 잠그고 읽는다.
     */
    Optional<EventSchedule> lockSchedule(long eventId);
}
