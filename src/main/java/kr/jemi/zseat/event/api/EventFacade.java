package kr.jemi.zseat.event.api;

import java.util.Optional;

public interface EventFacade {

    Optional<EventView> findEvent(long eventId);

    /**
     * 호출자 트랜잭션 안에서 이벤트를 공유 잠금으로 읽는다.
     * 예약 도중 마감/삭제가 끼어들지 못하게 하려면 이 메서드로 읽어야 한다.
     */
    Optional<EventView> lockEventForBooking(long eventId);
}
