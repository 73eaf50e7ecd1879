package kr.jemi.zseat.event.application.port.in;

import kr.jemi.zseat.common.auth.Requester;
import kr.jemi.zseat.event.domain.Event;

import java.util.List;

public interface GetEventUseCase {

    Event getEvent(long eventId);

    List<Event> listUpcoming();

    List<Event> listRecent();

    List<Event> listPast(Requester requester);
}
