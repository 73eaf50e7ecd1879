package kr.jemi.zseat.event.application.port.in;

import kr.jemi.zseat.common.auth.Requester;

public interface DeleteEventUseCase {

    void delete(long eventId, Requester requester);
}
