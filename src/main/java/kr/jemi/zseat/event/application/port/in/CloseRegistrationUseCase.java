package kr.jemi.zseat.event.application.port.in;

import kr.jemi.zseat.common.auth.Requester;
import kr.jemi.zseat.event.domain.Event;

public interface CloseRegistrationUseCase {

    Event closeRegistration(long eventId, Requester requester);
}
