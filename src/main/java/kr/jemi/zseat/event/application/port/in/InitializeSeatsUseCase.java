package kr.jemi.zseat.event.application.port.in;

import kr.jemi.zseat.common.auth.Requester;

public interface InitializeSeatsUseCase {

    int initializeSeats(long eventId, Requester requester);
}
