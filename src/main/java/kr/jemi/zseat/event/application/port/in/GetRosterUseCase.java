package kr.jemi.zseat.event.application.port.in;

import kr.jemi.zseat.common.auth.Requester;
import kr.jemi.zseat.event.domain.RosterEntry;

import java.util.List;

public interface GetRosterUseCase {

    List<RosterEntry> getRoster(long eventId, Requester requester);
}
