package kr.jemi.zseat.notification.application.port.in;

import kr.jemi.zseat.notification.domain.Roster;

public interface SendRosterUseCase {

    void sendRoster(Roster roster);
}
