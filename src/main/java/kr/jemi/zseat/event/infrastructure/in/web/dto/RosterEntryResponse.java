package kr.jemi.zseat.event.infrastructure.in.web.dto;

import kr.jemi.zseat.event.domain.RosterEntry;

public record RosterEntryResponse(String seatId, String name, String email, String phone) {

    private static final String NO_PHONE = "N/A";

    public static RosterEntryResponse from(RosterEntry entry) {
        return new RosterEntryResponse(
                entry.seatId(),
                entry.name(),
                entry.email(),
                entry.phoneNumber().orElse(NO_PHONE)
        );
    }
}
