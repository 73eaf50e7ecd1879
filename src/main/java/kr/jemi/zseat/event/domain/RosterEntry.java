package kr.jemi.zseat.event.domain;

import java.util.Optional;

public record RosterEntry(String seatId, String name, String email, String phone) {

    public Optional<String> phoneNumber() {
        return Optional.ofNullable(phone).filter(value -> !value.isBlank());
    }
}
