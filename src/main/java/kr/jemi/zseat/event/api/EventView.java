package kr.jemi.zseat.event.api;

import java.time.LocalDate;

public record EventView(long id, LocalDate date, int capacity, boolean registrationClosed) {
}
