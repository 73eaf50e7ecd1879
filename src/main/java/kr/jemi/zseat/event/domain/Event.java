package kr.jemi.zseat.event.domain;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import kr.jemi.zseat.common.validation.SelfValidating;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

public class Event implements SelfValidating {

    public static final int MIN_CAPACITY = 1;
    public static final int MAX_CAPACITY = 260;

    private final long id;
    @NotBlank
    private final String name;
    @NotNull
    private final LocalDate date;
    @NotNull
    private final LocalTime time;
    @NotBlank
    private final String description;
    @NotBlank
    private final String venue;
    @Min(MIN_CAPACITY)
    @Max(MAX_CAPACITY)
    private final int capacity;
    private boolean registrationClosed;
    @NotNull
    private final LocalDateTime createdAt;

    public Event(long id, String name, LocalDate date, LocalTime time, String description,
                 String venue, int capacity, boolean registrationClosed, LocalDateTime createdAt) {
        this.id = id;
        this.name = name;
        this.date = date;
        this.time = time;
        this.description = description;
        this.venue = venue;
        this.capacity = capacity;
        this.registrationClosed = registrationClosed;
        this.createdAt = createdAt;
        validateSelf();
    }

    public static Event create(long id, String name, LocalDate date, LocalTime time,
                               String description, String venue, int capacity, LocalDateTime createdAt) {
        return new Event(id, name, date, time, description, venue, capacity, false, createdAt);
    }

    public static boolean isSupportedCapacity(int capacity) {
        return capacity >= MIN_CAPACITY && capacity <= MAX_CAPACITY;
    }

    /**
     * 한 번 마감되면 되돌릴 수 없다.
     */
    public void closeRegistration() {
        if (registrationClosed) {
            throw new IllegalStateException("이미 예약이 마감된 이벤트입니다: " + id);
        }
        this.registrationClosed = true;
    }

    public boolean isScheduledOn(LocalDate day) {
        return date.equals(day);
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public LocalDate getDate() {
        return date;
    }

    public LocalTime getTime() {
        return time;
    }

    public String getDescription() {
        return description;
    }

    public String getVenue() {
        return venue;
    }

    public int getCapacity() {
        return capacity;
    }

    public boolean isRegistrationClosed() {
        return registrationClosed;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }
}
