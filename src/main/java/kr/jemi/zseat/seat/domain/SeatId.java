package kr.jemi.zseat.seat.domain;

import java.util.Comparator;
import java.util.regex.Pattern;

/**
 * 행 문자 + 열 번호로 이루어진 좌석 번호 (예: A1, C10).
 * 정렬은 행 우선(A1, A2, ..., A10, B1).
 */
public record SeatId(char row, int column) implements Comparable<SeatId> {

    private static final Pattern FORMAT = Pattern.compile("^[A-Z][1-9][0-9]?$");

    private static final Comparator<SeatId> ROW_MAJOR =
            Comparator.comparing(SeatId::row).thenComparingInt(SeatId::column);

    public SeatId {
        if (row < 'A' || row > 'Z') {
            throw new IllegalArgumentException("행은 A~Z 사이여야 합니다: " + row);
        }
        if (column < 1 || column > 99) {
            throw new IllegalArgumentException("열은 1~99 사이여야 합니다: " + column);
        }
    }

    public static boolean isValid(String value) {
        return value != null && FORMAT.matcher(value).matches();
    }

    public static SeatId parse(String value) {
        if (!isValid(value)) {
            throw new IllegalArgumentException("좌석 번호 형식이 올바르지 않습니다: " + value);
        }
        return new SeatId(value.charAt(0), Integer.parseInt(value.substring(1)));
    }

    public String value() {
        return String.valueOf(row) + column;
    }

    @Override
    public int compareTo(SeatId other) {
        return ROW_MAJOR.compare(this, other);
    }

    @Override
    public String toString() {
        return value();
    }
}
