package kr.jemi.zseat.notification.application.port.in;

import kr.jemi.zseat.notification.domain.BookingConfirmation;

import java.util.List;

public interface SendBookingConfirmationsUseCase {

    /**
     * @return 발송에 성공한 건수
     */
    int sendConfirmations(List<BookingConfirmation> confirmations);
}
