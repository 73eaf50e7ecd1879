package kr.jemi.zseat.common.scheduler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.modulith.events.IncompleteEventPublications;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.BDDMockito.then;
import static org.mockito.BDDMockito.willThrow;

@ExtendWith(MockitoExtension.class)
class EventResubmitSchedulerTest {

    @Mock
    IncompleteEventPublications incompleteEventPublications;

    @Test
    @DisplayName("설정된 기준 시간보다 오래된 미완료 발행만 재발행한다")
    void resubmitsOlderThanConfiguredDuration() {
        EventResubmitScheduler scheduler = new EventResubmitScheduler(incompleteEventPublications, Duration.ofMinutes(5));

        scheduler.resubmitIncompleteEvents();

        then(incompleteEventPublications).should().resubmitIncompletePublicationsOlderThan(Duration.ofMinutes(5));
    }

    @Test
    @DisplayName("재발행 중 예외가 나도 스케줄러 밖으로 전파하지 않는다")
    void containsResubmitFailure() {
        EventResubmitScheduler scheduler = new EventResubmitScheduler(incompleteEventPublications, Duration.ofMinutes(5));
        willThrow(new IllegalStateException("db down"))
            .given(incompleteEventPublications).resubmitIncompletePublicationsOlderThan(Duration.ofMinutes(5));

        assertThatCode(scheduler::resubmitIncompleteEvents).doesNotThrowAnyException();
    }
}
