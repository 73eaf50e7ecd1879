package kr.jemi.zseat.common.scheduler;

import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.modulith.events.IncompleteEventPublications;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 리스너 실행 전에 프로세스가 내려가 완료되지 못한 이벤트 발행(예약 알림, 마감 명단)을 다시 발행한다.
 * 재발행된 알림은 중복 발송될 수 있다.
 */
@Component
public class EventResubmitScheduler {

    private static final Logger log = LoggerFactory.getLogger(EventResubmitScheduler.class);

    private final IncompleteEventPublications incompleteEventPublications;
    private final Duration olderThan;

    public EventResubmitScheduler(IncompleteEventPublications incompleteEventPublications,
                                  @Value("${zseat.event-resubmit.older-than}") Duration olderThan) {
        this.incompleteEventPublications = incompleteEventPublications;
        this.olderThan = olderThan;
    }

    @Scheduled(cron = "${zseat.event-resubmit.cron}")
    @SchedulerLock(name = "resubmitIncompleteEvents",
            lockAtMostFor = "${zseat.event-resubmit.lock-at-most-for}",
            lockAtLeastFor = "${zseat.event-resubmit.lock-at-least-for}")
    public void resubmitIncompleteEvents() {
        log.debug("미완료 이벤트 재발행 시작: olderThan={}", olderThan);
        try {
            incompleteEventPublications.resubmitIncompletePublicationsOlderThan(olderThan);
        } catch (Exception e) {
            log.error("미완료 이벤트 재발행 실패: olderThan={}", olderThan, e);
        }
    }
}
