package kr.jemi.zseat.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class ClockConfig {

    /**
     * "오늘" 판단(당일 예약/당일 이벤트 금지)의 기준 시계.
     */
    @Bean
    public Clock clock(@Value("${zseat.clock.zone}") String zone) {
        return Clock.system(ZoneId.of(zone));
    }
}
