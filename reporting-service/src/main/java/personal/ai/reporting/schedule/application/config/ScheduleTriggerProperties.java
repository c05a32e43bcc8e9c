package personal.ai.reporting.schedule.application.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 스케줄 자동 실행 설정 Properties
 * application.yml의 reporting.schedule.trigger.* 설정을 바인딩
 *
 * @param enabled    자동 실행 여부
 * @param intervalMs 실행 대상 확인 주기 (기본 60초)
 * @param batchSize  한 번에 처리할 최대 스케줄 수
 */
@ConfigurationProperties(prefix = "reporting.schedule.trigger")
public record ScheduleTriggerProperties(
        boolean enabled,
        long intervalMs,
        int batchSize
) {
    public ScheduleTriggerProperties {
        if (intervalMs <= 0) {
            intervalMs = 60_000L;
        }
        if (batchSize <= 0) {
            batchSize = 100;
        }
    }
}
