package personal.ai.reporting.schedule.application.port.out;

/**
 * 스케줄러 락 Port
 * 여러 인스턴스가 같은 스케줄을 동시에 실행하지 않도록 제어
 *
 * 구현체:
 * - NoLockAdapter: 락 없이 항상 실행 (단일 인스턴스)
 * - ClusterLockAdapter: Redis 스케줄별 분산 락 (다중 인스턴스)
 */
public interface SchedulerLockPort {

    /**
     * @param schedulerName 스케줄러 이름 (예: "schedule-run")
     * @param resourceId    락 대상 ID (스케줄 ID)
     * @return true: 실행 가능, false: 스킵 (다른 인스턴스가 처리 중)
     */
    boolean tryAcquire(String schedulerName, String resourceId);

    void release(String schedulerName, String resourceId);

    /**
     * 전략 이름 반환 (로깅용)
     */
    String getStrategyName();
}
