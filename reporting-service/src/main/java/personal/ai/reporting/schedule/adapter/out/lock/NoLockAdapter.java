package personal.ai.reporting.schedule.adapter.out.lock;

import lombok.extern.slf4j.Slf4j;
import personal.ai.reporting.schedule.application.port.out.SchedulerLockPort;

/**
 * NoLock Adapter
 * 락 없이 항상 실행을 허용 (단일 인스턴스, 로컬 개발)
 *
 * 주의: 다중 인스턴스 환경에서는 같은 스케줄이 중복 실행될 수 있음
 */
@Slf4j
public class NoLockAdapter implements SchedulerLockPort {

    @Override
    public boolean tryAcquire(String schedulerName, String resourceId) {
        log.debug("[NoLock] Always allow: scheduler={}, resourceId={}", schedulerName, resourceId);
        return true;
    }

    @Override
    public void release(String schedulerName, String resourceId) {
        // 해제할 락 없음
    }

    @Override
    public String getStrategyName() {
        return "none";
    }
}
