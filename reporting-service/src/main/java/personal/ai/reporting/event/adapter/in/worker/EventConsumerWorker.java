package personal.ai.reporting.event.adapter.in.worker;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import personal.ai.reporting.event.application.service.EventIngestionLoop;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Event Consumer Worker
 * 애플리케이션 시작 시 전용 스레드에서 EventIngestionLoop를 실행하고 종료 시 정지
 * 큐 URL이 설정되지 않으면 소비를 시작하지 않음
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventConsumerWorker {

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final ObjectProvider<EventIngestionLoop> eventIngestionLoopProvider;

    private EventIngestionLoop loop;
    private ExecutorService executor;

    @PostConstruct
    public void start() {
        loop = eventIngestionLoopProvider.getIfAvailable();
        if (loop == null) {
            log.warn("Event consumer disabled: reporting.events.queue-url is not set");
            return;
        }

        executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "event-consumer");
            thread.setDaemon(true);
            return thread;
        });
        executor.submit(loop::run);
        log.info("Event consumer worker started");
    }

    @PreDestroy
    public void stop() {
        if (loop == null) {
            return;
        }
        log.info("Stopping event consumer worker...");
        loop.stop();

        executor.shutdown();
        try {
            // 롱 폴링 대기 중인 수신 호출이 끝날 때까지 대기
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * 헬스 체크용 상태
     */
    public boolean isEnabled() {
        return loop != null;
    }

    public boolean isRunning() {
        return loop != null && loop.isRunning();
    }
}
