package personal.ai.reporting.event.application.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import personal.ai.reporting.event.application.config.EventConsumerProperties;
import personal.ai.reporting.event.application.port.out.EventMessageSource;
import personal.ai.reporting.event.domain.exception.MalformedMessageException;
import personal.ai.reporting.event.domain.model.EventEnvelope;
import personal.ai.reporting.event.domain.model.InboundMessage;
import personal.ai.reporting.event.domain.model.PollResult;
import personal.ai.reporting.event.domain.service.EventEnvelopeParser;
import personal.ai.reporting.event.domain.service.EventRouter;

import java.util.List;

/**
 * Event Ingestion Loop
 * 메시지 소스를 롱 폴링하여 이벤트를 처리하고, 성공한 메시지만 확인(삭제)
 * <p>
 * 실패한 메시지는 확인하지 않고 남겨두어 재전달되게 하며 (at-least-once),
 * 재전달된 메시지는 다시 처리되므로 지표가 중복 기록될 수 있음
 */
@Slf4j
public class EventIngestionLoop {

    private static final String MESSAGES_METRIC = "reporting.events.messages";
    private static final String POLL_FAILURES_METRIC = "reporting.events.poll.failures";

    private final EventMessageSource messageSource;
    private final EventEnvelopeParser parser;
    private final EventRouter router;
    private final EventConsumerProperties properties;

    private final Counter acknowledgedCounter;
    private final Counter failedCounter;
    private final Counter pollFailureCounter;

    private volatile boolean stopRequested = false;
    private volatile boolean running = false;

    public EventIngestionLoop(EventMessageSource messageSource,
                              EventEnvelopeParser parser,
                              EventRouter router,
                              EventConsumerProperties properties,
                              MeterRegistry meterRegistry) {
        this.messageSource = messageSource;
        this.parser = parser;
        this.router = router;
        this.properties = properties;
        this.acknowledgedCounter = Counter.builder(MESSAGES_METRIC)
                .tag("outcome", "acknowledged")
                .description("Number of event messages processed and acknowledged")
                .register(meterRegistry);
        this.failedCounter = Counter.builder(MESSAGES_METRIC)
                .tag("outcome", "failed")
                .description("Number of event messages left for redelivery")
                .register(meterRegistry);
        this.pollFailureCounter = Counter.builder(POLL_FAILURES_METRIC)
                .description("Number of failed receive calls")
                .register(meterRegistry);
    }

    /**
     * 한 번 수신하여 메시지별로 독립 처리
     * 수신 호출이 실패하면 빈 결과를 반환
     */
    public PollResult pollOnce() {
        List<InboundMessage> messages;
        try {
            messages = messageSource.receive(properties.maxMessages(), properties.waitTimeSeconds());
        } catch (Exception e) {
            log.error("Failed to poll event messages", e);
            pollFailureCounter.increment();
            return PollResult.empty();
        }

        if (messages.isEmpty()) {
            return PollResult.empty();
        }
        log.info("Received event messages: count={}", messages.size());

        int acknowledged = 0;
        for (InboundMessage message : messages) {
            if (process(message)) {
                acknowledged++;
            }
        }

        int failed = messages.size() - acknowledged;
        if (failed > 0) {
            log.warn("Event messages left for redelivery: received={}, failed={}", messages.size(), failed);
        }
        return new PollResult(messages.size(), acknowledged, failed);
    }

    private boolean process(InboundMessage message) {
        try {
            EventEnvelope envelope = parser.parse(message.body());
            log.info("Processing event: messageId={}, eventType={}", message.messageId(), envelope.eventType());
            router.dispatch(envelope);
        } catch (MalformedMessageException e) {
            log.error("Malformed event message: messageId={}, reason={}", message.messageId(), e.getMessage());
            failedCounter.increment();
            return false;
        } catch (Exception e) {
            log.error("Failed to process event message: messageId={}", message.messageId(), e);
            failedCounter.increment();
            return false;
        }

        try {
            messageSource.acknowledge(message);
        } catch (Exception e) {
            log.error("Failed to acknowledge event message: messageId={}", message.messageId(), e);
            failedCounter.increment();
            return false;
        }
        acknowledgedCounter.increment();
        return true;
    }

    /**
     * stop()이 호출될 때까지 반복 폴링
     * 일시적인 오류로는 종료하지 않음
     */
    public void run() {
        running = true;
        log.info("Event ingestion loop started: maxMessages={}, waitTimeSeconds={}",
                properties.maxMessages(), properties.waitTimeSeconds());
        try {
            while (!stopRequested) {
                try {
                    PollResult result = pollOnce();
                    if (result.received() == 0 && !backoff()) {
                        break;
                    }
                } catch (Exception e) {
                    log.error("Unexpected error in event ingestion loop", e);
                    if (!backoff()) {
                        break;
                    }
                }
            }
        } finally {
            running = false;
            log.info("Event ingestion loop stopped");
        }
    }

    public void stop() {
        stopRequested = true;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * @return 인터럽트되면 false
     */
    private boolean backoff() {
        if (properties.idleBackoffMs() <= 0 || stopRequested) {
            return true;
        }
        try {
            Thread.sleep(properties.idleBackoffMs());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopRequested = true;
            return false;
        }
    }
}
