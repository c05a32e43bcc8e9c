package personal.ai.reporting.event.domain.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.ai.reporting.event.domain.model.ContractSigningEventType;
import personal.ai.reporting.event.domain.model.EventEnvelope;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Event Router
 * 이벤트 유형별 핸들러 조회 테이블
 * <p>
 * 핸들러가 없는 유형(UNRECOGNIZED 포함)은 아무것도 하지 않는 핸들러로 처리되어 정상 완료로 간주
 */
@Slf4j
@Component
public class EventRouter {

    private final Map<ContractSigningEventType, ContractEventHandler> handlers =
            new EnumMap<>(ContractSigningEventType.class);

    public EventRouter(List<ContractEventHandler> handlers) {
        for (ContractEventHandler handler : handlers) {
            ContractEventHandler previous = this.handlers.put(handler.supportedType(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handler for event type: " + handler.supportedType());
            }
        }
        log.info("Event router initialized: handledTypes={}", this.handlers.keySet());
    }

    public ContractEventHandler route(EventEnvelope envelope) {
        return handlers.getOrDefault(envelope.type(), IgnoredEventHandler.INSTANCE);
    }

    public void dispatch(EventEnvelope envelope) {
        route(envelope).handle(envelope);
    }

    /**
     * 처리 대상이 아닌 이벤트
     */
    private static final class IgnoredEventHandler implements ContractEventHandler {

        private static final IgnoredEventHandler INSTANCE = new IgnoredEventHandler();

        @Override
        public ContractSigningEventType supportedType() {
            return ContractSigningEventType.UNRECOGNIZED;
        }

        @Override
        public void handle(EventEnvelope envelope) {
            log.debug("Ignoring event type: {}", envelope.eventType());
        }
    }
}
