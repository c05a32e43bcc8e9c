package personal.ai.reporting.event.domain.service;

import personal.ai.reporting.event.domain.model.ContractSigningEventType;
import personal.ai.reporting.event.domain.model.EventEnvelope;

/**
 * 계약 서명 이벤트 핸들러
 */
public interface ContractEventHandler {

    ContractSigningEventType supportedType();

    /**
     * @throws personal.ai.reporting.event.domain.exception.EventHandlingException 처리 실패 시
     */
    void handle(EventEnvelope envelope);
}
