package personal.ai.reporting.event.domain.exception;

import personal.ai.reporting.event.domain.model.ContractSigningEventType;

/**
 * 이벤트 핸들러 실행 실패
 * 메시지는 확인(삭제)되지 않고 재전달됨
 */
public class EventHandlingException extends RuntimeException {

    private final ContractSigningEventType eventType;

    public EventHandlingException(ContractSigningEventType eventType, Throwable cause) {
        super(String.format("Failed to handle event: type=%s", eventType.getWireValue()), cause);
        this.eventType = eventType;
    }

    public ContractSigningEventType getEventType() {
        return eventType;
    }
}
