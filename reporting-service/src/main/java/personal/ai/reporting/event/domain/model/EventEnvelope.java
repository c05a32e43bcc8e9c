package personal.ai.reporting.event.domain.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Event Envelope
 * 이벤트 유형 문자열과 원본 JSON 객체
 * <p>
 * payload 객체가 없으면 envelope 자체를 payload로 사용
 */
public record EventEnvelope(String eventType, JsonNode body) {

    private static final String EVENT_TYPE_FIELD = "event_type";
    private static final String PAYLOAD_FIELD = "payload";

    public static EventEnvelope from(JsonNode body) {
        JsonNode typeNode = body.get(EVENT_TYPE_FIELD);
        String eventType = typeNode != null && typeNode.isTextual() ? typeNode.asText() : null;
        return new EventEnvelope(eventType, body);
    }

    public ContractSigningEventType type() {
        return ContractSigningEventType.fromWireValue(eventType);
    }

    public JsonNode payload() {
        JsonNode payload = body.get(PAYLOAD_FIELD);
        return payload != null && payload.isObject() ? payload : body;
    }

    /**
     * payload의 문자열 필드 (없으면 null)
     */
    public String payloadText(String field) {
        JsonNode node = payload().get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    /**
     * payload의 배열 필드 크기 (없거나 배열이 아니면 0)
     */
    public int payloadListSize(String field) {
        JsonNode node = payload().get(field);
        return node != null && node.isArray() ? node.size() : 0;
    }
}
