package personal.ai.reporting.event.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import personal.ai.reporting.event.domain.exception.MalformedMessageException;
import personal.ai.reporting.event.domain.model.EventEnvelope;

/**
 * Event Envelope Parser
 * 메시지 본문을 EventEnvelope로 변환
 * <p>
 * 알림(notification) 형식으로 감싸진 경우 문자열 Message 필드 안의 JSON을 envelope로 사용
 */
@Component
public class EventEnvelopeParser {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final String NOTIFICATION_MESSAGE_FIELD = "Message";

    /**
     * @throws MalformedMessageException 본문 또는 내부 Message가 JSON 객체가 아닐 때
     */
    public EventEnvelope parse(String body) {
        JsonNode outer = readObject(body);

        JsonNode message = outer.get(NOTIFICATION_MESSAGE_FIELD);
        if (message != null && message.isTextual()) {
            return EventEnvelope.from(readObject(message.asText()));
        }
        return EventEnvelope.from(outer);
    }

    private JsonNode readObject(String json) {
        if (json == null || json.isBlank()) {
            throw new MalformedMessageException("Message body is empty");
        }
        JsonNode node;
        try {
            node = OBJECT_MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("Message body is not valid JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new MalformedMessageException("Message body is not a JSON object");
        }
        return node;
    }
}
