package personal.ai.reporting.event.domain.service;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.ai.reporting.event.domain.model.ContractSigningEventType;
import personal.ai.reporting.event.domain.model.EventEnvelope;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("EventRouter 단위 테스트")
class EventRouterTest {

    private static EventEnvelope envelope(String eventType) {
        return new EventEnvelope(eventType, JsonNodeFactory.instance.objectNode());
    }

    @Test
    @DisplayName("유형에 맞는 핸들러로 전달")
    void dispatch_ToMatchingHandler() {
        // given
        RecordingHandler completed = new RecordingHandler(ContractSigningEventType.SIGNING_COMPLETED);
        RecordingHandler canceled = new RecordingHandler(ContractSigningEventType.SIGNING_CANCELED);
        EventRouter router = new EventRouter(List.of(completed, canceled));

        // when
        router.dispatch(envelope("contract.signing.completed"));

        // then
        assertThat(completed.handled).hasSize(1);
        assertThat(canceled.handled).isEmpty();
    }

    @Test
    @DisplayName("처리 대상이 아닌 유형은 아무것도 하지 않고 정상 완료")
    void dispatch_UnknownTypeIsIgnored() {
        // given
        RecordingHandler completed = new RecordingHandler(ContractSigningEventType.SIGNING_COMPLETED);
        EventRouter router = new EventRouter(List.of(completed));

        // when & then
        assertThatCode(() -> router.dispatch(envelope("contract.archived"))).doesNotThrowAnyException();
        assertThatCode(() -> router.dispatch(envelope(null))).doesNotThrowAnyException();
        assertThat(completed.handled).isEmpty();
    }

    @Test
    @DisplayName("같은 유형의 핸들러가 둘이면 초기화 실패")
    void duplicateHandler() {
        assertThatThrownBy(() -> new EventRouter(List.of(
                new RecordingHandler(ContractSigningEventType.SIGNING_FAILED),
                new RecordingHandler(ContractSigningEventType.SIGNING_FAILED))))
                .isInstanceOf(IllegalStateException.class);
    }

    private static final class RecordingHandler implements ContractEventHandler {

        private final ContractSigningEventType type;
        private final List<EventEnvelope> handled = new ArrayList<>();

        private RecordingHandler(ContractSigningEventType type) {
            this.type = type;
        }

        @Override
        public ContractSigningEventType supportedType() {
            return type;
        }

        @Override
        public void handle(EventEnvelope envelope) {
            handled.add(envelope);
        }
    }
}
