package personal.ai.reporting.event.application.service.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionTemplate;
import personal.ai.reporting.event.application.config.EventConsumerProperties;
import personal.ai.reporting.event.domain.exception.EventHandlingException;
import personal.ai.reporting.event.domain.model.ContractSigningEventType;
import personal.ai.reporting.event.domain.model.EventEnvelope;
import personal.ai.reporting.support.NoOpTransactionManager;
import personal.ai.reporting.metric.application.port.in.RecordMetricCommand;
import personal.ai.reporting.metric.application.port.in.RecordMetricUseCase;
import personal.ai.reporting.template.application.port.in.GetTemplateUseCase;
import personal.ai.reporting.template.domain.model.ReportTemplate;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("계약 서명 이벤트 지표 핸들러 단위 테스트")
class SigningMetricsHandlerTest {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final String ANCHOR_NAME = "Contract Signing Report";
    private static final Long ANCHOR_ID = 42L;

    @Mock
    private GetTemplateUseCase getTemplateUseCase;
    @Mock
    private RecordMetricUseCase recordMetricUseCase;

    private NoOpTransactionManager transactionManager;
    private TransactionTemplate transactionTemplate;
    private EventConsumerProperties properties;

    @BeforeEach
    void setUp() {
        transactionManager = new NoOpTransactionManager();
        transactionTemplate = new TransactionTemplate(transactionManager);
        properties = new EventConsumerProperties(null, null, null, 0, 0, null, 0L);
    }

    private EventEnvelope envelope(String json) throws Exception {
        return EventEnvelope.from(OBJECT_MAPPER.readTree(json));
    }

    private void anchorExists() {
        given(getTemplateUseCase.findTemplateByName(ANCHOR_NAME)).willReturn(Optional.of(
                new ReportTemplate(ANCHOR_ID, ANCHOR_NAME, "contracts", null, null, null, false, true, null, null)));
    }

    private List<RecordMetricCommand> recordedCommands(int expected) {
        ArgumentCaptor<RecordMetricCommand> captor = ArgumentCaptor.forClass(RecordMetricCommand.class);
        verify(recordMetricUseCase, times(expected)).appendMetric(captor.capture());
        return captor.getAllValues();
    }

    @Test
    @DisplayName("서명 요청 - 시작 건수와 참여자 수 기록")
    void requested() throws Exception {
        // given
        anchorExists();
        SigningRequestedHandler handler = new SigningRequestedHandler(
                getTemplateUseCase, recordMetricUseCase, transactionTemplate, properties);

        // when
        handler.handle(envelope("""
                {"event_type":"contract.signing.requested",
                 "payload":{"signing_package_id":"pkg-1","participants":["a","b","c"]}}
                """));

        // then
        assertThat(recordedCommands(2))
                .extracting(RecordMetricCommand::reportId, RecordMetricCommand::name,
                        RecordMetricCommand::value, RecordMetricCommand::unit, RecordMetricCommand::category)
                .containsExactly(
                        tuple(ANCHOR_ID, "contract_signing_initiated", 1.0, "count", "contracts"),
                        tuple(ANCHOR_ID, "signing_participants", 3.0, "count", "contracts"));
        assertThat(transactionManager.commits()).isEqualTo(1);
    }

    @Test
    @DisplayName("부분 서명 - 서명 2명, 대기 1명이면 진행률 66.67%")
    void partiallySigned_Progress() throws Exception {
        // given
        anchorExists();
        SigningPartiallySignedHandler handler = new SigningPartiallySignedHandler(
                getTemplateUseCase, recordMetricUseCase, transactionTemplate, properties);

        // when
        handler.handle(envelope("""
                {"event_type":"contract.signing.partially_signed",
                 "payload":{"signed_participants":["a","b"],"pending_participants":["c"]}}
                """));

        // then
        RecordMetricCommand command = recordedCommands(1).get(0);
        assertThat(command.name()).isEqualTo("signing_progress_percent");
        assertThat(command.unit()).isEqualTo("percent");
        assertThat(command.value()).isCloseTo(66.67, within(0.01));
    }

    @Test
    @DisplayName("부분 서명 - 참여자가 없으면 진행률 0")
    void partiallySigned_NoParticipants() throws Exception {
        // given
        anchorExists();
        SigningPartiallySignedHandler handler = new SigningPartiallySignedHandler(
                getTemplateUseCase, recordMetricUseCase, transactionTemplate, properties);

        // when
        handler.handle(envelope("{\"event_type\":\"contract.signing.partially_signed\",\"payload\":{}}"));

        // then
        assertThat(recordedCommands(1).get(0).value()).isZero();
    }

    @Test
    @DisplayName("서명 완료 - 완료 건수와 서명 참여자 수 기록")
    void completed() throws Exception {
        // given
        anchorExists();
        SigningCompletedHandler handler = new SigningCompletedHandler(
                getTemplateUseCase, recordMetricUseCase, transactionTemplate, properties);

        // when
        handler.handle(envelope("""
                {"event_type":"contract.signing.completed",
                 "payload":{"signed_participants":["a","b"]}}
                """));

        // then
        assertThat(recordedCommands(2))
                .extracting(RecordMetricCommand::name, RecordMetricCommand::value)
                .containsExactly(
                        tuple("contract_signing_completed", 1.0),
                        tuple("completed_signing_participants", 2.0));
    }

    @Test
    @DisplayName("서명 취소/실패 - 건수 1 기록")
    void canceledAndFailed() throws Exception {
        // given
        anchorExists();
        SigningCanceledHandler canceled = new SigningCanceledHandler(
                getTemplateUseCase, recordMetricUseCase, transactionTemplate, properties);
        SigningFailedHandler failed = new SigningFailedHandler(
                getTemplateUseCase, recordMetricUseCase, transactionTemplate, properties);

        // when
        canceled.handle(envelope("{\"event_type\":\"contract.signing.canceled\"}"));
        failed.handle(envelope("{\"event_type\":\"contract.signing.failed\"}"));

        // then
        assertThat(recordedCommands(2))
                .extracting(RecordMetricCommand::name)
                .containsExactly("contract_signing_canceled", "contract_signing_failed");
        assertThat(canceled.supportedType()).isEqualTo(ContractSigningEventType.SIGNING_CANCELED);
        assertThat(failed.supportedType()).isEqualTo(ContractSigningEventType.SIGNING_FAILED);
    }

    @Test
    @DisplayName("기준 템플릿이 없으면 아무것도 기록하지 않고 정상 종료")
    void anchorMissing_NoOp() throws Exception {
        // given
        given(getTemplateUseCase.findTemplateByName(ANCHOR_NAME)).willReturn(Optional.empty());
        SigningCompletedHandler handler = new SigningCompletedHandler(
                getTemplateUseCase, recordMetricUseCase, transactionTemplate, properties);

        // when
        handler.handle(envelope("{\"event_type\":\"contract.signing.completed\",\"payload\":{}}"));

        // then
        verify(recordMetricUseCase, never()).appendMetric(any());
    }

    @Test
    @DisplayName("지표 기록 실패 - 트랜잭션 롤백 후 EventHandlingException")
    void recordFailure_RollsBackAndWraps() throws Exception {
        // given
        anchorExists();
        given(recordMetricUseCase.appendMetric(any())).willThrow(new IllegalStateException("db down"));
        SigningRequestedHandler handler = new SigningRequestedHandler(
                getTemplateUseCase, recordMetricUseCase, transactionTemplate, properties);
        EventEnvelope envelope = envelope("{\"event_type\":\"contract.signing.requested\"}");

        // when & then
        assertThatThrownBy(() -> handler.handle(envelope))
                .isInstanceOf(EventHandlingException.class)
                .hasRootCauseMessage("db down");
        assertThat(transactionManager.rollbacks()).isEqualTo(1);
        assertThat(transactionManager.commits()).isZero();
    }
}
