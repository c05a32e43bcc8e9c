package personal.ai.reporting.event.application.service.handler;

import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;
import personal.ai.reporting.event.application.config.EventConsumerProperties;
import personal.ai.reporting.event.domain.model.ContractSigningEventType;
import personal.ai.reporting.event.domain.model.EventEnvelope;
import personal.ai.reporting.metric.application.port.in.RecordMetricUseCase;
import personal.ai.reporting.template.application.port.in.GetTemplateUseCase;

import java.util.List;

/**
 * Signing completed handler
 * 서명 완료: 완료 건수와 최종 서명자 수
 */
@Component
public class SigningCompletedHandler extends AbstractSigningMetricsHandler {

    public SigningCompletedHandler(GetTemplateUseCase getTemplateUseCase,
                                   RecordMetricUseCase recordMetricUseCase,
                                   TransactionTemplate transactionTemplate,
                                   EventConsumerProperties properties) {
        super(getTemplateUseCase, recordMetricUseCase, transactionTemplate, properties);
    }

    @Override
    public ContractSigningEventType supportedType() {
        return ContractSigningEventType.SIGNING_COMPLETED;
    }

    @Override
    protected List<SigningMetric> metricsFor(EventEnvelope envelope) {
        return List.of(
                SigningMetric.count("contract_signing_completed", 1),
                SigningMetric.count("completed_signing_participants",
                        envelope.payloadListSize("signed_participants")));
    }
}
