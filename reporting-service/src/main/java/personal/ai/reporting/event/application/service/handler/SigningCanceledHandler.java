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
 * Signing canceled handler
 * 서명 취소 건수
 */
@Component
public class SigningCanceledHandler extends AbstractSigningMetricsHandler {

    public SigningCanceledHandler(GetTemplateUseCase getTemplateUseCase,
                                  RecordMetricUseCase recordMetricUseCase,
                                  TransactionTemplate transactionTemplate,
                                  EventConsumerProperties properties) {
        super(getTemplateUseCase, recordMetricUseCase, transactionTemplate, properties);
    }

    @Override
    public ContractSigningEventType supportedType() {
        return ContractSigningEventType.SIGNING_CANCELED;
    }

    @Override
    protected List<SigningMetric> metricsFor(EventEnvelope envelope) {
        return List.of(SigningMetric.count("contract_signing_canceled", 1));
    }
}
