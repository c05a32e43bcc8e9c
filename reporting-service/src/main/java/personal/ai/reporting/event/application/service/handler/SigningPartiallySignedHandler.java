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
 * Partially signed handler
 * 서명 진행률: signed / (signed + pending) * 100, 참여자가 없으면 0
 */
@Component
public class SigningPartiallySignedHandler extends AbstractSigningMetricsHandler {

    public SigningPartiallySignedHandler(GetTemplateUseCase getTemplateUseCase,
                                         RecordMetricUseCase recordMetricUseCase,
                                         TransactionTemplate transactionTemplate,
                                         EventConsumerProperties properties) {
        super(getTemplateUseCase, recordMetricUseCase, transactionTemplate, properties);
    }

    @Override
    public ContractSigningEventType supportedType() {
        return ContractSigningEventType.SIGNING_PARTIALLY_SIGNED;
    }

    @Override
    protected List<SigningMetric> metricsFor(EventEnvelope envelope) {
        int signed = envelope.payloadListSize("signed_participants");
        int pending = envelope.payloadListSize("pending_participants");
        int total = signed + pending;
        double progress = total > 0 ? (double) signed / total * 100 : 0;

        return List.of(new SigningMetric("signing_progress_percent", progress, UNIT_PERCENT));
    }
}
