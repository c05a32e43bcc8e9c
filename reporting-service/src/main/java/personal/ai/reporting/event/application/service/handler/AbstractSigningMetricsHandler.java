package personal.ai.reporting.event.application.service.handler;

import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.support.TransactionTemplate;
import personal.ai.reporting.event.application.config.EventConsumerProperties;
import personal.ai.reporting.event.domain.exception.EventHandlingException;
import personal.ai.reporting.event.domain.model.EventEnvelope;
import personal.ai.reporting.event.domain.service.ContractEventHandler;
import personal.ai.reporting.metric.application.port.in.RecordMetricCommand;
import personal.ai.reporting.metric.application.port.in.RecordMetricUseCase;
import personal.ai.reporting.template.application.port.in.GetTemplateUseCase;
import personal.ai.reporting.template.domain.model.ReportTemplate;

import java.util.List;
import java.util.Optional;

/**
 * 계약 서명 이벤트를 지표로 기록하는 핸들러의 공통 흐름
 * <p>
 * 1. 기준 템플릿(anchor)을 이름으로 조회 (없으면 아무것도 기록하지 않고 정상 종료)
 * 2. 이벤트별 지표를 contracts 분류로 기록
 * <p>
 * 한 이벤트의 지표는 하나의 트랜잭션에서 기록되며, 실패는 EventHandlingException으로 감싸서 전파
 */
@Slf4j
public abstract class AbstractSigningMetricsHandler implements ContractEventHandler {

    static final String CATEGORY = "contracts";
    static final String UNIT_COUNT = "count";
    static final String UNIT_PERCENT = "percent";
    static final String SIGNING_PACKAGE_ID = "signing_package_id";

    private final GetTemplateUseCase getTemplateUseCase;
    private final RecordMetricUseCase recordMetricUseCase;
    private final TransactionTemplate transactionTemplate;
    private final EventConsumerProperties properties;

    protected AbstractSigningMetricsHandler(GetTemplateUseCase getTemplateUseCase,
                                            RecordMetricUseCase recordMetricUseCase,
                                            TransactionTemplate transactionTemplate,
                                            EventConsumerProperties properties) {
        this.getTemplateUseCase = getTemplateUseCase;
        this.recordMetricUseCase = recordMetricUseCase;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties;
    }

    @Override
    public void handle(EventEnvelope envelope) {
        String signingPackageId = envelope.payloadText(SIGNING_PACKAGE_ID);
        log.info("Recording contract signing event: type={}, signingPackageId={}",
                supportedType().getWireValue(), signingPackageId);

        try {
            transactionTemplate.executeWithoutResult(status -> recordMetrics(envelope));
        } catch (Exception e) {
            log.error("Failed to handle contract signing event: type={}, signingPackageId={}",
                    supportedType().getWireValue(), signingPackageId, e);
            throw new EventHandlingException(supportedType(), e);
        }
    }

    private void recordMetrics(EventEnvelope envelope) {
        Optional<ReportTemplate> anchor = getTemplateUseCase.findTemplateByName(properties.anchorTemplateName());
        if (anchor.isEmpty()) {
            log.warn("Anchor template not found, skipping metrics: templateName={}, type={}",
                    properties.anchorTemplateName(), supportedType().getWireValue());
            return;
        }

        Long anchorId = anchor.get().id();
        for (SigningMetric metric : metricsFor(envelope)) {
            recordMetricUseCase.appendMetric(new RecordMetricCommand(
                    anchorId, metric.name(), metric.value(), metric.unit(), CATEGORY));
        }
    }

    /**
     * 이벤트에서 기록할 지표 목록
     */
    protected abstract List<SigningMetric> metricsFor(EventEnvelope envelope);

    protected record SigningMetric(String name, double value, String unit) {

        static SigningMetric count(String name, double value) {
            return new SigningMetric(name, value, UNIT_COUNT);
        }
    }
}
