package personal.ai.reporting.event.adapter.out.sqs;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import personal.ai.reporting.event.application.config.EventConsumerProperties;
import personal.ai.reporting.event.application.port.out.EventMessageSource;
import personal.ai.reporting.event.application.service.EventIngestionLoop;
import personal.ai.reporting.event.domain.service.EventEnvelopeParser;
import personal.ai.reporting.event.domain.service.EventRouter;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.SqsClientBuilder;

import java.net.URI;

/**
 * SQS 이벤트 소비 구성
 * reporting.events.queue-url이 설정된 경우에만 활성화
 */
@Slf4j
@Configuration
@ConditionalOnExpression("'${reporting.events.queue-url:}' != ''")
public class SqsEventConsumerConfig {

    @Bean(destroyMethod = "close")
    public SqsClient sqsClient(EventConsumerProperties properties) {
        SqsClientBuilder builder = SqsClient.builder()
                .region(Region.of(properties.region()));
        if (properties.endpoint() != null && !properties.endpoint().isBlank()) {
            builder.endpointOverride(URI.create(properties.endpoint()));
        }
        log.info("Creating SQS client: region={}, endpointOverride={}",
                properties.region(), properties.endpoint() != null && !properties.endpoint().isBlank());
        return builder.build();
    }

    @Bean
    public EventMessageSource eventMessageSource(SqsClient sqsClient, EventConsumerProperties properties) {
        return new SqsEventMessageSource(sqsClient, properties.queueUrl());
    }

    @Bean
    public EventIngestionLoop eventIngestionLoop(EventMessageSource eventMessageSource,
                                                 EventEnvelopeParser eventEnvelopeParser,
                                                 EventRouter eventRouter,
                                                 EventConsumerProperties properties,
                                                 MeterRegistry meterRegistry) {
        return new EventIngestionLoop(eventMessageSource, eventEnvelopeParser, eventRouter,
                properties, meterRegistry);
    }
}
