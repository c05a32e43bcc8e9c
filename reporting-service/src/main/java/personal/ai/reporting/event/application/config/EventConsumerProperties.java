package personal.ai.reporting.event.application.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 계약 이벤트 소비 설정 Properties
 * application.yml의 reporting.events.* 설정을 바인딩
 *
 * @param queueUrl           SQS 큐 URL (비어 있으면 소비 비활성화)
 * @param region             AWS 리전
 * @param endpoint           엔드포인트 재정의 (로컬 SQS 호환 서버 등)
 * @param maxMessages        한 번에 수신할 최대 메시지 수 (1~10)
 * @param waitTimeSeconds    롱 폴링 대기 시간 (0~20)
 * @param anchorTemplateName 이벤트 지표를 연결할 템플릿 이름
 * @param idleBackoffMs      빈 응답 또는 수신 실패 후 다음 폴링까지 대기 시간
 */
@ConfigurationProperties(prefix = "reporting.events")
public record EventConsumerProperties(
        String queueUrl,
        String region,
        String endpoint,
        int maxMessages,
        int waitTimeSeconds,
        String anchorTemplateName,
        long idleBackoffMs
) {
    public static final String DEFAULT_ANCHOR_TEMPLATE_NAME = "Contract Signing Report";

    public EventConsumerProperties {
        if (region == null || region.isBlank()) {
            region = "us-east-1";
        }
        if (maxMessages <= 0 || maxMessages > 10) {
            maxMessages = 10;
        }
        if (waitTimeSeconds < 0 || waitTimeSeconds > 20) {
            waitTimeSeconds = 20;
        }
        if (anchorTemplateName == null || anchorTemplateName.isBlank()) {
            anchorTemplateName = DEFAULT_ANCHOR_TEMPLATE_NAME;
        }
        if (idleBackoffMs <= 0) {
            idleBackoffMs = 1000L;
        }
    }

    public boolean isConsumerEnabled() {
        return queueUrl != null && !queueUrl.isBlank();
    }
}
