package personal.ai.reporting.schedule.domain.model;

import java.util.List;

/**
 * 생성된 보고서의 전달 방법
 * 스케줄 엔진은 내용을 해석하지 않으며, 실행 시 전달 의도만 기록
 *
 * @param method      email, download, webhook
 * @param recipients  수신자 이메일 목록
 * @param webhookUrl  webhook 전달 시 대상 URL
 * @param includeFile 보고서 파일 첨부 여부
 */
public record DeliveryTarget(
        String method,
        List<String> recipients,
        String webhookUrl,
        boolean includeFile) {

    public static final String DEFAULT_METHOD = "email";

    public DeliveryTarget {
        method = method == null || method.isBlank() ? DEFAULT_METHOD : method;
        recipients = recipients == null ? List.of() : List.copyOf(recipients);
    }
}
