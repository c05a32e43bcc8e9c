package personal.ai.reporting.event.domain.model;

/**
 * 메시지 소스에서 수신한 메시지
 *
 * @param messageId     메시지 ID (로그용)
 * @param body          원본 본문
 * @param receiptHandle 삭제(확인)에 사용하는 수신 핸들
 */
public record InboundMessage(
        String messageId,
        String body,
        String receiptHandle) {
}
