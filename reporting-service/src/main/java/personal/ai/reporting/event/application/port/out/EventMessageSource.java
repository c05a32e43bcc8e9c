package personal.ai.reporting.event.application.port.out;

import personal.ai.reporting.event.domain.model.InboundMessage;

import java.util.List;

/**
 * Event Message Source (Output Port)
 * 확인(acknowledge)하지 않은 메시지는 가시성 제한 시간이 지나면 다시 수신됨
 */
public interface EventMessageSource {

    /**
     * 메시지 수신 (롱 폴링)
     *
     * @param maxMessages     최대 수신 개수
     * @param waitTimeSeconds 메시지가 없을 때 대기할 최대 시간
     */
    List<InboundMessage> receive(int maxMessages, int waitTimeSeconds);

    /**
     * 처리 완료된 메시지 삭제
     */
    void acknowledge(InboundMessage message);
}
