package personal.ai.reporting.event.adapter.out.sqs;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import personal.ai.reporting.event.application.port.out.EventMessageSource;
import personal.ai.reporting.event.domain.model.InboundMessage;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.DeleteMessageRequest;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;

import java.util.List;

/**
 * SQS Event Message Source
 * 수신은 롱 폴링, 확인은 receipt handle로 메시지 삭제
 */
@Slf4j
@RequiredArgsConstructor
public class SqsEventMessageSource implements EventMessageSource {

    private final SqsClient sqsClient;
    private final String queueUrl;

    @Override
    public List<InboundMessage> receive(int maxMessages, int waitTimeSeconds) {
        ReceiveMessageRequest request = ReceiveMessageRequest.builder()
                .queueUrl(queueUrl)
                .maxNumberOfMessages(maxMessages)
                .waitTimeSeconds(waitTimeSeconds)
                .messageAttributeNames("All")
                .build();

        return sqsClient.receiveMessage(request).messages().stream()
                .map(message -> new InboundMessage(message.messageId(), message.body(), message.receiptHandle()))
                .toList();
    }

    @Override
    public void acknowledge(InboundMessage message) {
        sqsClient.deleteMessage(DeleteMessageRequest.builder()
                .queueUrl(queueUrl)
                .receiptHandle(message.receiptHandle())
                .build());
        log.debug("SQS message deleted: messageId={}", message.messageId());
    }
}
