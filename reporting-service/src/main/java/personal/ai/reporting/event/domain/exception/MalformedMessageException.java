package personal.ai.reporting.event.domain.exception;

/**
 * 메시지 본문이 JSON 객체가 아니거나 파싱할 수 없을 때
 * 메시지는 확인(삭제)되지 않고 재전달됨
 */
public class MalformedMessageException extends RuntimeException {

    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
