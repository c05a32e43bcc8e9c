package personal.ai.reporting.event.domain.model;

/**
 * 한 번의 폴링 결과
 *
 * @param received     수신한 메시지 수
 * @param acknowledged 처리 후 삭제한 메시지 수
 * @param failed       처리 실패로 남겨둔 메시지 수
 */
public record PollResult(int received, int acknowledged, int failed) {

    public static PollResult empty() {
        return new PollResult(0, 0, 0);
    }
}
