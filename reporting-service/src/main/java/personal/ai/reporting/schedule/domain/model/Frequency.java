package personal.ai.reporting.schedule.domain.model;

import java.util.Arrays;

/**
 * 스케줄 반복 주기
 * 저장된 문자열과 소문자 키워드가 정확히 일치할 때만 해당 주기로 인식하며,
 * 그 외 값(quarterly, yearly, 대소문자가 다른 값 등)은 OTHER로 취급
 */
public enum Frequency {
    DAILY("daily"),
    WEEKLY("weekly"),
    MONTHLY("monthly"),
    OTHER(null);

    private final String keyword;

    Frequency(String keyword) {
        this.keyword = keyword;
    }

    public static Frequency from(String value) {
        return Arrays.stream(values())
                .filter(frequency -> frequency.keyword != null && frequency.keyword.equals(value))
                .findFirst()
                .orElse(OTHER);
    }

    public String getKeyword() {
        return keyword;
    }
}
