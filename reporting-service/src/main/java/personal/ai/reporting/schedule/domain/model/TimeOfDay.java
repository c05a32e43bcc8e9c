package personal.ai.reporting.schedule.domain.model;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

import java.time.LocalTime;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Time Of Day Value Object
 * "HH:MM" 형식의 실행 시각 (초 단위 없음)
 */
public record TimeOfDay(int hour, int minute) {

    private static final Pattern FORMAT = Pattern.compile("^(\\d{1,2}):(\\d{2})$");

    public TimeOfDay {
        if (hour < 0 || hour > 23) {
            throw new BusinessException(ErrorCode.INVALID_TIME_OF_DAY, "Hour must be between 0 and 23: " + hour);
        }
        if (minute < 0 || minute > 59) {
            throw new BusinessException(ErrorCode.INVALID_TIME_OF_DAY, "Minute must be between 0 and 59: " + minute);
        }
    }

    /**
     * "H:MM" 또는 "HH:MM" 문자열 파싱
     *
     * @throws BusinessException INVALID_TIME_OF_DAY - 형식 또는 범위가 잘못된 경우
     */
    public static TimeOfDay parse(String value) {
        if (value == null) {
            throw new BusinessException(ErrorCode.INVALID_TIME_OF_DAY, "Time of day cannot be null");
        }
        Matcher matcher = FORMAT.matcher(value.trim());
        if (!matcher.matches()) {
            throw new BusinessException(ErrorCode.INVALID_TIME_OF_DAY, "Time of day must be HH:MM: " + value);
        }
        return new TimeOfDay(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)));
    }

    public LocalTime toLocalTime() {
        return LocalTime.of(hour, minute);
    }

    /**
     * 두 자리로 정규화된 "HH:MM"
     */
    public String format() {
        return String.format("%02d:%02d", hour, minute);
    }

    @Override
    public String toString() {
        return format();
    }
}
