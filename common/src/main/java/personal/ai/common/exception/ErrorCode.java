package personal.ai.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드 정의
 * HTTP Status Code와 메시지를 함께 관리
 */
public enum ErrorCode {
    // Common (Cxxx)
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "C001", "잘못된 입력값입니다."),
    NOT_FOUND(HttpStatus.NOT_FOUND, "C004", "요청한 리소스를 찾을 수 없습니다."),
    CONFLICT(HttpStatus.CONFLICT, "C005", "리소스 충돌이 발생했습니다."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C006", "서버 내부 오류가 발생했습니다."),

    // Template Domain (Txxx)
    TEMPLATE_NOT_FOUND(HttpStatus.NOT_FOUND, "T001", "보고서 템플릿을 찾을 수 없습니다."),
    TEMPLATE_ALREADY_EXISTS(HttpStatus.CONFLICT, "T002", "이미 존재하는 템플릿 이름입니다."),

    // Report Domain (Rxxx)
    REPORT_NOT_FOUND(HttpStatus.NOT_FOUND, "R001", "보고서를 찾을 수 없습니다."),
    INVALID_DATE_RANGE(HttpStatus.BAD_REQUEST, "R002", "조회 기간이 올바르지 않습니다."),

    // Schedule Domain (Sxxx)
    SCHEDULE_NOT_FOUND(HttpStatus.NOT_FOUND, "S001", "보고서 스케줄을 찾을 수 없습니다."),
    INVALID_TIME_OF_DAY(HttpStatus.BAD_REQUEST, "S002", "실행 시각은 HH:MM 형식이어야 합니다."),

    // Export Domain (Xxxx)
    EXPORT_NOT_FOUND(HttpStatus.NOT_FOUND, "X001", "내보내기 정보를 찾을 수 없습니다."),

    // External Service (Exxx)
    EXTERNAL_SERVICE_ERROR(HttpStatus.SERVICE_UNAVAILABLE, "E001", "외부 서비스 오류가 발생했습니다.");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus httpStatus, String code, String message) {
        this.httpStatus = httpStatus;
        this.code = code;
        this.message = message;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
