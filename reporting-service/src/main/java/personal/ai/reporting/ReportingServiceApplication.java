package personal.ai.reporting;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Reporting Service Application
 * 리포트 템플릿, 리포트, 정기 스케줄, 내보내기, 지표, 접근 로그와 계약 서명 이벤트 소비를 담당
 */
@EnableScheduling  // 스케줄 자동 실행 활성화
@ConfigurationPropertiesScan
@SpringBootApplication(
    scanBasePackages = {
        "personal.ai.reporting",
        "personal.ai.common"  // common 모듈의 GlobalExceptionHandler 등을 스캔
    }
)
public class ReportingServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(ReportingServiceApplication.class, args);
    }
}
