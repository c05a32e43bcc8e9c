package personal.ai.reporting.adapter.in.web;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import personal.ai.common.health.HealthCheckService;
import personal.ai.reporting.event.adapter.in.worker.EventConsumerWorker;

import javax.sql.DataSource;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Health Check Controller 단위 테스트
 * @WebMvcTest를 사용하여 컨트롤러 계층만 테스트
 */
@WebMvcTest(HealthCheckController.class)
@DisplayName("Reporting Service Health Check API 단위 테스트")
class HealthCheckControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DataSource dataSource;

    @MockBean
    private HealthCheckService healthCheckService;

    @MockBean
    private EventConsumerWorker eventConsumerWorker;

    @Test
    @DisplayName("모든 컴포넌트가 정상이면 success")
    void healthCheckReturnsSuccess() throws Exception {
        // Given: DB, Redis, 이벤트 소비 워커가 정상 동작 중
        given(healthCheckService.checkDatabase(any(DataSource.class))).willReturn("UP");
        given(healthCheckService.checkRedis()).willReturn("UP");
        given(eventConsumerWorker.isEnabled()).willReturn(true);
        given(eventConsumerWorker.isRunning()).willReturn(true);

        // When: 헬스 체크 엔드포인트를 호출하면
        mockMvc.perform(get("/api/v1/health")
                        .contentType(MediaType.APPLICATION_JSON))
                // Then: 200 OK와 함께 정상 응답을 반환한다
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.result").value("success"))
                .andExpect(jsonPath("$.data.database").value("UP"))
                .andExpect(jsonPath("$.data.redis").value("UP"))
                .andExpect(jsonPath("$.data.messageQueue").value("UP"));
    }

    @Test
    @DisplayName("이벤트 소비가 비활성화되어 있으면 DISABLED이며 unhealthy가 아님")
    void healthCheckWithConsumerDisabled() throws Exception {
        // Given: 큐 URL이 설정되지 않음
        given(healthCheckService.checkDatabase(any(DataSource.class))).willReturn("UP");
        given(healthCheckService.checkRedis()).willReturn("UP");
        given(eventConsumerWorker.isEnabled()).willReturn(false);

        // When & Then
        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result").value("success"))
                .andExpect(jsonPath("$.data.messageQueue").value("DISABLED"));
    }

    @Test
    @DisplayName("워커가 멈췄거나 DB가 내려가면 error")
    void healthCheckReportsUnhealthy() throws Exception {
        // Given: DB 장애, 워커 중지
        given(healthCheckService.checkDatabase(any(DataSource.class))).willReturn("DOWN");
        given(healthCheckService.checkRedis()).willReturn("UP");
        given(eventConsumerWorker.isEnabled()).willReturn(true);
        given(eventConsumerWorker.isRunning()).willReturn(false);

        // When & Then: 상태 코드는 200, 결과는 error
        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result").value("error"))
                .andExpect(jsonPath("$.data.database").value("DOWN"))
                .andExpect(jsonPath("$.data.messageQueue").value("DOWN"));
    }
}
