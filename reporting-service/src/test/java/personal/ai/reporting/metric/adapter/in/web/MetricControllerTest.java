package personal.ai.reporting.metric.adapter.in.web;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import personal.ai.reporting.metric.application.port.in.GetMetricUseCase;
import personal.ai.reporting.metric.application.port.in.RecordMetricCommand;
import personal.ai.reporting.metric.application.port.in.RecordMetricUseCase;
import personal.ai.reporting.metric.domain.exception.MetricTargetNotFoundException;
import personal.ai.reporting.metric.domain.model.MetricStatistics;
import personal.ai.reporting.metric.domain.model.ReportMetric;

import java.time.LocalDateTime;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(MetricController.class)
@DisplayName("Metric API 단위 테스트")
class MetricControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RecordMetricUseCase recordMetricUseCase;
    @MockBean
    private GetMetricUseCase getMetricUseCase;

    @Test
    @DisplayName("지표 기록 - 201 Created")
    void recordMetric_Created() throws Exception {
        // given
        given(recordMetricUseCase.recordMetric(any(RecordMetricCommand.class))).willReturn(
                ReportMetric.create(100L, "generation_time", 12.345, "seconds", null,
                        LocalDateTime.of(2024, 1, 1, 0, 0)));

        // when & then
        mockMvc.perform(post("/api/v1/metrics")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"reportId":100,"metricName":"generation_time",
                                 "metricValue":12.345,"metricUnit":"seconds"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.metricValue").value(12.35))
                .andExpect(jsonPath("$.metricCategory").value("performance"));
    }

    @Test
    @DisplayName("지표 기록 실패 - 대상 없음 404")
    void recordMetric_TargetNotFound() throws Exception {
        // given
        given(recordMetricUseCase.recordMetric(any(RecordMetricCommand.class)))
                .willThrow(new MetricTargetNotFoundException(100L));

        // when & then
        mockMvc.perform(post("/api/v1/metrics")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"reportId":100,"metricName":"generation_time",
                                 "metricValue":1,"metricUnit":"seconds"}
                                """))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("기간 평균 조회")
    void getAverageMetrics() throws Exception {
        // given
        given(getMetricUseCase.getAverageMetrics("generation_time", 7))
                .willReturn(new MetricStatistics(20.0, 3, 10.0, 30.0));

        // when & then
        mockMvc.perform(get("/api/v1/metrics/average/generation_time").param("days", "7"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.metricName").value("generation_time"))
                .andExpect(jsonPath("$.periodDays").value(7))
                .andExpect(jsonPath("$.average").value(20.0))
                .andExpect(jsonPath("$.count").value(3));
    }

    @Test
    @DisplayName("기간 평균 조회 실패 - days 범위 초과 시 400")
    void getAverageMetrics_DaysOutOfRange() throws Exception {
        mockMvc.perform(get("/api/v1/metrics/average/generation_time").param("days", "366"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(getMetricUseCase);
    }
}
