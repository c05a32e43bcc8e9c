package personal.ai.reporting.schedule.adapter.in.web;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import personal.ai.common.dto.PageResponse;
import personal.ai.reporting.schedule.application.port.in.CreateScheduleCommand;
import personal.ai.reporting.schedule.application.port.in.CreateScheduleUseCase;
import personal.ai.reporting.schedule.application.port.in.GetScheduleUseCase;
import personal.ai.reporting.schedule.application.port.in.RecordScheduleExecutionUseCase;
import personal.ai.reporting.schedule.domain.exception.ScheduleNotFoundException;
import personal.ai.reporting.schedule.domain.model.Schedule;
import personal.ai.reporting.schedule.domain.model.TimeOfDay;
import personal.ai.reporting.template.domain.exception.TemplateNotFoundException;

import java.time.LocalDateTime;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ScheduleController.class)
@DisplayName("Schedule API 단위 테스트")
class ScheduleControllerTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 1, 1, 9, 0);

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CreateScheduleUseCase createScheduleUseCase;
    @MockBean
    private GetScheduleUseCase getScheduleUseCase;
    @MockBean
    private RecordScheduleExecutionUseCase recordScheduleExecutionUseCase;

    private Schedule schedule(int runs, int successes, int failures) {
        return new Schedule(7L, 1L, 10L, "Daily sales", "daily", new TimeOfDay(8, 0),
                null, null, "UTC", true, NOW.plusHours(23), null, runs, successes, failures,
                null, NOW, NOW);
    }

    @Test
    @DisplayName("스케줄 생성 - 201 Created")
    void createSchedule_Created() throws Exception {
        // given
        given(createScheduleUseCase.createSchedule(any(CreateScheduleCommand.class))).willReturn(schedule(0, 0, 0));

        // when & then
        mockMvc.perform(post("/api/v1/schedules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"userId":1,"templateId":10,"scheduleName":"Daily sales",
                                 "frequency":"daily","timeOfDay":"08:00","recipients":["ops@example.com"]}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(7))
                .andExpect(jsonPath("$.scheduleName").value("Daily sales"))
                .andExpect(jsonPath("$.timeOfDay").value("08:00"))
                .andExpect(jsonPath("$.runCount").value(0));
    }

    @Test
    @DisplayName("스케줄 생성 실패 - 필수 값 누락 시 400")
    void createSchedule_MissingFields() throws Exception {
        mockMvc.perform(post("/api/v1/schedules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":1,\"frequency\":\"daily\",\"timeOfDay\":\"08:00\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("C001"));
        verifyNoInteractions(createScheduleUseCase);
    }

    @Test
    @DisplayName("스케줄 생성 실패 - 템플릿 없음 404")
    void createSchedule_TemplateNotFound() throws Exception {
        // given
        given(createScheduleUseCase.createSchedule(any(CreateScheduleCommand.class)))
                .willThrow(new TemplateNotFoundException(10L));

        // when & then
        mockMvc.perform(post("/api/v1/schedules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"userId":1,"templateId":10,"scheduleName":"Daily sales",
                                 "frequency":"daily","timeOfDay":"08:00"}
                                """))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("T001"));
    }

    @Test
    @DisplayName("실행 대상 스케줄 조회")
    void getDueSchedules() throws Exception {
        // given
        given(getScheduleUseCase.dueSchedules()).willReturn(List.of(schedule(1, 1, 0), schedule(2, 1, 1)));

        // when & then
        mockMvc.perform(get("/api/v1/schedules/due"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.items.length()").value(2));
    }

    @Test
    @DisplayName("사용자 스케줄 조회 - 기본 페이지 값")
    void getUserSchedules_DefaultPaging() throws Exception {
        // given
        given(getScheduleUseCase.getUserSchedules(1L, 100, 0))
                .willReturn(new PageResponse<>(List.of(schedule(0, 0, 0)), 1, 100, 0));

        // when & then
        mockMvc.perform(get("/api/v1/schedules/user/1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.limit").value(100))
                .andExpect(jsonPath("$.items[0].frequency").value("daily"));
    }

    @Test
    @DisplayName("사용자 스케줄 조회 실패 - limit 범위 초과 시 400")
    void getUserSchedules_LimitOutOfRange() throws Exception {
        mockMvc.perform(get("/api/v1/schedules/user/1").param("limit", "1001"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(getScheduleUseCase);
    }

    @Test
    @DisplayName("실행 결과 기록 - 실패")
    void recordExecution_Failure() throws Exception {
        // given
        given(recordScheduleExecutionUseCase.recordExecution(7L, false)).willReturn(schedule(3, 2, 1));

        // when & then
        mockMvc.perform(patch("/api/v1/schedules/7/execute").param("success", "false"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.runCount").value(3))
                .andExpect(jsonPath("$.failureCount").value(1));
    }

    @Test
    @DisplayName("실행 결과 기록 실패 - 스케줄 없음 404")
    void recordExecution_NotFound() throws Exception {
        // given
        given(recordScheduleExecutionUseCase.recordExecution(99L, true))
                .willThrow(new ScheduleNotFoundException(99L));

        // when & then
        mockMvc.perform(patch("/api/v1/schedules/99/execute"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("S001"));
    }
}
