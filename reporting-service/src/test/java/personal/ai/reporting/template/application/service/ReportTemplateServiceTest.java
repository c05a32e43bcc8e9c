package personal.ai.reporting.template.application.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.ai.reporting.template.application.port.in.CreateTemplateCommand;
import personal.ai.reporting.template.application.port.out.ReportTemplateRepository;
import personal.ai.reporting.template.domain.exception.TemplateAlreadyExistsException;
import personal.ai.reporting.template.domain.exception.TemplateNotFoundException;
import personal.ai.reporting.template.domain.model.ReportTemplate;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("ReportTemplateService 단위 테스트")
class ReportTemplateServiceTest {

    private static final Long TEMPLATE_ID = 1L;

    @Mock
    private ReportTemplateRepository reportTemplateRepository;
    @InjectMocks
    private ReportTemplateService reportTemplateService;

    @Test
    @DisplayName("템플릿 생성 성공 - 내보내기 형식 미지정 시 기본값")
    void createTemplate_Success() {
        // given
        given(reportTemplateRepository.existsByName("Monthly Sales")).willReturn(false);
        willAnswer(invocation -> invocation.getArgument(0))
                .given(reportTemplateRepository).save(any(ReportTemplate.class));
        CreateTemplateCommand command = new CreateTemplateCommand(
                "Monthly Sales", "sales", "desc", List.of("summary", "charts"), null, false);

        // when
        ReportTemplate created = reportTemplateService.createTemplate(command);

        // then
        assertThat(created.name()).isEqualTo("Monthly Sales");
        assertThat(created.active()).isTrue();
        assertThat(created.sections()).containsExactly("summary", "charts");
        assertThat(created.exportFormats()).containsExactly("pdf", "csv", "json");
    }

    @Test
    @DisplayName("템플릿 생성 실패 - 이름 중복")
    void createTemplate_DuplicateName() {
        // given
        given(reportTemplateRepository.existsByName("Monthly Sales")).willReturn(true);
        CreateTemplateCommand command = new CreateTemplateCommand(
                "Monthly Sales", "sales", null, null, null, false);

        // when & then
        assertThatThrownBy(() -> reportTemplateService.createTemplate(command))
                .isInstanceOf(TemplateAlreadyExistsException.class);
        verify(reportTemplateRepository, never()).save(any());
    }

    @Test
    @DisplayName("템플릿 조회 실패 - 없음")
    void getTemplate_NotFound() {
        // given
        given(reportTemplateRepository.findById(TEMPLATE_ID)).willReturn(Optional.empty());

        // when & then
        assertThatThrownBy(() -> reportTemplateService.getTemplate(TEMPLATE_ID))
                .isInstanceOf(TemplateNotFoundException.class);
    }

    @Test
    @DisplayName("이름으로 템플릿 조회")
    void findTemplateByName() {
        // given
        ReportTemplate template = new ReportTemplate(TEMPLATE_ID, "Contract Signing Report", "contracts",
                null, null, null, false, true, null, null);
        given(reportTemplateRepository.findByName("Contract Signing Report")).willReturn(Optional.of(template));

        // when
        Optional<ReportTemplate> result = reportTemplateService.findTemplateByName("Contract Signing Report");

        // then
        assertThat(result).contains(template);
    }
}
