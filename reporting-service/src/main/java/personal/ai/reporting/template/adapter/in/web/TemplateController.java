package personal.ai.reporting.template.adapter.in.web;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.ai.common.dto.PageResponse;
import personal.ai.reporting.template.adapter.in.web.dto.CreateTemplateRequest;
import personal.ai.reporting.template.adapter.in.web.dto.TemplateResponse;
import personal.ai.reporting.template.application.port.in.CreateTemplateUseCase;
import personal.ai.reporting.template.application.port.in.GetTemplateUseCase;
import personal.ai.reporting.template.domain.model.ReportTemplate;

/**
 * Report Template API Controller
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/templates")
@RequiredArgsConstructor
public class TemplateController {

    private final CreateTemplateUseCase createTemplateUseCase;
    private final GetTemplateUseCase getTemplateUseCase;

    /**
     * 템플릿 생성
     * POST /api/v1/templates
     */
    @PostMapping
    public ResponseEntity<TemplateResponse> createTemplate(@Valid @RequestBody CreateTemplateRequest request) {
        log.info("Create template: name={}, type={}", request.templateName(), request.templateType());

        ReportTemplate template = createTemplateUseCase.createTemplate(request.toCommand());

        return ResponseEntity.status(HttpStatus.CREATED).body(TemplateResponse.from(template));
    }

    /**
     * GET /api/v1/templates/{templateId}
     */
    @GetMapping("/{templateId}")
    public ResponseEntity<TemplateResponse> getTemplate(@PathVariable Long templateId) {
        return ResponseEntity.ok(TemplateResponse.from(getTemplateUseCase.getTemplate(templateId)));
    }

    /**
     * GET /api/v1/templates/type/{templateType}
     */
    @GetMapping("/type/{templateType}")
    public ResponseEntity<PageResponse<TemplateResponse>> getTemplatesByType(
            @PathVariable String templateType,
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit,
            @RequestParam(defaultValue = "0") @Min(0) int offset
    ) {
        PageResponse<ReportTemplate> page = getTemplateUseCase.getTemplatesByType(templateType, limit, offset);
        return ResponseEntity.ok(page.map(TemplateResponse::from));
    }

    /**
     * 활성 템플릿 목록
     * GET /api/v1/templates
     */
    @GetMapping
    public ResponseEntity<PageResponse<TemplateResponse>> listTemplates(
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit,
            @RequestParam(defaultValue = "0") @Min(0) int offset
    ) {
        PageResponse<ReportTemplate> page = getTemplateUseCase.listActiveTemplates(limit, offset);
        return ResponseEntity.ok(page.map(TemplateResponse::from));
    }
}
