package personal.ai.reporting.export.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import personal.ai.reporting.export.application.port.in.CreateExportCommand;

/**
 * 내보내기 생성 요청 DTO
 */
public record CreateExportRequest(
        @NotNull(message = "보고서 ID는 필수입니다.")
        Long reportId,

        @NotBlank(message = "내보내기 형식은 필수입니다.")
        @Size(max = 20, message = "내보내기 형식은 20자 이하여야 합니다.")
        String exportFormat,

        @NotBlank(message = "파일 경로는 필수입니다.")
        @Size(max = 500, message = "파일 경로는 500자 이하여야 합니다.")
        String filePath,

        @PositiveOrZero(message = "파일 크기는 0 이상이어야 합니다.")
        Long fileSize
) {
    public CreateExportCommand toCommand() {
        return new CreateExportCommand(reportId, exportFormat, filePath, fileSize);
    }
}
