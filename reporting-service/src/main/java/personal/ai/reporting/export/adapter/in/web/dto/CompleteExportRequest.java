package personal.ai.reporting.export.adapter.in.web.dto;

import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

/**
 * 내보내기 완료 요청 DTO
 */
public record CompleteExportRequest(
        @PositiveOrZero(message = "파일 크기는 0 이상이어야 합니다.")
        Long fileSize,

        @Size(max = 100, message = "파일 해시는 100자 이하여야 합니다.")
        String fileHash
) {
}
