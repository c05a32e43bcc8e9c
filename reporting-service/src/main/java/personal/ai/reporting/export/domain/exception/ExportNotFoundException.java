package personal.ai.reporting.export.domain.exception;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

/**
 * Export Not Found Exception
 */
public class ExportNotFoundException extends BusinessException {
    public ExportNotFoundException(Long exportId) {
        super(ErrorCode.EXPORT_NOT_FOUND,
                String.format("Export not found: exportId=%d", exportId));
    }
}
