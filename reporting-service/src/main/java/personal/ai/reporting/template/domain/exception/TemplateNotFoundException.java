package personal.ai.reporting.template.domain.exception;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

/**
 * Template Not Found Exception
 * 템플릿이 없거나 삭제된 경우 발생
 */
public class TemplateNotFoundException extends BusinessException {
    public TemplateNotFoundException(Long templateId) {
        super(ErrorCode.TEMPLATE_NOT_FOUND,
                String.format("Report template not found: templateId=%d", templateId));
    }
}
