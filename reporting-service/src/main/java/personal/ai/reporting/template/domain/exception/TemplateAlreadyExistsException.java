package personal.ai.reporting.template.domain.exception;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

/**
 * Template Already Exists Exception
 * 템플릿 이름은 유일해야 함
 */
public class TemplateAlreadyExistsException extends BusinessException {
    public TemplateAlreadyExistsException(String templateName) {
        super(ErrorCode.TEMPLATE_ALREADY_EXISTS,
                String.format("Report template already exists: name=%s", templateName));
    }
}
