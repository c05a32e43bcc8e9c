package personal.ai.reporting.event.domain.model;

import java.util.Arrays;

/**
 * 전자계약 서명 이벤트 유형
 * 알 수 없는 유형(누락 포함)은 UNRECOGNIZED
 */
public enum ContractSigningEventType {
    SIGNING_REQUESTED("contract.signing.requested"),
    SIGNING_PARTIALLY_SIGNED("contract.signing.partially_signed"),
    SIGNING_COMPLETED("contract.signing.completed"),
    SIGNING_CANCELED("contract.signing.canceled"),
    SIGNING_FAILED("contract.signing.failed"),
    UNRECOGNIZED(null);

    private final String wireValue;

    ContractSigningEventType(String wireValue) {
        this.wireValue = wireValue;
    }

    public static ContractSigningEventType fromWireValue(String value) {
        if (value == null) {
            return UNRECOGNIZED;
        }
        return Arrays.stream(values())
                .filter(type -> value.equals(type.wireValue))
                .findFirst()
                .orElse(UNRECOGNIZED);
    }

    public String getWireValue() {
        return wireValue;
    }
}
