package personal.ai.reporting.metric.application.port.in;

/**
 * 지표 기록 Command
 *
 * @param reportId 지표를 연결할 보고서 ID (이벤트 지표는 기준 템플릿 ID)
 * @param category null이면 performance
 */
public record RecordMetricCommand(
        Long reportId,
        String name,
        double value,
        String unit,
        String category
) {
}
