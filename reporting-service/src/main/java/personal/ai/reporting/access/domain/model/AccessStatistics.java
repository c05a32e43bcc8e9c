package personal.ai.reporting.access.domain.model;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * 보고서 접근 통계
 *
 * @param totalAccesses 전체 접근 수
 * @param successful    accessStatus가 success인 접근 수
 * @param failed        그 외 접근 수
 * @param byType        접근 유형별 건수
 * @param uniqueUsers   서로 다른 사용자 수
 */
public record AccessStatistics(
        long totalAccesses,
        long successful,
        long failed,
        Map<String, Long> byType,
        long uniqueUsers) {

    public static AccessStatistics of(List<AccessLog> logs) {
        long successful = logs.stream().filter(AccessLog::isSuccessful).count();
        Map<String, Long> byType = logs.stream()
                .collect(Collectors.groupingBy(AccessLog::accessType, TreeMap::new, Collectors.counting()));
        long uniqueUsers = logs.stream().map(AccessLog::userId).distinct().count();

        return new AccessStatistics(logs.size(), successful, logs.size() - successful, byType, uniqueUsers);
    }
}
