package personal.ai.common.dto;

import java.util.List;
import java.util.function.Function;

/**
 * offset/limit 기반 목록 응답
 *
 * @param items  현재 페이지 항목
 * @param total  전체 건수
 * @param limit  요청한 최대 건수
 * @param offset 요청한 시작 위치
 */
public record PageResponse<T>(
        List<T> items,
        long total,
        int limit,
        int offset
) {
    public <R> PageResponse<R> map(Function<? super T, ? extends R> mapper) {
        List<R> mapped = items.stream()
                .<R>map(mapper)
                .toList();
        return new PageResponse<>(mapped, total, limit, offset);
    }
}
