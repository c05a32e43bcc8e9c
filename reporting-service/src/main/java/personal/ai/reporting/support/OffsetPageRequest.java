package personal.ai.reporting.support;

import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.util.Assert;

import java.util.Objects;

/**
 * offset/limit 파라미터를 Spring Data Pageable로 변환
 * offset이 limit의 배수가 아니어도 정확한 위치부터 조회
 * <p>
 * 페이지 이동(next, previous, withPage)은 limit 단위로 offset을 옮김
 */
public final class OffsetPageRequest implements Pageable {

    private final int limit;
    private final long offset;
    private final Sort sort;

    private OffsetPageRequest(int limit, long offset, Sort sort) {
        Assert.isTrue(limit > 0, "Limit must be greater than zero");
        Assert.isTrue(offset >= 0, "Offset must not be negative");
        Assert.notNull(sort, "Sort must not be null");
        this.limit = limit;
        this.offset = offset;
        this.sort = sort;
    }

    public static OffsetPageRequest of(int limit, long offset, Sort sort) {
        return new OffsetPageRequest(limit, offset, sort);
    }

    @Override
    public int getPageNumber() {
        return (int) (offset / limit);
    }

    @Override
    public int getPageSize() {
        return limit;
    }

    @Override
    public long getOffset() {
        return offset;
    }

    @Override
    public Sort getSort() {
        return sort;
    }

    @Override
    public Pageable next() {
        return new OffsetPageRequest(limit, offset + limit, sort);
    }

    @Override
    public Pageable previousOrFirst() {
        return hasPrevious() ? new OffsetPageRequest(limit, Math.max(0, offset - limit), sort) : first();
    }

    @Override
    public Pageable first() {
        return new OffsetPageRequest(limit, 0, sort);
    }

    @Override
    public Pageable withPage(int pageNumber) {
        Assert.isTrue(pageNumber >= 0, "Page number must not be negative");
        // 페이지 경계에 맞지 않는 시작 위치는 유지
        long remainder = offset % limit;
        return new OffsetPageRequest(limit, (long) pageNumber * limit + remainder, sort);
    }

    @Override
    public boolean hasPrevious() {
        return offset > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof OffsetPageRequest that)) {
            return false;
        }
        return limit == that.limit && offset == that.offset && sort.equals(that.sort);
    }

    @Override
    public int hashCode() {
        return Objects.hash(limit, offset, sort);
    }

    @Override
    public String toString() {
        return "OffsetPageRequest[limit=" + limit + ", offset=" + offset + ", sort=" + sort + "]";
    }
}
