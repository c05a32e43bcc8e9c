package personal.ai.reporting.support;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("OffsetPageRequest 단위 테스트")
class OffsetPageRequestTest {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "createdAt");

    @Test
    @DisplayName("limit의 배수가 아닌 offset도 그대로 사용")
    void of_KeepsExactOffset() {
        // when
        Pageable pageable = OffsetPageRequest.of(10, 15, NEWEST_FIRST);

        // then
        assertThat(pageable.getOffset()).isEqualTo(15);
        assertThat(pageable.getPageSize()).isEqualTo(10);
        assertThat(pageable.getPageNumber()).isEqualTo(1);
        assertThat(pageable.getSort()).isEqualTo(NEWEST_FIRST);
    }

    @Test
    @DisplayName("페이지 이동 시 offset 유지")
    void navigation_PreservesOffset() {
        // given
        Pageable pageable = OffsetPageRequest.of(10, 15, NEWEST_FIRST);

        // when & then
        assertThat(pageable.next().getOffset()).isEqualTo(25);
        assertThat(pageable.previousOrFirst().getOffset()).isEqualTo(5);
        assertThat(pageable.first().getOffset()).isZero();
        assertThat(pageable.withPage(3).getOffset()).isEqualTo(35);
        assertThat(OffsetPageRequest.of(10, 0, NEWEST_FIRST).hasPrevious()).isFalse();
    }

    @Test
    @DisplayName("offset이 다르면 서로 다른 요청")
    void equality_IncludesOffset() {
        assertThat(OffsetPageRequest.of(10, 15, NEWEST_FIRST))
                .isEqualTo(OffsetPageRequest.of(10, 15, NEWEST_FIRST))
                .hasSameHashCodeAs(OffsetPageRequest.of(10, 15, NEWEST_FIRST))
                .isNotEqualTo(OffsetPageRequest.of(10, 10, NEWEST_FIRST));
    }

    @Test
    @DisplayName("limit이 0이면 예외")
    void of_ZeroLimit() {
        assertThatThrownBy(() -> OffsetPageRequest.of(0, 0, NEWEST_FIRST))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
