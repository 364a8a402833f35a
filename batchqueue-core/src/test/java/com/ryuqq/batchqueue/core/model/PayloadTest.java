package com.ryuqq.batchqueue.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * payload 값 객체와 Action 테이블 테스트.
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
class PayloadTest {

    @Test
    void Action은_클래스와_payload_타입을_고정으로_가짐() {
        assertThat(Action.FETCH_PAGE.operationClass()).isEqualTo(OperationClass.READ);
        assertThat(Action.FETCH_SELECTION.operationClass().isRead()).isTrue();
        assertThat(Action.CREATE_RECORD.operationClass()).isEqualTo(OperationClass.WRITE);
        assertThat(Action.REORDER_SELECTION.payloadType()).isEqualTo(IdList.class);

        assertThat(Action.FETCH_PAGE.accepts(PageQuery.of(0, 10))).isTrue();
        assertThat(Action.FETCH_PAGE.accepts(IdList.of(1))).isFalse();
    }

    @Test
    void 페이지_조회는_음수_offset과_0_이하_limit을_거부함() {
        assertThatThrownBy(() -> new PageQuery(-1, 10, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("offset");
        assertThatThrownBy(() -> new SelectionQuery(0, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("limit");
    }

    @Test
    void IdList는_null_원소를_거부하고_입력을_복사함() {
        // given
        List<Long> source = new ArrayList<>(List.of(1L, 2L));
        IdList ids = new IdList(source);

        // when
        source.add(3L);

        // then
        assertThat(ids.ids()).containsExactly(1L, 2L);
        assertThatThrownBy(() -> new IdList(Arrays.asList(1L, null)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(new IdList(List.of()).isEmpty()).isTrue();
    }

    @Test
    void NewRecord_빈_필드는_빈_문자열로_변환됨() {
        // when
        RecordFields fields = NewRecord.withoutId("Name", null, null).toFields();

        // then
        assertThat(fields).isEqualTo(new RecordFields("Name", "", ""));
        assertThat(new NewRecord(3L, "n", null, null).hasId()).isTrue();
    }

    @Test
    void PageLimits_최대값을_넘는_요청만_잘라냄() {
        PageLimits limits = new PageLimits();

        assertThat(limits.defaultLimit()).isEqualTo(10);
        assertThat(limits.clamp(50)).isEqualTo(50);
        assertThat(limits.clamp(500)).isEqualTo(100);
        assertThatThrownBy(() -> new PageLimits(10, 5)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void StoredRecord_필터는_세_필드_중_하나에_포함되면_일치함() {
        StoredRecord record = new StoredRecord(7L, "Item 7", "Description for item 7", "Category 1", Instant.EPOCH);

        assertThat(record.matches("")).isTrue();
        assertThat(record.matches("item 7")).isTrue();
        assertThat(record.matches("category 1")).isTrue();
        assertThat(record.matches("description for")).isTrue();
        assertThat(record.matches("item 8")).isFalse();
    }
}
