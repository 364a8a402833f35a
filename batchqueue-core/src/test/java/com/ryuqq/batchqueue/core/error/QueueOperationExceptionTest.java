package com.ryuqq.batchqueue.core.error;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 오류 분류 테스트.
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
class QueueOperationExceptionTest {

    @Test
    void 오류_코드는_HTTP_상태에_대응함() {
        assertThat(ErrorCode.VALIDATION.httpStatus()).isEqualTo(400);
        assertThat(ErrorCode.NOT_FOUND.httpStatus()).isEqualTo(404);
        assertThat(ErrorCode.CONFLICT.httpStatus()).isEqualTo(409);
        assertThat(ErrorCode.INTERNAL.httpStatus()).isEqualTo(500);
    }

    @Test
    void NotFoundException은_없는_ID를_모두_나열함() {
        // when
        NotFoundException e = new NotFoundException("Records not found", List.of(999L, 1000L));

        // then
        assertThat(e.errorCode()).isEqualTo(ErrorCode.NOT_FOUND);
        assertThat(e.getMessage()).isEqualTo("Records not found");
        assertThat(e.details()).isEqualTo("The following IDs do not exist: 999, 1000");
        assertThat(e.missingIds()).containsExactly(999L, 1000L);
    }

    @Test
    void ConflictException은_충돌한_ID를_담음() {
        // when
        ConflictException e = new ConflictException(5L);

        // then
        assertThat(e.errorCode()).isEqualTo(ErrorCode.CONFLICT);
        assertThat(e.conflictingId()).isEqualTo(5L);
        assertThat(e.details()).isEqualTo("Record with ID 5 already exists");
    }

    @Test
    void InternalOperationException은_원인을_보존함() {
        // given
        IllegalStateException cause = new IllegalStateException("boom");

        // when
        InternalOperationException e = new InternalOperationException("failed", cause);

        // then
        assertThat(e.errorCode()).isEqualTo(ErrorCode.INTERNAL);
        assertThat(e.getCause()).isSameAs(cause);
        assertThat(new InternalOperationException("queue shut down").getCause()).isNull();
    }

    @Test
    void ValidationException은_상세_메시지를_가짐() {
        ValidationException e = new ValidationException("Invalid input", "ids array cannot be empty");

        assertThat(e.errorCode()).isEqualTo(ErrorCode.VALIDATION);
        assertThat(e.details()).isEqualTo("ids array cannot be empty");
    }
}
