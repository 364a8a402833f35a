package com.ryuqq.batchqueue.core.model;

/**
 * 레코드의 사용자 입력 필드.
 *
 * @param name 이름
 * @param description 설명
 * @param category 카테고리
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
public record RecordFields(String name, String description, String category) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필드가 null인 경우
     */
    public RecordFields {
        if (name == null || description == null || category == null) {
            throw new IllegalArgumentException("All fields are required for RecordFields");
        }
    }
}
