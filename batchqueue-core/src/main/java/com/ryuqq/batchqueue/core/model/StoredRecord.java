package com.ryuqq.batchqueue.core.model;

import java.time.Instant;
import java.util.Locale;

/**
 * Store에 저장된 레코드.
 *
 * @param id 레코드 ID
 * @param name 이름
 * @param description 설명
 * @param category 카테고리
 * @param createdAt 생성 시각
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
public record StoredRecord(long id, String name, String description, String category, Instant createdAt) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null인 경우
     */
    public StoredRecord {
        if (name == null || description == null || category == null || createdAt == null) {
            throw new IllegalArgumentException("All fields are required for StoredRecord");
        }
    }

    /**
     * 필드와 ID로 레코드 생성.
     *
     * @param id 레코드 ID
     * @param fields 입력 필드
     * @param createdAt 생성 시각
     * @return StoredRecord
     */
    public static StoredRecord of(long id, RecordFields fields, Instant createdAt) {
        return new StoredRecord(id, fields.name(), fields.description(), fields.category(), createdAt);
    }

    /**
     * name/description/category 중 하나라도 필터를 포함하는지 확인 (대소문자 무시).
     *
     * @param lowerCaseFilter 소문자로 정규화된 필터
     * @return 포함하면 true (빈 필터는 항상 true)
     */
    public boolean matches(String lowerCaseFilter) {
        if (lowerCaseFilter.isEmpty()) {
            return true;
        }
        return name.toLowerCase(Locale.ROOT).contains(lowerCaseFilter)
            || description.toLowerCase(Locale.ROOT).contains(lowerCaseFilter)
            || category.toLowerCase(Locale.ROOT).contains(lowerCaseFilter);
    }
}
