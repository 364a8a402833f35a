package com.ryuqq.batchqueue.core.model;

/**
 * 레코드 생성 입력.
 *
 * <p>id가 주어지면 그 id를 채택하고(충돌 시 conflict), 없으면 store가 다음 id를 할당합니다.
 * name 누락은 핸들러에서 validation error로 거부됩니다.</p>
 *
 * @param id 희망 ID (null 허용)
 * @param name 이름
 * @param description 설명 (null 허용)
 * @param category 카테고리 (null 허용)
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
public record NewRecord(Long id, String name, String description, String category) implements OperationPayload {

    /**
     * ID 없이 생성.
     *
     * @param name 이름
     * @param description 설명
     * @param category 카테고리
     * @return NewRecord
     */
    public static NewRecord withoutId(String name, String description, String category) {
        return new NewRecord(null, name, description, category);
    }

    /**
     * 희망 ID가 있는지 확인.
     *
     * @return id가 non-null이면 true
     */
    public boolean hasId() {
        return id != null;
    }

    /**
     * store에 전달할 필드 묶음으로 변환 (null은 빈 문자열).
     *
     * @return RecordFields
     */
    public RecordFields toFields() {
        return new RecordFields(
            name == null ? "" : name,
            description == null ? "" : description,
            category == null ? "" : category
        );
    }
}
