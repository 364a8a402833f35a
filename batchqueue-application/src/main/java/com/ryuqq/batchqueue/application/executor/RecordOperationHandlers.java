package com.ryuqq.batchqueue.application.executor;

import com.ryuqq.batchqueue.core.error.ConflictException;
import com.ryuqq.batchqueue.core.error.NotFoundException;
import com.ryuqq.batchqueue.core.error.ValidationException;
import com.ryuqq.batchqueue.core.model.Action;
import com.ryuqq.batchqueue.core.model.IdList;
import com.ryuqq.batchqueue.core.model.NewRecord;
import com.ryuqq.batchqueue.core.model.OperationPayload;
import com.ryuqq.batchqueue.core.model.PageLimits;
import com.ryuqq.batchqueue.core.model.PageQuery;
import com.ryuqq.batchqueue.core.model.SelectionQuery;
import com.ryuqq.batchqueue.core.model.StoredRecord;
import com.ryuqq.batchqueue.core.result.CreatedRecord;
import com.ryuqq.batchqueue.core.result.OperationResult;
import com.ryuqq.batchqueue.core.result.PageInfo;
import com.ryuqq.batchqueue.core.result.RecordPage;
import com.ryuqq.batchqueue.core.result.RemovalResult;
import com.ryuqq.batchqueue.core.result.ReorderResult;
import com.ryuqq.batchqueue.core.result.SelectionAddResult;
import com.ryuqq.batchqueue.core.result.SelectionPage;
import com.ryuqq.batchqueue.core.spi.RecordStore;
import com.ryuqq.batchqueue.core.spi.SelectionAddition;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 6가지 도메인 액션 핸들러.
 *
 * <p>선택 목록 불변식(존재하는 레코드만 참조, 중복 없음)은 store 변경 전에 여기서 검증합니다.
 * 검증에 실패하면 store는 변경되지 않습니다.</p>
 *
 * <p><strong>동시성:</strong> WRITE 핸들러는 WRITE 배치 안에서 순차 실행되므로
 * 검증과 변경 사이에 다른 WRITE가 끼어들지 않습니다.</p>
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
public final class RecordOperationHandlers {

    private final RecordStore store;
    private final PageLimits pageLimits;

    /**
     * 생성자.
     *
     * @param store 레코드 저장소
     * @param pageLimits 페이지 크기 정책
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RecordOperationHandlers(RecordStore store, PageLimits pageLimits) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (pageLimits == null) {
            throw new IllegalArgumentException("pageLimits cannot be null");
        }
        this.store = store;
        this.pageLimits = pageLimits;
    }

    /**
     * 액션 분기 실행.
     *
     * @param action 액션
     * @param payload 액션별 입력 (READ는 null이면 기본 페이지)
     * @return 실행 결과
     * @throws ValidationException 입력이 잘못된 경우
     * @throws NotFoundException 참조 ID가 없는 경우
     * @throws ConflictException 생성 ID가 충돌하는 경우
     */
    public OperationResult handle(Action action, OperationPayload payload) {
        return switch (action) {
            case FETCH_PAGE -> fetchPage(payload == null
                ? PageQuery.of(0, pageLimits.defaultLimit())
                : cast(action, payload, PageQuery.class));
            case FETCH_SELECTION -> fetchSelection(payload == null
                ? new SelectionQuery(0, pageLimits.defaultLimit())
                : cast(action, payload, SelectionQuery.class));
            case ADD_TO_SELECTION -> addToSelection(cast(action, payload, IdList.class));
            case REORDER_SELECTION -> reorderSelection(cast(action, payload, IdList.class));
            case REMOVE_FROM_SELECTION -> removeFromSelection(cast(action, payload, IdList.class));
            case CREATE_RECORD -> createRecord(cast(action, payload, NewRecord.class));
        };
    }

    /**
     * 필터 + 페이지네이션 조회.
     *
     * <p>name/description/category 대소문자 무시 부분 일치. 일치 항목이 없으면 빈 페이지.</p>
     */
    RecordPage fetchPage(PageQuery query) {
        int limit = pageLimits.clamp(query.limit());
        String filter = query.normalizedFilter();

        List<StoredRecord> source = store.getAll();
        if (!filter.isEmpty()) {
            source = source.stream().filter(record -> record.matches(filter)).toList();
        }

        int total = source.size();
        return new RecordPage(slice(source, query.offset(), limit), PageInfo.of(query.offset(), limit, total));
    }

    /**
     * 선택 목록 페이지 조회 (전체 선택 ID 포함).
     */
    SelectionPage fetchSelection(SelectionQuery query) {
        int limit = pageLimits.clamp(query.limit());
        List<Long> selectedIds = store.getSelectionOrder();
        List<StoredRecord> records = store.getByIds(slice(selectedIds, query.offset(), limit));
        return new SelectionPage(records, selectedIds, PageInfo.of(query.offset(), limit, selectedIds.size()));
    }

    /**
     * 선택 추가. 하나라도 없는 ID가 있으면 아무것도 추가하지 않습니다.
     */
    SelectionAddResult addToSelection(IdList idList) {
        requireNotEmpty(idList);
        List<Long> ids = distinct(idList.ids());

        List<Long> missing = ids.stream().filter(id -> !store.exists(id)).toList();
        if (!missing.isEmpty()) {
            throw new NotFoundException("Records not found", missing);
        }

        SelectionAddition addition = store.addToSelection(ids);
        String message = addition.added().isEmpty()
            ? "All records were already selected"
            : "Added " + addition.added().size() + " records";
        return new SelectionAddResult(message, addition.added(), addition.alreadyPresent(),
            store.getSelectionOrder().size());
    }

    /**
     * 선택 순서 변경. 새 목록은 현재 선택 집합과 정확히 같아야 합니다.
     */
    ReorderResult reorderSelection(IdList idList) {
        requireNotEmpty(idList);
        List<Long> ids = idList.ids();
        List<Long> current = store.getSelectionOrder();
        Set<Long> currentSet = new HashSet<>(current);

        Set<Long> seen = new HashSet<>();
        List<Long> duplicates = ids.stream().filter(id -> !seen.add(id)).distinct().toList();
        if (!duplicates.isEmpty()) {
            throw new ValidationException("Duplicate IDs are not allowed",
                "The following IDs appear more than once: " + join(duplicates));
        }

        List<Long> foreign = ids.stream().filter(id -> !currentSet.contains(id)).toList();
        if (!foreign.isEmpty()) {
            throw new ValidationException("Invalid IDs",
                "The following IDs are not in selected items: " + join(foreign));
        }

        List<Long> missing = current.stream().filter(id -> !seen.contains(id)).toList();
        if (!missing.isEmpty()) {
            throw new ValidationException("Incomplete order",
                "The following selected IDs are missing from the new order: " + join(missing));
        }

        store.setSelectionOrder(ids);
        return new ReorderResult("Order updated", ids, ids.size());
    }

    /**
     * 선택 제거. 선택되지 않은 ID가 섞여 있어도 성공입니다.
     */
    RemovalResult removeFromSelection(IdList idList) {
        requireNotEmpty(idList);
        List<Long> ids = distinct(idList.ids());

        Set<Long> selected = new HashSet<>(store.getSelectionOrder());
        int notFound = (int) ids.stream().filter(id -> !selected.contains(id)).count();
        int removed = store.removeFromSelection(ids);

        String message = removed > 0 ? "Removed " + removed + " records" : "Records were not selected";
        return new RemovalResult(message, removed, notFound, store.getSelectionOrder().size());
    }

    /**
     * 레코드 생성. id가 있으면 채택(충돌 시 conflict), 없으면 store가 다음 ID 할당.
     */
    CreatedRecord createRecord(NewRecord newRecord) {
        if (newRecord.name() == null || newRecord.name().isBlank()) {
            throw new ValidationException("Invalid input", "name is required");
        }
        if (newRecord.hasId()) {
            if (newRecord.id() < 1) {
                throw new ValidationException("Invalid input", "id must be positive (current: " + newRecord.id() + ")");
            }
            if (store.exists(newRecord.id())) {
                throw new ConflictException(newRecord.id());
            }
        }
        StoredRecord record = store.create(newRecord.id(), newRecord.toFields());
        return new CreatedRecord("Record created", record);
    }

    private static <T extends OperationPayload> T cast(Action action, OperationPayload payload, Class<T> type) {
        if (payload == null) {
            throw new ValidationException("Invalid input", action + " requires a " + type.getSimpleName() + " payload");
        }
        if (!type.isInstance(payload)) {
            throw new ValidationException("Invalid input",
                action + " requires " + type.getSimpleName() + " but got " + payload.getClass().getSimpleName());
        }
        return type.cast(payload);
    }

    private static void requireNotEmpty(IdList idList) {
        if (idList.isEmpty()) {
            throw new ValidationException("Invalid input", "ids array cannot be empty");
        }
    }

    private static <T> List<T> slice(List<T> source, int offset, int limit) {
        int total = source.size();
        int from = Math.min(offset, total);
        int to = (int) Math.min((long) offset + limit, total);
        return new ArrayList<>(source.subList(from, to));
    }

    private static List<Long> distinct(List<Long> ids) {
        return new ArrayList<>(new LinkedHashSet<>(ids));
    }

    private static String join(List<Long> ids) {
        return ids.stream().map(String::valueOf).collect(Collectors.joining(", "));
    }
}
