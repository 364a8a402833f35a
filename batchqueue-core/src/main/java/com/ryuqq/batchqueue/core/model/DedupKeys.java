package com.ryuqq.batchqueue.core.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.util.List;
import java.util.stream.Collectors;

/**
 * (Action, Payload) 로부터 중복 제거 키를 도출하는 순수 함수 모음.
 *
 * <p>동일한 논리 요청은 항상 동일한 키를 가져야 하며, 이 키가 배치 내 중복 제거의 기준입니다.</p>
 *
 * <p><strong>키 형식:</strong></p>
 * <pre>
 * NewRecord(id != null)   → CREATE_RECORD:5
 * IdList                  → ADD_TO_SELECTION:1,2,3        (숫자 정렬, 순서 무관)
 * IdList (재정렬)          → REORDER_SELECTION:3,1,2       (요청 순서 유지)
 * PageQuery               → FETCH_PAGE:0:20:abc           (offset:limit:정규화 필터)
 * 그 외 / null            → FETCH_SELECTION:{"limit":10,"offset":0}  (canonical JSON)
 * </pre>
 *
 * <p><strong>재정렬 예외:</strong> ID 목록 키는 원칙적으로 순서와 무관하지만, REORDER_SELECTION은
 * 순서 자체가 요청 내용이므로 의도적으로 요청 순서를 유지합니다. [3,1,2]와 [1,2,3]은 서로 다른
 * 재정렬이며 하나로 합쳐지면 안 됩니다.</p>
 *
 * <p>조회 payload의 기본값 채우기와 limit clamp는 {@link PageLimits#normalize(Action, OperationPayload)}로
 * 키 도출 전에 적용해야 실행 결과가 같은 조회가 같은 키를 갖습니다.</p>
 *
 * <p>PageQuery의 필터는 마지막 구간에 두어 필터 문자열에 ':'가 있어도 키가 모호해지지 않습니다.</p>
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
public final class DedupKeys {

    private static final char ACTION_SEPARATOR = ':';

    private static final ObjectMapper CANONICAL_MAPPER = JsonMapper.builder()
        .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
        .build();

    private DedupKeys() {
    }

    /**
     * 중복 제거 키 도출.
     *
     * @param action 액션 (null 불가)
     * @param payload Payload (null 허용)
     * @return 결정적(deterministic) 키 문자열
     * @throws IllegalArgumentException action이 null이거나 payload를 직렬화할 수 없는 경우
     */
    public static String derive(Action action, OperationPayload payload) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        return action.name() + ACTION_SEPARATOR + body(action, payload);
    }

    private static String body(Action action, OperationPayload payload) {
        if (payload instanceof NewRecord newRecord && newRecord.hasId()) {
            return String.valueOf(newRecord.id());
        }
        if (payload instanceof IdList idList) {
            // 재정렬은 순서가 곧 요청 내용이므로 정렬하지 않음
            return action == Action.REORDER_SELECTION
                ? join(idList.ids())
                : join(idList.ids().stream().sorted().toList());
        }
        if (payload instanceof PageQuery query) {
            return query.offset() + ":" + query.limit() + ":" + query.normalizedFilter();
        }
        return canonicalJson(payload);
    }

    private static String join(List<Long> ids) {
        return ids.stream().map(String::valueOf).collect(Collectors.joining(","));
    }

    private static String canonicalJson(Object payload) {
        try {
            return CANONICAL_MAPPER.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("payload cannot be serialized for dedup key: " + payload, e);
        }
    }
}
