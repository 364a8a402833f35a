package com.ryuqq.batchqueue.core.error;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 참조한 ID가 존재하지 않음.
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
public class NotFoundException extends QueueOperationException {

    private final List<Long> missingIds;

    public NotFoundException(String message, List<Long> missingIds) {
        super(ErrorCode.NOT_FOUND, message, describe(missingIds), null);
        this.missingIds = List.copyOf(missingIds);
    }

    /**
     * 존재하지 않는 ID 목록 조회.
     *
     * @return 누락 ID (요청 순서)
     */
    public List<Long> missingIds() {
        return missingIds;
    }

    private static String describe(List<Long> missingIds) {
        return "The following IDs do not exist: "
            + missingIds.stream().map(String::valueOf).collect(Collectors.joining(", "));
    }
}
