package com.ryuqq.batchqueue.adapter.runner;

import com.ryuqq.batchqueue.core.model.PageLimits;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * BatchingRequestQueue 실행 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>readDelayMs: READ 배치 윈도우 (기본 1000ms)</li>
 *   <li>writeDelayMs: WRITE 배치 윈도우 (기본 10000ms)</li>
 *   <li>defaultPageSize: limit 미지정 시 페이지 크기 (기본 10)</li>
 *   <li>maxPageSize: 페이지 크기 상한 (기본 100)</li>
 *   <li>timerThreads: 타이머 스레드 수 (기본 2, READ와 WRITE가 서로 막지 않도록 최소 2)</li>
 *   <li>seedRecordCount: 기동 시 생성할 레코드 수 (기본 1,000,000)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>낮은 지연: readDelayMs 감소 (1000 → 100), 대신 배치당 중복 제거 효과 감소</li>
 *   <li>쓰기 병합 강화: writeDelayMs 증가</li>
 *   <li>테스트/데모: seedRecordCount 감소 (1,000,000 → 100)</li>
 * </ul>
 *
 * @author BatchQueue Team
 * @since 1.0.0
 * @param readDelayMs READ 배치 윈도우 (밀리초, 양수여야 함)
 * @param writeDelayMs WRITE 배치 윈도우 (밀리초, 양수여야 함)
 * @param defaultPageSize 기본 페이지 크기 (1 이상)
 * @param maxPageSize 최대 페이지 크기 (defaultPageSize 이상)
 * @param timerThreads 타이머 스레드 수 (2 이상)
 * @param seedRecordCount 초기 레코드 수 (0 이상)
 */
public record BatchQueueConfig(
    long readDelayMs,
    long writeDelayMs,
    int defaultPageSize,
    int maxPageSize,
    int timerThreads,
    int seedRecordCount
) {

    /**
     * classpath 설정 파일 이름.
     */
    public static final String RESOURCE_NAME = "batchqueue.properties";

    static final String READ_DELAY_KEY = "batchqueue.read-delay-ms";
    static final String WRITE_DELAY_KEY = "batchqueue.write-delay-ms";
    static final String DEFAULT_PAGE_SIZE_KEY = "batchqueue.default-page-size";
    static final String MAX_PAGE_SIZE_KEY = "batchqueue.max-page-size";
    static final String TIMER_THREADS_KEY = "batchqueue.timer-threads";
    static final String SEED_RECORD_COUNT_KEY = "batchqueue.seed-record-count";

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: readDelayMs=1000ms, writeDelayMs=10000ms, defaultPageSize=10,
     * maxPageSize=100, timerThreads=2, seedRecordCount=1,000,000</p>
     */
    public BatchQueueConfig() {
        this(1000, 10000, 10, 100, 2, 1_000_000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BatchQueueConfig {
        if (readDelayMs <= 0) {
            throw new IllegalArgumentException("readDelayMs must be positive (current: " + readDelayMs + ")");
        }
        if (writeDelayMs <= 0) {
            throw new IllegalArgumentException("writeDelayMs must be positive (current: " + writeDelayMs + ")");
        }
        if (defaultPageSize <= 0) {
            throw new IllegalArgumentException("defaultPageSize must be positive (current: " + defaultPageSize + ")");
        }
        if (maxPageSize < defaultPageSize) {
            throw new IllegalArgumentException(
                "maxPageSize must be >= defaultPageSize (default: " + defaultPageSize + ", max: " + maxPageSize + ")"
            );
        }
        if (timerThreads < 2) {
            throw new IllegalArgumentException("timerThreads must be >= 2 (current: " + timerThreads + ")");
        }
        if (seedRecordCount < 0) {
            throw new IllegalArgumentException("seedRecordCount must be >= 0 (current: " + seedRecordCount + ")");
        }
    }

    /**
     * classpath의 {@value #RESOURCE_NAME}에서 설정 로드.
     *
     * <p>파일이 없으면 기본 설정을 반환합니다.</p>
     *
     * @return 설정
     * @throws UncheckedIOException 파일을 읽을 수 없는 경우
     * @throws IllegalArgumentException 값이 숫자가 아니거나 검증에 실패한 경우
     */
    public static BatchQueueConfig load() {
        Properties properties = new Properties();
        try (InputStream in = BatchQueueConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE_NAME, e);
        }
        return fromProperties(properties);
    }

    /**
     * Properties에서 설정 생성. 없는 키는 기본값을 사용합니다.
     *
     * @param properties 설정 값
     * @return 설정
     * @throws IllegalArgumentException properties가 null이거나 값이 잘못된 경우
     */
    public static BatchQueueConfig fromProperties(Properties properties) {
        if (properties == null) {
            throw new IllegalArgumentException("properties cannot be null");
        }
        BatchQueueConfig defaults = new BatchQueueConfig();
        return new BatchQueueConfig(
            longValue(properties, READ_DELAY_KEY, defaults.readDelayMs()),
            longValue(properties, WRITE_DELAY_KEY, defaults.writeDelayMs()),
            (int) longValue(properties, DEFAULT_PAGE_SIZE_KEY, defaults.defaultPageSize()),
            (int) longValue(properties, MAX_PAGE_SIZE_KEY, defaults.maxPageSize()),
            (int) longValue(properties, TIMER_THREADS_KEY, defaults.timerThreads()),
            (int) longValue(properties, SEED_RECORD_COUNT_KEY, defaults.seedRecordCount())
        );
    }

    private static long longValue(Properties properties, String key, long defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(raw.trim().replace("_", ""));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number (current: " + raw + ")", e);
        }
    }

    /**
     * 페이지 정책 변환.
     *
     * @return defaultPageSize/maxPageSize 기반 PageLimits
     */
    public PageLimits pageLimits() {
        return new PageLimits(defaultPageSize, maxPageSize);
    }

    /**
     * readDelayMs만 변경한 새 인스턴스 생성.
     */
    public BatchQueueConfig withReadDelayMs(long readDelayMs) {
        return new BatchQueueConfig(readDelayMs, writeDelayMs, defaultPageSize, maxPageSize, timerThreads, seedRecordCount);
    }

    /**
     * writeDelayMs만 변경한 새 인스턴스 생성.
     */
    public BatchQueueConfig withWriteDelayMs(long writeDelayMs) {
        return new BatchQueueConfig(readDelayMs, writeDelayMs, defaultPageSize, maxPageSize, timerThreads, seedRecordCount);
    }

    /**
     * defaultPageSize만 변경한 새 인스턴스 생성.
     */
    public BatchQueueConfig withDefaultPageSize(int defaultPageSize) {
        return new BatchQueueConfig(readDelayMs, writeDelayMs, defaultPageSize, maxPageSize, timerThreads, seedRecordCount);
    }

    /**
     * maxPageSize만 변경한 새 인스턴스 생성.
     */
    public BatchQueueConfig withMaxPageSize(int maxPageSize) {
        return new BatchQueueConfig(readDelayMs, writeDelayMs, defaultPageSize, maxPageSize, timerThreads, seedRecordCount);
    }

    /**
     * timerThreads만 변경한 새 인스턴스 생성.
     */
    public BatchQueueConfig withTimerThreads(int timerThreads) {
        return new BatchQueueConfig(readDelayMs, writeDelayMs, defaultPageSize, maxPageSize, timerThreads, seedRecordCount);
    }

    /**
     * seedRecordCount만 변경한 새 인스턴스 생성.
     */
    public BatchQueueConfig withSeedRecordCount(int seedRecordCount) {
        return new BatchQueueConfig(readDelayMs, writeDelayMs, defaultPageSize, maxPageSize, timerThreads, seedRecordCount);
    }
}
