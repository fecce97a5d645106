package com.ryuqq.pipeline.application.coordinator;

import com.ryuqq.pipeline.adapter.file.lock.FileLockManager;
import com.ryuqq.pipeline.adapter.file.store.FileStateStore;
import com.ryuqq.pipeline.adapter.inmemory.notifier.InMemoryChangeNotifier;
import com.ryuqq.pipeline.adapter.runner.RetryExecutor;
import com.ryuqq.pipeline.adapter.runner.Sleeper;
import com.ryuqq.pipeline.application.statemachine.ProjectStateMachine;
import com.ryuqq.pipeline.core.config.CoordinationConfig;
import com.ryuqq.pipeline.core.error.ErrorClassifier;
import com.ryuqq.pipeline.core.retry.RetryPolicies;

/**
 * StateCoordinator 조립 팩토리.
 *
 * <p>전역 싱글턴은 두지 않습니다. 호출자가 반환된 핸들을 소유하고 닫습니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class StateCoordinators {

    // Utility class - prevent instantiation
    private StateCoordinators() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 파일 기반 coordinator 생성 (기본 재시도 정책).
     *
     * @param config 설정
     * @return 새 coordinator
     */
    public static StateCoordinator fileBacked(CoordinationConfig config) {
        return fileBacked(config, new RetryExecutor());
    }

    /**
     * 파일 기반 coordinator 생성.
     *
     * @param config 설정
     * @param retry 재시도 실행기
     * @return 새 coordinator
     */
    public static StateCoordinator fileBacked(CoordinationConfig config, RetryExecutor retry) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        FileLockManager lockManager = new FileLockManager(config);
        InMemoryChangeNotifier notifier = new InMemoryChangeNotifier();
        FileStateStore store = new FileStateStore(config, lockManager, notifier);
        return new DefaultStateCoordinator(store, new ProjectStateMachine(store), notifier, lockManager, retry);
    }

    /**
     * 재시도 정책만 바꾼 파일 기반 coordinator 생성.
     */
    public static StateCoordinator fileBacked(CoordinationConfig config, RetryPolicies policies) {
        return fileBacked(config, new RetryExecutor(new ErrorClassifier(), policies,
            Sleeper.THREAD));
    }
}
