package com.ryuqq.pipeline.adapter.runner;

/**
 * 재시도 대기 추상화.
 *
 * <p>테스트에서 실제 대기 없이 지연 값을 검증할 수 있도록 분리합니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
