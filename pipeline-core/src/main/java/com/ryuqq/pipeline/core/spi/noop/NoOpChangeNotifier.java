package com.ryuqq.pipeline.core.spi.noop;

import com.ryuqq.pipeline.core.error.WatchException;
import com.ryuqq.pipeline.core.model.ProjectId;
import com.ryuqq.pipeline.core.model.SectionName;
import com.ryuqq.pipeline.core.model.StateChangeEvent;
import com.ryuqq.pipeline.core.spi.ChangeListener;
import com.ryuqq.pipeline.core.spi.ChangeNotifier;
import com.ryuqq.pipeline.core.spi.Subscription;

/**
 * ChangeNotifier NoOp 구현.
 *
 * <p>이벤트를 전달하지 않습니다. 변경 구독이 필요 없는 배치 도구나 테스트에서 사용합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>subscribe(): 비활성 구독 반환</li>
 *   <li>publish(): 아무 동작 안 함</li>
 *   <li>subscriberCount(): 항상 0 반환</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class NoOpChangeNotifier implements ChangeNotifier {

    private static final Subscription INACTIVE = new Subscription() {
        @Override
        public void unsubscribe() {
            // 해제할 대상 없음
        }

        @Override
        public boolean isActive() {
            return false;
        }
    };

    private volatile boolean closed;

    @Override
    public Subscription subscribe(ProjectId projectId, SectionName section, ChangeListener listener) {
        if (closed) {
            throw new WatchException("Change notifier is closed");
        }
        return INACTIVE;
    }

    @Override
    public void publish(StateChangeEvent event) {
        // 전달하지 않음
    }

    @Override
    public void unsubscribeProject(ProjectId projectId) {
        // 구독 없음
    }

    @Override
    public int subscriberCount() {
        return 0;
    }

    @Override
    public void close() {
        closed = true;
    }
}
