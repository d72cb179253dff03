package com.ryuqq.resilience.adapter.local;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 이름 접두어를 붙인 데몬 스레드 팩토리.
 *
 * <p>리셋 타이머와 타임아웃 실행 스레드가 JVM 종료를 막지 않도록 데몬으로 생성합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
final class NamedDaemonThreadFactory implements ThreadFactory {

    private final String prefix;
    private final AtomicInteger sequence = new AtomicInteger();

    NamedDaemonThreadFactory(String prefix) {
        this.prefix = prefix;
    }

    @Override
    public Thread newThread(Runnable runnable) {
        Thread thread = new Thread(runnable, prefix + sequence.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    }
}
