package com.ryuqq.deployer.application.tail;

import com.ryuqq.deployer.core.model.DeploymentEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 전송된 이벤트와 keep-alive를 기록하는 테스트용 {@link TailSink}.
 *
 * <p>{@code capacity}개를 받은 뒤의 전송은 버리고 닫힌 상태가 됩니다 (구독자 이탈 시뮬레이션).</p>
 */
class RecordingSink implements TailSink {

    private final List<DeploymentEvent> events = new CopyOnWriteArrayList<>();
    private final AtomicInteger keepAlives = new AtomicInteger();
    private final int capacity;
    private volatile boolean open = true;

    RecordingSink() {
        this(Integer.MAX_VALUE);
    }

    RecordingSink(int capacity) {
        this.capacity = capacity;
    }

    @Override
    public void send(DeploymentEvent event) {
        if (!open) {
            return;
        }
        if (events.size() >= capacity) {
            open = false;
            return;
        }
        events.add(event);
    }

    @Override
    public void keepAlive() {
        if (open) {
            keepAlives.incrementAndGet();
        }
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    void close() {
        open = false;
    }

    List<DeploymentEvent> events() {
        return new ArrayList<>(events);
    }

    List<Long> ids() {
        List<Long> ids = new ArrayList<>();
        for (DeploymentEvent event : events) {
            ids.add(event.id());
        }
        return ids;
    }

    int keepAlives() {
        return keepAlives.get();
    }
}
