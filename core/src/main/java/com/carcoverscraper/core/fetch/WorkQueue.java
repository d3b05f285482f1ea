package com.carcoverscraper.core.fetch;

import com.carcoverscraper.core.model.WorkItem;
import com.carcoverscraper.core.util.UrlUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 워커 공용 작업 큐.
 * - 재시도는 notBefore가 찍힌 WorkItem으로 재투입 → 워커가 제자리에서 sleep 하지 않음(DelayQueue)
 * - outstanding = 큐 대기 + 지연 대기 + 처리 중. 0이 되면 완료(드레인).
 * - close(): 새 최상위 작업 거부, 재시도는 계속 받음
 * - cancel(): close + 대기 중 작업 폐기 + 재시도 거부
 *
 * 불변식: 워커는 poll로 받은 항목마다 정확히 한 번 done()을 호출하고,
 * 재투입/파생 작업 offer는 done() 이전에 한다(outstanding이 중간에 0으로 떨어지지 않게).
 */
public final class WorkQueue {

    private final DelayQueue<WorkItem> queue = new DelayQueue<>();
    private final AtomicInteger outstanding = new AtomicInteger();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Set<String> admitted = ConcurrentHashMap.newKeySet();

    /**
     * 최상위 작업 투입(시드/페이지네이션/상세 링크).
     * @return false = 닫힘 또는 같은 URL이 이미 투입됨
     */
    public boolean offer(WorkItem item) {
        if (item == null || closed.get()) return false;
        if (!admitted.add(keyOf(item))) return false;
        outstanding.incrementAndGet();
        queue.add(item);
        return true;
    }

    /** 재시도 재투입. 강제 취소 후에만 거부된다. */
    public boolean resubmit(WorkItem retry) {
        if (retry == null || cancelled.get()) return false;
        outstanding.incrementAndGet();
        queue.add(retry);
        return true;
    }

    /** 준비된 항목을 최대 wait 동안 기다린다. 없으면 null. */
    public WorkItem poll(Duration wait) throws InterruptedException {
        return queue.poll(Math.max(1, wait.toMillis()), TimeUnit.MILLISECONDS);
    }

    /** poll로 받은 항목 하나의 처리가 끝났음을 알린다. */
    public void done() {
        outstanding.decrementAndGet();
    }

    public boolean isDrained() { return outstanding.get() <= 0; }

    public int outstanding() { return Math.max(0, outstanding.get()); }

    public void close() { closed.set(true); }

    /** 강제 취소: 대기 중 항목 폐기 후 반환(진행 중 항목은 워커가 마무리). */
    public List<WorkItem> cancel() {
        closed.set(true);
        cancelled.set(true);
        List<WorkItem> dropped = new ArrayList<>();
        // 만기 전(지연 중) 항목도 포함해서 비운다
        for (WorkItem w : new ArrayList<>(queue)) {
            if (queue.remove(w)) {
                dropped.add(w);
                outstanding.decrementAndGet();
            }
        }
        return dropped;
    }

    public boolean isClosed() { return closed.get(); }

    public boolean isCancelled() { return cancelled.get(); }

    private static String keyOf(WorkItem item) {
        return item.getKind() + " " + UrlUtils.normalize(item.getUrl());
    }
}
