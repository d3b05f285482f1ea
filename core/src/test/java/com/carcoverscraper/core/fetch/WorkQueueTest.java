package com.carcoverscraper.core.fetch;

import com.carcoverscraper.core.model.WorkItem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class WorkQueueTest {

    private static final URI PAGE = URI.create("https://www.olx.in/items/q-car-cover?page=1");

    @Test
    @DisplayName("같은 URL(정규화 기준)+종류는 한 번만 투입")
    void offer_admitsEachUrlOnce() {
        WorkQueue q = new WorkQueue();

        assertThat(q.offer(WorkItem.search(PAGE, 1))).isTrue();
        assertThat(q.offer(WorkItem.search(URI.create("HTTPS://WWW.OLX.IN:443/items/q-car-cover?page=1#top"), 1))).isFalse();
        assertThat(q.offer(WorkItem.detail(PAGE, null))).isTrue(); // 종류가 다르면 별개
        assertThat(q.outstanding()).isEqualTo(2);
    }

    @Test
    @DisplayName("close 후: 새 작업 거부, 재시도는 수용")
    void close_rejectsNewWork_butAcceptsRetries() throws Exception {
        WorkQueue q = new WorkQueue();
        q.offer(WorkItem.search(PAGE, 1));
        WorkItem polled = q.poll(Duration.ofMillis(100));
        q.close();

        assertThat(q.offer(WorkItem.search(URI.create("https://www.olx.in/items/q-car-cover?page=2"), 2))).isFalse();
        assertThat(q.resubmit(polled.retryAfter(Duration.ZERO))).isTrue();
        q.done();

        WorkItem retry = q.poll(Duration.ofMillis(100));
        assertThat(retry).isNotNull();
        assertThat(retry.getAttempt()).isEqualTo(1);
        q.done();
        assertThat(q.isDrained()).isTrue();
    }

    @Test
    @DisplayName("재투입 항목은 notBefore 이전엔 꺼내지지 않는다")
    void retry_isNotDeliveredBeforeDelay() throws Exception {
        WorkQueue q = new WorkQueue();
        q.offer(WorkItem.search(PAGE, 1));
        WorkItem first = q.poll(Duration.ofMillis(100));
        q.resubmit(first.retryAfter(Duration.ofMillis(300)));
        q.done();

        assertThat(q.isDrained()).isFalse();
        assertThat(q.poll(Duration.ofMillis(50))).isNull();

        WorkItem later = q.poll(Duration.ofSeconds(2));
        assertThat(later).isNotNull();
        assertThat(later.isRetry()).isTrue();
    }

    @Test
    @DisplayName("cancel: 지연 중 항목까지 폐기, 이후 재시도 거부")
    void cancel_dropsQueuedAndDelayed() throws Exception {
        WorkQueue q = new WorkQueue();
        q.offer(WorkItem.search(PAGE, 1));
        q.offer(WorkItem.detail(URI.create("https://www.olx.in/item/a-iid-1"), null));
        WorkItem first = q.poll(Duration.ofMillis(100));
        q.resubmit(first.retryAfter(Duration.ofSeconds(30)));
        q.done();

        List<WorkItem> dropped = q.cancel();

        assertThat(dropped).hasSize(2);
        assertThat(q.isDrained()).isTrue();
        assertThat(q.isCancelled()).isTrue();
        assertThat(q.resubmit(first.retryAfter(Duration.ZERO))).isFalse();
        assertThat(q.cancel()).isEmpty();
    }
}
