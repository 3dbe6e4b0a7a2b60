package com.socialpulse.api.publisher;

import com.socialpulse.api.dto.ScrapeCompletedEvent;
import com.socialpulse.api.exception.SubscriberLimitExceededException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 사이클 완료 이벤트를 구독자별 bounded queue로 전달. 재전송(replay)은 없다.
 * 구독자는 연결이 끊기면 반드시 unsubscribe 해야 한다.
 */
@Slf4j
@Component
public class ScrapeEventBroadcaster {

    private final int maxSubscribers;
    private final int bufferSize;
    private final Set<BlockingQueue<ScrapeCompletedEvent>> subscribers = ConcurrentHashMap.newKeySet();

    public ScrapeEventBroadcaster(@Value("${events.max-subscribers:100}") int maxSubscribers,
                                  @Value("${events.buffer-size:50}") int bufferSize) {
        this.maxSubscribers = maxSubscribers;
        this.bufferSize = bufferSize;
    }

    public synchronized BlockingQueue<ScrapeCompletedEvent> subscribe() {
        if (subscribers.size() >= maxSubscribers) {
            throw new SubscriberLimitExceededException(maxSubscribers);
        }
        BlockingQueue<ScrapeCompletedEvent> queue = new ArrayBlockingQueue<>(bufferSize);
        subscribers.add(queue);
        log.debug("Subscriber added ({} total)", subscribers.size());
        return queue;
    }

    public void unsubscribe(BlockingQueue<ScrapeCompletedEvent> queue) {
        if (queue != null && subscribers.remove(queue)) {
            log.debug("Subscriber removed ({} total)", subscribers.size());
        }
    }

    /**
     * 큐가 가득 찬 구독자는 이번 이벤트만 놓친다. 절대 block 하지 않는다.
     */
    public void publish(ScrapeCompletedEvent event) {
        int dropped = 0;
        for (BlockingQueue<ScrapeCompletedEvent> queue : subscribers) {
            if (!queue.offer(event)) {
                dropped++;
            }
        }
        if (dropped > 0) {
            log.warn("Event for {} dropped for {} slow subscriber(s)", event.source(), dropped);
        }
    }

    public int subscriberCount() {
        return subscribers.size();
    }
}
