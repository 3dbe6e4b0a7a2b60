package com.socialpulse.api.controller;

import com.socialpulse.api.dto.ScrapeCompletedEvent;
import com.socialpulse.api.publisher.ScrapeEventBroadcaster;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 클라이언트마다 broadcaster 구독 하나를 열고, 큐를 비우면서 SSE로 흘려보낸다.
 * 이벤트가 없으면 heartbeat 주기마다 ping.
 */
@Slf4j
@RestController
public class EventStreamController {

    private static final long NO_TIMEOUT = 0L;

    private final ScrapeEventBroadcaster broadcaster;
    private final Duration heartbeat;
    private final ExecutorService pumps = Executors.newCachedThreadPool();

    public EventStreamController(ScrapeEventBroadcaster broadcaster,
                                 @Value("${events.heartbeat:30s}") Duration heartbeat) {
        this.broadcaster = broadcaster;
        this.heartbeat = heartbeat;
    }

    @GetMapping(value = "/api/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events() {
        // 가득 차 있으면 여기서 SubscriberLimitExceededException -> 503
        BlockingQueue<ScrapeCompletedEvent> queue = broadcaster.subscribe();

        SseEmitter emitter = new SseEmitter(NO_TIMEOUT);
        AtomicBoolean open = new AtomicBoolean(true);
        emitter.onCompletion(() -> open.set(false));
        emitter.onTimeout(() -> open.set(false));
        emitter.onError(e -> open.set(false));

        try {
            pumps.execute(() -> pump(emitter, queue, open));
        } catch (RuntimeException e) {
            broadcaster.unsubscribe(queue);
            throw e;
        }
        return emitter;
    }

    private void pump(SseEmitter emitter, BlockingQueue<ScrapeCompletedEvent> queue, AtomicBoolean open) {
        boolean clientGone = false;
        try {
            while (open.get() && !Thread.currentThread().isInterrupted()) {
                ScrapeCompletedEvent event = queue.poll(heartbeat.toMillis(), TimeUnit.MILLISECONDS);
                if (event == null) {
                    emitter.send(SseEmitter.event().name("ping").data(""));
                } else {
                    emitter.send(SseEmitter.event().name("message").data(event, MediaType.APPLICATION_JSON));
                }
            }
        } catch (IOException | IllegalStateException e) {
            clientGone = true;
            log.debug("SSE client disconnected: {}", e.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            broadcaster.unsubscribe(queue);
            if (!clientGone) {
                emitter.complete();
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        pumps.shutdownNow();
    }
}
