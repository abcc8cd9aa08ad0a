package com.transmissionweb.feeder.scheduler;

import com.transmissionweb.feeder.config.FeederProperties;
import com.transmissionweb.feeder.entity.Feed;
import com.transmissionweb.feeder.service.FeedCheckService;
import com.transmissionweb.feeder.service.FeedService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 피드 주기 점검 스케줄러.
 * 매 주기마다 활성화된 피드를 ID순으로 돌며 점검 주기가 지난 피드를 하나씩 점검합니다.
 * 첫 주기는 시작 즉시 실행됩니다.
 */
@Component
@Slf4j
public class FeedPollScheduler implements SmartLifecycle {

    private final FeedService feedService;
    private final FeedCheckService feedCheckService;
    private final FeederProperties properties;
    private final TaskScheduler taskScheduler;
    private final Clock clock;

    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final ReentrantLock cycleLock = new ReentrantLock();

    private volatile ScheduledFuture<?> pollFuture;
    private volatile boolean running;

    public FeedPollScheduler(FeedService feedService,
                             FeedCheckService feedCheckService,
                             FeederProperties properties,
                             @Qualifier("feedPollTaskScheduler") TaskScheduler taskScheduler,
                             Clock clock) {
        this.feedService = feedService;
        this.feedCheckService = feedCheckService;
        this.properties = properties;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    @Override
    public void start() {
        if (!properties.getPoll().isEnabled()) {
            log.info("Feed polling is disabled");
            running = true;
            return;
        }
        stopRequested.set(false);
        pollFuture = taskScheduler.scheduleAtFixedRate(this::runCycle, Instant.now(clock), properties.getPoll().getInterval());
        running = true;
        log.info("Feed polling started, interval {}", properties.getPoll().getInterval());
    }

    /**
     * 이후 주기를 취소하고, 실행 중인 주기는 종료 타임아웃까지 대기
     */
    @Override
    public void stop() {
        stopRequested.set(true);
        ScheduledFuture<?> future = pollFuture;
        if (future != null) {
            future.cancel(false);
        }
        try {
            long timeoutMillis = properties.getPoll().getShutdownTimeout().toMillis();
            if (cycleLock.tryLock(timeoutMillis, TimeUnit.MILLISECONDS)) {
                cycleLock.unlock();
            } else {
                log.warn("Feed poll cycle still running after {}", properties.getPoll().getShutdownTimeout());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the feed poll cycle to finish");
        }
        running = false;
        log.info("Feed polling stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * 점검 주기 1회 실행.
     * 실패한 피드는 로그만 남기고 다음 피드로 넘어갑니다.
     *
     * @return 점검한 피드 수
     */
    public int runCycle() {
        if (!cycleLock.tryLock()) {
            log.debug("Previous poll cycle still running, skipping");
            return 0;
        }
        try {
            List<Feed> feeds = feedService.getEnabledFeeds();
            LocalDateTime now = LocalDateTime.now(clock);
            int checked = 0;

            for (Feed feed : feeds) {
                if (stopRequested.get()) {
                    log.info("Stop requested, ending poll cycle early");
                    break;
                }
                if (!feed.isDue(now)) {
                    continue;
                }
                try {
                    feedCheckService.checkFeed(feed.getId(), stopRequested::get);
                    checked++;
                } catch (Exception e) {
                    log.error("Error checking feed {}: {}", feed.getName(), e.getMessage(), e);
                }
            }

            log.debug("Poll cycle finished, {} of {} feeds checked", checked, feeds.size());
            return checked;
        } catch (Exception e) {
            log.error("Feed poll cycle failed: {}", e.getMessage(), e);
            return 0;
        } finally {
            cycleLock.unlock();
        }
    }
}
