package fpt.com.ehraccess.common.concurrent;

import fpt.com.ehraccess.common.exception.ErrorCode;
import fpt.com.ehraccess.common.exception.ServiceUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes work per key ("lane"). Different keys never block each other.
 * Lanes are created on demand and dropped as soon as nobody holds or waits on them.
 */
@Slf4j
@Component
public class LaneLockRegistry {

    private final ConcurrentHashMap<String, Lane> lanes = new ConcurrentHashMap<>();
    private final long acquireTimeoutMs;

    public LaneLockRegistry(@Value("${app.lane.acquire-timeout-ms:5000}") long acquireTimeoutMs) {
        this.acquireTimeoutMs = acquireTimeoutMs;
    }

    public <T> T withLane(String key, Supplier<T> action) {
        Lane lane = join(key);
        boolean locked = false;
        try {
            locked = lane.lock.tryLock(acquireTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            leave(key);
            log.debug("Lane {} acquisition interrupted", key);
            throw new ServiceUnavailableException(ErrorCode.OPERATION_CANCELLED, key);
        }
        if (!locked) {
            leave(key);
            log.warn("Lane {} busy for more than {} ms", key, acquireTimeoutMs);
            throw new ServiceUnavailableException(ErrorCode.LANE_BUSY, key);
        }
        try {
            return action.get();
        } finally {
            lane.lock.unlock();
            leave(key);
        }
    }

    public void runInLane(String key, Runnable action) {
        withLane(key, () -> {
            action.run();
            return null;
        });
    }

    /**
     * Number of lanes currently held or awaited.
     */
    public int activeLanes() {
        return lanes.size();
    }

    private Lane join(String key) {
        return lanes.compute(key, (k, existing) -> {
            Lane lane = existing == null ? new Lane() : existing;
            lane.users++;
            return lane;
        });
    }

    private void leave(String key) {
        lanes.computeIfPresent(key, (k, lane) -> --lane.users == 0 ? null : lane);
    }

    private static final class Lane {
        private final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's per-key compute
        private int users;
    }
}
