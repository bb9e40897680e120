package yggdrasil.storage.service.support;

import java.time.Duration;

/**
 * 写入节流器
 * 保证相邻两次放行之间至少间隔 minInterval，用于限制后台迁移对存储的写压力
 */
public class WritePacer {

    private final long minIntervalNanos;
    private long nextPermitNanos;

    public WritePacer(Duration minInterval) {
        this.minIntervalNanos = Math.max(0L, minInterval.toNanos());
        this.nextPermitNanos = System.nanoTime();
    }

    /**
     * 阻塞到下一个可用时间片
     */
    public void acquire() throws InterruptedException {
        long waitNanos;
        synchronized (this) {
            long now = System.nanoTime();
            long permitAt = Math.max(now, nextPermitNanos);
            nextPermitNanos = permitAt + minIntervalNanos;
            waitNanos = permitAt - now;
        }
        if (waitNanos > 0) {
            Thread.sleep(waitNanos / 1_000_000L, (int) (waitNanos % 1_000_000L));
        }
    }
}
