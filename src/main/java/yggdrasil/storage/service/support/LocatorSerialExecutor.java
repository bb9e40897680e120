package yggdrasil.storage.service.support;

import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * 按来源地址串行执行
 * 同一地址的摄取依次进行，不同地址互不阻塞
 */
@Component
public class LocatorSerialExecutor {

    private final ConcurrentMap<String, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

    public <T> T run(String key, Supplier<T> action) {
        CompletableFuture<Void> mine = new CompletableFuture<>();
        CompletableFuture<Void> previous = tails.put(key, mine);
        try {
            if (previous != null) {
                previous.join();
            }
            return action.get();
        } finally {
            mine.complete(null);
            tails.remove(key, mine);
        }
    }

    /**
     * 当前仍有排队或执行中任务的地址数
     */
    public int activeKeys() {
        return tails.size();
    }
}
