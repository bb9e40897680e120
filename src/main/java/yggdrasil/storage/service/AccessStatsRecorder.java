package yggdrasil.storage.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import yggdrasil.storage.repository.ContentRecordRepository;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * 访问计数
 * 内存累加，定期批量落库；允许少量丢失，不阻塞查询路径
 */
@Component
public class AccessStatsRecorder {

    private static final Logger log = LoggerFactory.getLogger(AccessStatsRecorder.class);

    /** 每次落库时旧访问频率的衰减系数 */
    private static final double FREQUENCY_DECAY = 0.9;

    private final ContentRecordRepository recordRepository;
    private final ConcurrentMap<Long, LongAdder> pending = new ConcurrentHashMap<>();

    public AccessStatsRecorder(ContentRecordRepository recordRepository) {
        this.recordRepository = recordRepository;
    }

    public void recordHits(Collection<Long> recordIds) {
        for (Long id : recordIds) {
            pending.computeIfAbsent(id, key -> new LongAdder()).increment();
        }
    }

    @Scheduled(fixedDelayString = "${storage.query.access-flush-ms:10000}")
    public int flush() {
        List<Long> ids = new ArrayList<>(pending.keySet());
        LocalDateTime now = LocalDateTime.now();
        int flushed = 0;
        for (Long id : ids) {
            LongAdder adder = pending.remove(id);
            if (adder == null) {
                continue;
            }
            long hits = adder.sum();
            if (hits == 0) {
                continue;
            }
            try {
                recordRepository.addAccessHits(id, hits, FREQUENCY_DECAY, now);
                flushed++;
            } catch (DataAccessException e) {
                log.warn("访问计数落库失败，记录 {} 本轮 {} 次访问丢弃: {}", id, hits, e.getMessage());
            }
        }
        return flushed;
    }

    long pendingHits(Long recordId) {
        LongAdder adder = pending.get(recordId);
        return adder == null ? 0L : adder.sum();
    }
}
