package yggdrasil.storage.repository;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.data.domain.PageRequest;
import yggdrasil.storage.dto.StatusCountView;
import yggdrasil.storage.model.ContentRecord;
import yggdrasil.storage.model.RecordStatus;
import yggdrasil.storage.model.StorageLocation;
import yggdrasil.storage.model.StorageStrategy;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest(properties = {"spring.jpa.hibernate.ddl-auto=create-drop"})
public class ContentRecordRepositoryTest {

    @Autowired
    private ContentRecordRepository repository;

    @Autowired
    private TestEntityManager entityManager;

    private ContentRecord persist(String locator, StorageStrategy strategy, RecordStatus status, long size) {
        ContentRecord record = new ContentRecord();
        record.setSourceLocator(locator);
        record.setTitle(locator);
        record.setDomain("philosophy");
        record.setContentType("article");
        record.setDeclaredSize(size);
        record.setStrategy(strategy);
        record.setPolicyVersion(1);
        record.setConfidenceScore(0.8);
        record.setStatus(status);
        record.setLocation(new StorageLocation());
        record.setContentHash("hash-" + locator);
        record.setScrapeCount(1);
        record.setMetadata(new HashMap<>(Map.of("source", "test")));
        record.setTags(new ArrayList<>(List.of("a", "b")));
        record.setKeywords(new ArrayList<>());
        return repository.saveAndFlush(record);
    }

    @Test
    public void findsRecordBySourceLocator() {
        ContentRecord saved = persist("https://example.org/one", StorageStrategy.FULL_STORE, RecordStatus.READY, 10_000L);
        entityManager.clear();

        ContentRecord found = repository.findBySourceLocator("https://example.org/one").orElseThrow();

        assertThat(found.getId()).isEqualTo(saved.getId());
        assertThat(found.getMetadata()).containsEntry("source", "test");
        assertThat(found.getTags()).containsExactly("a", "b");
    }

    @Test
    public void rescrapeOnlyTouchesStatistics() {
        ContentRecord saved = persist("https://example.org/two", StorageStrategy.FULL_STORE, RecordStatus.READY, 10_000L);

        int updated = repository.mergeRescrape(saved.getId(), LocalDateTime.now(), "hash-new");
        entityManager.clear();

        ContentRecord reloaded = repository.findById(saved.getId()).orElseThrow();
        assertThat(updated).isEqualTo(1);
        assertThat(reloaded.getScrapeCount()).isEqualTo(2);
        assertThat(reloaded.getLastSeenHash()).isEqualTo("hash-new");
        assertThat(reloaded.getContentHash()).isEqualTo("hash-https://example.org/two");
        assertThat(reloaded.getStrategy()).isEqualTo(StorageStrategy.FULL_STORE);
    }

    @Test
    public void statusTransitionRequiresExpectedStatus() {
        ContentRecord saved = persist("https://example.org/three", StorageStrategy.HYBRID, RecordStatus.DEGRADED, 10_000L);

        assertThat(repository.transitionStatus(saved.getId(), RecordStatus.READY, RecordStatus.MIGRATING)).isZero();
        assertThat(repository.transitionStatus(saved.getId(), RecordStatus.DEGRADED, RecordStatus.READY)).isEqualTo(1);
        assertThat(repository.findById(saved.getId()).orElseThrow().getStatus()).isEqualTo(RecordStatus.READY);
    }

    @Test
    public void swapLocationIsGuardedByVersion() {
        ContentRecord saved = persist("https://example.org/four", StorageStrategy.FULL_STORE, RecordStatus.MIGRATING, 10_000L);
        long version = saved.getVersion();

        int stale = repository.swapLocation(saved.getId(), version + 5, null, "c", "g1", 3, null, "h",
            StorageStrategy.VECTOR_STORE, 2, 0.9, RecordStatus.READY);
        int swapped = repository.swapLocation(saved.getId(), version, null, "c", "g1", 3, null, "h",
            StorageStrategy.VECTOR_STORE, 2, 0.9, RecordStatus.READY);

        ContentRecord reloaded = repository.findById(saved.getId()).orElseThrow();
        assertThat(stale).isZero();
        assertThat(swapped).isEqualTo(1);
        assertThat(reloaded.getStrategy()).isEqualTo(StorageStrategy.VECTOR_STORE);
        assertThat(reloaded.getLocation().getVectorGeneration()).isEqualTo("g1");
        assertThat(reloaded.getVersion()).isEqualTo(version + 1);
        assertThat(repository.isGenerationReferenced("g1")).isTrue();
        assertThat(repository.isGenerationReferenced("g0")).isFalse();
    }

    @Test
    public void findsOversizedFullStoreRecords() {
        persist("https://example.org/big", StorageStrategy.FULL_STORE, RecordStatus.READY, 20_000_000L);
        persist("https://example.org/small", StorageStrategy.FULL_STORE, RecordStatus.READY, 20_000L);
        persist("https://example.org/vector", StorageStrategy.VECTOR_STORE, RecordStatus.READY, 90_000_000L);

        List<ContentRecord> oversized = repository.findOversized(StorageStrategy.FULL_STORE, 10_000_000L,
            RecordStatus.READY, PageRequest.of(0, 10));

        assertThat(oversized).extracting(ContentRecord::getSourceLocator).containsExactly("https://example.org/big");
    }

    @Test
    public void countsRecordsByStatus() {
        persist("https://example.org/r1", StorageStrategy.FULL_STORE, RecordStatus.READY, 1_000L);
        persist("https://example.org/r2", StorageStrategy.FULL_STORE, RecordStatus.READY, 1_000L);
        persist("https://example.org/d1", StorageStrategy.HYBRID, RecordStatus.DEGRADED, 1_000L);

        Map<RecordStatus, Long> counts = repository.countGroupedByStatus().stream()
            .collect(Collectors.toMap(StatusCountView::getStatus, StatusCountView::getTotal));

        assertThat(counts).containsEntry(RecordStatus.READY, 2L).containsEntry(RecordStatus.DEGRADED, 1L);
    }
}
