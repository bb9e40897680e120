package yggdrasil.storage.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.data.domain.Pageable;
import yggdrasil.storage.common.convention.errorcode.StorageErrorCode;
import yggdrasil.storage.common.convention.exception.TransientStoreException;
import yggdrasil.storage.config.StorageProperties;
import yggdrasil.storage.model.ContentRecord;
import yggdrasil.storage.model.GarbageCollectionTask;
import yggdrasil.storage.model.StorageLocation;
import yggdrasil.storage.repository.ContentRecordRepository;
import yggdrasil.storage.repository.GarbageCollectionTaskRepository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class LocationGarbageCollectorTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 6, 1, 12, 0);

    private GarbageCollectionTaskRepository taskRepository;
    private ContentRecordRepository recordRepository;
    private FullContentStore fullContentStore;
    private VectorStoreGateway vectorGateway;
    private VectorBatchLedger batchLedger;
    private SpecializedTableWriter specializedWriter;
    private LocationGarbageCollector collector;

    @BeforeEach
    public void setUp() {
        taskRepository = Mockito.mock(GarbageCollectionTaskRepository.class);
        recordRepository = Mockito.mock(ContentRecordRepository.class);
        fullContentStore = Mockito.mock(FullContentStore.class);
        vectorGateway = Mockito.mock(VectorStoreGateway.class);
        batchLedger = Mockito.mock(VectorBatchLedger.class);
        specializedWriter = Mockito.mock(SpecializedTableWriter.class);
        collector = new LocationGarbageCollector(taskRepository, recordRepository, fullContentStore, vectorGateway,
            batchLedger, specializedWriter, new StorageProperties());
    }

    private static GarbageCollectionTask task(GarbageCollectionTask.Kind kind, String reference, int attempts) {
        GarbageCollectionTask task = new GarbageCollectionTask();
        task.setRecordId(9L);
        task.setKind(kind);
        task.setReference(reference);
        task.setDueAt(NOW.minusMinutes(5));
        task.setAttempts(attempts);
        task.setStatus(GarbageCollectionTask.Status.PENDING);
        return task;
    }

    private void due(GarbageCollectionTask... tasks) {
        when(taskRepository.findByStatusAndDueAtLessThanEqualOrderByDueAtAsc(
            eq(GarbageCollectionTask.Status.PENDING), eq(NOW), any(Pageable.class))).thenReturn(List.of(tasks));
    }

    @Test
    public void onlyTasksDueAtTheGivenTimeAreRequested() {
        due();

        assertThat(collector.collectDue(NOW)).isZero();

        verify(taskRepository).findByStatusAndDueAtLessThanEqualOrderByDueAtAsc(
            eq(GarbageCollectionTask.Status.PENDING), eq(NOW), any(Pageable.class));
        Mockito.verifyNoInteractions(fullContentStore, vectorGateway, specializedWriter);
    }

    @Test
    public void referencedBlobIsNeverDeleted() {
        GarbageCollectionTask shared = task(GarbageCollectionTask.Kind.FULL_BLOB, "42", 0);
        due(shared);
        when(recordRepository.isBlobReferenced(42L)).thenReturn(true);

        collector.collectDue(NOW);

        verify(fullContentStore, never()).deleteIfUnclaimed(anyLong(), any());
        assertThat(shared.getStatus()).isEqualTo(GarbageCollectionTask.Status.DONE);
        verify(taskRepository).save(shared);
    }

    @Test
    public void unreferencedBlobIsDeletedUnderTheClaimCutoff() {
        GarbageCollectionTask retired = task(GarbageCollectionTask.Kind.FULL_BLOB, "43", 0);
        due(retired);
        when(fullContentStore.deleteIfUnclaimed(43L, NOW.minusHours(1))).thenReturn(true);

        int done = collector.collectDue(NOW);

        assertThat(done).isEqualTo(1);
        assertThat(retired.getStatus()).isEqualTo(GarbageCollectionTask.Status.DONE);
    }

    @Test
    public void recentlyClaimedBlobIsPostponed() {
        GarbageCollectionTask retired = task(GarbageCollectionTask.Kind.FULL_BLOB, "44", 0);
        due(retired);
        when(fullContentStore.deleteIfUnclaimed(44L, NOW.minusHours(1))).thenReturn(false);

        int done = collector.collectDue(NOW);

        assertThat(done).isZero();
        assertThat(retired.getStatus()).isEqualTo(GarbageCollectionTask.Status.PENDING);
        assertThat(retired.getDueAt()).isEqualTo(NOW.plusHours(1));
        assertThat(retired.getAttempts()).isZero();
    }

    @Test
    public void referencedGenerationIsSkippedAndRetiredOneIsSwept() {
        GarbageCollectionTask live = task(GarbageCollectionTask.Kind.VECTOR_GENERATION, "g-live", 0);
        GarbageCollectionTask old = task(GarbageCollectionTask.Kind.VECTOR_GENERATION, "g-old", 0);
        due(live, old);
        when(recordRepository.isGenerationReferenced("g-live")).thenReturn(true);

        int done = collector.collectDue(NOW);

        assertThat(done).isEqualTo(2);
        verify(vectorGateway, never()).deleteGeneration("g-live");
        verify(vectorGateway).deleteGeneration("g-old");
        verify(batchLedger).markSwept("g-old");
        verify(batchLedger, never()).markSwept("g-live");
    }

    @Test
    public void specializedRowStillPointedToIsKept() {
        ContentRecord owner = new ContentRecord();
        owner.setId(9L);
        StorageLocation location = new StorageLocation();
        location.setSpecializedTable("spec_philosophy_v1");
        owner.setLocation(location);
        when(recordRepository.findById(9L)).thenReturn(Optional.of(owner));
        due(task(GarbageCollectionTask.Kind.SPECIALIZED_ROW, "spec_philosophy_v1", 0),
            task(GarbageCollectionTask.Kind.SPECIALIZED_ROW, "spec_philosophy_v0", 0));

        collector.collectDue(NOW);

        verify(specializedWriter, never()).delete(eq("spec_philosophy_v1"), anyLong());
        verify(specializedWriter).delete("spec_philosophy_v0", 9L);
    }

    @Test
    public void failureIsRetriedUntilTheAttemptLimit() {
        GarbageCollectionTask first = task(GarbageCollectionTask.Kind.VECTOR_GENERATION, "g-flaky", 0);
        GarbageCollectionTask last = task(GarbageCollectionTask.Kind.VECTOR_GENERATION, "g-doomed", 4);
        due(first, last);
        when(vectorGateway.deleteGeneration(anyString()))
            .thenThrow(new TransientStoreException("es unavailable", StorageErrorCode.ELASTICSEARCH_ERROR));

        int done = collector.collectDue(NOW);

        assertThat(done).isZero();
        assertThat(first.getAttempts()).isEqualTo(1);
        assertThat(first.getStatus()).isEqualTo(GarbageCollectionTask.Status.PENDING);
        assertThat(last.getAttempts()).isEqualTo(5);
        assertThat(last.getStatus()).isEqualTo(GarbageCollectionTask.Status.FAILED);
        verify(batchLedger, never()).markSwept(anyString());
    }
}
