package yggdrasil.storage.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import yggdrasil.storage.common.convention.errorcode.StorageErrorCode;
import yggdrasil.storage.common.convention.exception.ContentValidationException;
import yggdrasil.storage.config.StorageProperties;
import yggdrasil.storage.dto.IngestRequest;
import yggdrasil.storage.dto.IngestResult;
import yggdrasil.storage.dto.LegResult;
import yggdrasil.storage.dto.WriteOutcome;
import yggdrasil.storage.model.ContentRecord;
import yggdrasil.storage.model.RecordStatus;
import yggdrasil.storage.model.StorageLeg;
import yggdrasil.storage.model.StorageLocation;
import yggdrasil.storage.model.StorageStrategy;
import yggdrasil.storage.repository.ContentRecordRepository;
import yggdrasil.storage.service.support.LocatorSerialExecutor;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

public class IngestionServiceTest {

    private ContentRecordRepository recordRepository;
    private StorageCoordinator coordinator;
    private ConsistencyMapper consistencyMapper;
    private ReconciliationService reconciliationService;
    private IngestionService ingestionService;

    @BeforeEach
    public void setUp() {
        StorageProperties properties = new StorageProperties();
        recordRepository = Mockito.mock(ContentRecordRepository.class);
        coordinator = Mockito.mock(StorageCoordinator.class);
        consistencyMapper = Mockito.mock(ConsistencyMapper.class);
        reconciliationService = Mockito.mock(ReconciliationService.class);

        when(recordRepository.findBySourceLocator(anyString())).thenReturn(Optional.empty());
        when(recordRepository.saveAndFlush(any(ContentRecord.class))).thenAnswer(invocation -> {
            ContentRecord record = invocation.getArgument(0);
            record.setId(100L);
            return record;
        });

        ingestionService = new IngestionService(recordRepository, new ContentClassifier(properties),
            new PlacementPolicy(properties), coordinator, consistencyMapper, reconciliationService,
            new LocatorSerialExecutor(), properties);
    }

    private void commitAs(StorageStrategy strategy, RecordStatus status) {
        commitAs(100L, strategy, status);
    }

    private void commitAs(Long recordId, StorageStrategy strategy, RecordStatus status) {
        when(consistencyMapper.commitIngestion(eq(recordId), any(WriteOutcome.class))).thenAnswer(invocation -> {
            WriteOutcome outcome = invocation.getArgument(1);
            ContentRecord record = new ContentRecord();
            record.setId(recordId);
            record.setStrategy(strategy);
            record.setStatus(status);
            StorageLocation location = new StorageLocation();
            for (LegResult leg : outcome.succeeded()) {
                if (leg.getLeg() == StorageLeg.FULL) {
                    location.setFullBlobId(leg.getFullBlobId());
                } else if (leg.getLeg() == StorageLeg.VECTOR) {
                    location.setVectorCollection(leg.getVectorCollection());
                    location.setVectorGeneration(leg.getVectorGeneration());
                    location.setVectorChunkCount(leg.getVectorChunkCount());
                }
            }
            record.setLocation(location);
            return record;
        });
    }

    @Test
    public void smallTechnologyArticleIsStoredInFullStore() {
        WriteOutcome outcome = new WriteOutcome();
        outcome.add(LegResult.full(7L));
        when(coordinator.execute(any(), anyString(), anyString(), eq(StorageStrategy.FULL_STORE))).thenReturn(outcome);
        commitAs(StorageStrategy.FULL_STORE, RecordStatus.READY);

        IngestResult result = ingestionService.ingest(IngestRequest.builder()
            .sourceLocator("https://example.org/tech/article")
            .title("Compilers")
            .domain("technology")
            .declaredSize(10 * 1024L)
            .content("Software and algorithm design for compilers. Programming languages evolve.")
            .build());

        assertThat(result.getRecordId()).isEqualTo(100L);
        assertThat(result.isCreated()).isTrue();
        assertThat(result.getStrategy()).isEqualTo(StorageStrategy.FULL_STORE);
        assertThat(result.getStatus()).isEqualTo(RecordStatus.READY);

        ArgumentCaptor<ContentRecord> saved = ArgumentCaptor.forClass(ContentRecord.class);
        verify(recordRepository).saveAndFlush(saved.capture());
        ContentRecord pending = saved.getValue();
        assertThat(pending.getStrategy()).isEqualTo(StorageStrategy.FULL_STORE);
        assertThat(pending.getConfidenceScore()).isBetween(0.7, 0.99);
        assertThat(pending.getDomain()).isEqualTo("technology");
        verifyNoInteractions(reconciliationService);
    }

    @Test
    public void largeLiteratureBookIsStoredAsVectors() {
        WriteOutcome outcome = new WriteOutcome();
        outcome.add(LegResult.vector("ygg_content_vectors", "g-1", 12));
        when(coordinator.execute(any(), anyString(), anyString(), eq(StorageStrategy.VECTOR_STORE))).thenReturn(outcome);
        commitAs(StorageStrategy.VECTOR_STORE, RecordStatus.READY);

        IngestResult result = ingestionService.ingest(IngestRequest.builder()
            .sourceLocator("https://www.gutenberg.org/ebooks/2600")
            .domain("literature")
            .declaredSize(60L * 1024 * 1024)
            .content("A novel of many characters and a sprawling plot.")
            .build());

        assertThat(result.getStrategy()).isEqualTo(StorageStrategy.VECTOR_STORE);
        verify(coordinator).execute(any(), anyString(), anyString(), eq(StorageStrategy.VECTOR_STORE));
    }

    @Test
    public void failedLegIsScheduledForRepair() {
        WriteOutcome outcome = new WriteOutcome();
        outcome.add(LegResult.full(7L));
        outcome.add(LegResult.failed(StorageLeg.VECTOR, "es unavailable"));
        when(coordinator.execute(any(), anyString(), anyString(), any())).thenReturn(outcome);
        commitAs(StorageStrategy.HYBRID, RecordStatus.DEGRADED);

        IngestResult result = ingestionService.ingest(IngestRequest.builder()
            .sourceLocator("https://example.org/philosophy/essay")
            .domain("philosophy")
            .declaredSize(5_000_000L)
            .content("Consciousness and existence.")
            .build());

        assertThat(result.getStatus()).isEqualTo(RecordStatus.DEGRADED);
        assertThat(result.getFailedLegs()).containsExactly(StorageLeg.VECTOR);
        verify(reconciliationService).scheduleRepair(any(ContentRecord.class), eq(StorageLeg.VECTOR),
            eq("Consciousness and existence."), eq("es unavailable"));
    }

    @Test
    public void legRejectedAtCommitIsScheduledForRepair() {
        WriteOutcome outcome = new WriteOutcome();
        outcome.add(LegResult.full(7L));
        when(coordinator.execute(any(), anyString(), anyString(), eq(StorageStrategy.FULL_STORE))).thenReturn(outcome);
        when(consistencyMapper.commitIngestion(eq(100L), any(WriteOutcome.class))).thenAnswer(invocation -> {
            ContentRecord record = new ContentRecord();
            record.setId(100L);
            record.setStrategy(StorageStrategy.FULL_STORE);
            record.setStatus(RecordStatus.DEGRADED);
            record.setLocation(new StorageLocation());
            return record;
        });

        IngestResult result = ingestionService.ingest(IngestRequest.builder()
            .sourceLocator("https://example.org/tech/gc-race")
            .domain("technology")
            .declaredSize(2048L)
            .content("Shared blob removed before the pointer was set.")
            .build());

        assertThat(result.getStatus()).isEqualTo(RecordStatus.DEGRADED);
        assertThat(result.getFailedLegs()).containsExactly(StorageLeg.FULL);
        verify(reconciliationService).scheduleRepair(any(ContentRecord.class), eq(StorageLeg.FULL),
            eq("Shared blob removed before the pointer was set."), eq("写入后回读校验失败"));
    }

    @Test
    public void interruptedIngestionWithNewContentIsReclassified() {
        ContentRecord stuck = new ContentRecord();
        stuck.setId(6L);
        stuck.setSourceLocator("https://example.org/tech/interrupted");
        stuck.setStrategy(StorageStrategy.VECTOR_STORE);
        stuck.setStatus(RecordStatus.PENDING);
        stuck.setContentHash("hash-of-earlier-content");
        stuck.setScrapeCount(1);
        stuck.setLocation(new StorageLocation());
        when(recordRepository.findBySourceLocator("https://example.org/tech/interrupted")).thenReturn(Optional.of(stuck));
        when(recordRepository.saveAndFlush(any(ContentRecord.class))).thenAnswer(invocation -> invocation.getArgument(0));
        WriteOutcome outcome = new WriteOutcome();
        outcome.add(LegResult.full(8L));
        when(coordinator.execute(any(), anyString(), anyString(), eq(StorageStrategy.FULL_STORE))).thenReturn(outcome);
        commitAs(6L, StorageStrategy.FULL_STORE, RecordStatus.READY);

        IngestResult result = ingestionService.ingest(IngestRequest.builder()
            .sourceLocator("https://example.org/tech/interrupted")
            .domain("technology")
            .declaredSize(4096L)
            .content("A short revised article about compilers.")
            .build());

        assertThat(result.getRecordId()).isEqualTo(6L);
        assertThat(result.isCreated()).isFalse();
        assertThat(result.getStatus()).isEqualTo(RecordStatus.READY);
        assertThat(stuck.getStrategy()).isEqualTo(StorageStrategy.FULL_STORE);
        assertThat(stuck.getContentHash()).isNotEqualTo("hash-of-earlier-content");
        assertThat(stuck.getScrapeCount()).isEqualTo(2);
        verify(recordRepository, never()).mergeRescrape(any(), any(), anyString());
    }

    @Test
    public void repeatedLocatorOnlyMergesScrapeStatistics() {
        ContentRecord existing = new ContentRecord();
        existing.setId(5L);
        existing.setSourceLocator("https://example.org/again");
        existing.setStrategy(StorageStrategy.FULL_STORE);
        existing.setStatus(RecordStatus.READY);
        existing.setContentHash("old-hash");
        when(recordRepository.findBySourceLocator("https://example.org/again")).thenReturn(Optional.of(existing));

        IngestResult result = ingestionService.ingest(IngestRequest.builder()
            .sourceLocator("https://example.org/again")
            .content("same page scraped twice")
            .build());

        assertThat(result.getRecordId()).isEqualTo(5L);
        assertThat(result.isCreated()).isFalse();
        verify(recordRepository).mergeRescrape(eq(5L), any(), anyString());
        verify(recordRepository, never()).saveAndFlush(any());
        verifyNoInteractions(coordinator, consistencyMapper);
    }

    @Test
    public void emptyContentIsRejectedBeforeAnyWrite() {
        assertThatThrownBy(() -> ingestionService.ingest(IngestRequest.builder()
            .sourceLocator("https://example.org/empty")
            .content("   ")
            .build()))
            .isInstanceOf(ContentValidationException.class)
            .extracting("errorCode")
            .isEqualTo(StorageErrorCode.CONTENT_EMPTY.code());

        verifyNoInteractions(recordRepository, coordinator);
    }

    @Test
    public void negativeDeclaredSizeIsRejected() {
        assertThatThrownBy(() -> ingestionService.ingest(IngestRequest.builder()
            .sourceLocator("https://example.org/negative")
            .declaredSize(-1L)
            .content("text")
            .build()))
            .isInstanceOf(ContentValidationException.class);
    }
}
