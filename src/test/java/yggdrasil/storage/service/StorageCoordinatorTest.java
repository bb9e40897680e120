package yggdrasil.storage.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mockito;
import yggdrasil.storage.client.VectorEncodingService;
import yggdrasil.storage.common.convention.errorcode.StorageErrorCode;
import yggdrasil.storage.common.convention.exception.TransientStoreException;
import yggdrasil.storage.config.StorageProperties;
import yggdrasil.storage.dto.LegResult;
import yggdrasil.storage.dto.WriteOutcome;
import yggdrasil.storage.model.ContentRecord;
import yggdrasil.storage.model.StorageLeg;
import yggdrasil.storage.model.StorageStrategy;
import yggdrasil.storage.model.VectorChunkDocument;
import yggdrasil.storage.model.VectorMapping;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

public class StorageCoordinatorTest {

    private FullContentStore fullContentStore;
    private VectorStoreGateway vectorGateway;
    private VectorBatchLedger batchLedger;
    private VectorEncodingService encodingService;
    private SpecializedTableWriter specializedWriter;
    private StorageCoordinator coordinator;

    @BeforeEach
    public void setUp() {
        StorageProperties properties = new StorageProperties();
        properties.getCoordinator().setInitialBackoff(Duration.ofMillis(1));
        properties.getCoordinator().setMaxBackoff(Duration.ofMillis(2));

        fullContentStore = Mockito.mock(FullContentStore.class);
        vectorGateway = Mockito.mock(VectorStoreGateway.class);
        batchLedger = Mockito.mock(VectorBatchLedger.class);
        encodingService = Mockito.mock(VectorEncodingService.class);
        specializedWriter = Mockito.mock(SpecializedTableWriter.class);

        when(vectorGateway.collection()).thenReturn("ygg_content_vectors");
        when(encodingService.getDimension()).thenReturn(4);
        when(encodingService.getModelName()).thenReturn("test-embedding");
        when(encodingService.encode(anyList())).thenAnswer(invocation -> {
            List<String> texts = invocation.getArgument(0);
            List<float[]> vectors = new ArrayList<>();
            for (int i = 0; i < texts.size(); i++) {
                vectors.add(new float[]{0.1f, 0.2f, 0.3f, 0.4f});
            }
            return vectors;
        });

        coordinator = new StorageCoordinator(fullContentStore, vectorGateway, batchLedger, encodingService,
            specializedWriter, new ContentChunker(properties), Runnable::run, properties);
    }

    private static ContentRecord record(Long id, String domain, String contentType) {
        ContentRecord record = new ContentRecord();
        record.setId(id);
        record.setSourceLocator("https://example.org/" + id);
        record.setDomain(domain);
        record.setContentType(contentType);
        record.setCreatedAt(LocalDateTime.of(2024, 1, 1, 0, 0));
        return record;
    }

    private static String paragraphs(int count, int length) {
        StringBuilder text = new StringBuilder();
        for (int p = 0; p < count; p++) {
            if (p > 0) {
                text.append("\n\n");
            }
            StringBuilder paragraph = new StringBuilder();
            while (paragraph.length() < length) {
                paragraph.append("word").append(p).append(' ');
            }
            text.append(paragraph.toString().trim());
        }
        return text.toString();
    }

    @Test
    public void fullStoreWritesOneBlobAndNoVectors() {
        when(fullContentStore.writeIdempotent(eq("hash-a"), anyString(), isNull(), eq(1L))).thenReturn(11L);

        WriteOutcome outcome = coordinator.execute(record(1L, "technology", "article"),
            "a short technology article", "hash-a", StorageStrategy.FULL_STORE);

        assertThat(outcome.allSucceeded()).isTrue();
        assertThat(outcome.getLegs()).hasSize(1);
        assertThat(outcome.getLegs().get(0).getFullBlobId()).isEqualTo(11L);
        verify(fullContentStore, times(1)).writeIdempotent(eq("hash-a"), anyString(), isNull(), eq(1L));
        verifyNoInteractions(vectorGateway, batchLedger, encodingService);
    }

    @Test
    @SuppressWarnings("unchecked")
    public void vectorStoreWritesAllChunksBeforeCompletionMarker() {
        String book = paragraphs(3, 800);

        WriteOutcome outcome = coordinator.execute(record(2L, "literature", "book"), book, "hash-b",
            StorageStrategy.VECTOR_STORE);

        assertThat(outcome.allSucceeded()).isTrue();
        LegResult vector = outcome.getLegs().get(0);
        assertThat(vector.getLeg()).isEqualTo(StorageLeg.VECTOR);
        assertThat(vector.getVectorChunkCount()).isEqualTo(3);

        ArgumentCaptor<List<VectorChunkDocument>> documents = ArgumentCaptor.forClass(List.class);
        ArgumentCaptor<List<VectorMapping>> mappings = ArgumentCaptor.forClass(List.class);
        InOrder order = Mockito.inOrder(batchLedger, vectorGateway);
        order.verify(batchLedger).stage(eq(2L), eq("ygg_content_vectors"), eq(vector.getVectorGeneration()), eq(3));
        order.verify(vectorGateway).indexChunks(documents.capture());
        order.verify(vectorGateway).refresh();
        order.verify(batchLedger).commit(eq(vector.getVectorGeneration()), mappings.capture());

        assertThat(documents.getValue()).extracting(VectorChunkDocument::getChunkSequence)
            .containsExactlyInAnyOrder(0, 1, 2);
        assertThat(documents.getValue()).allSatisfy(document -> {
            assertThat(document.getContentRecordId()).isEqualTo(2L);
            assertThat(document.getGeneration()).isEqualTo(vector.getVectorGeneration());
            assertThat(document.getDomain()).isEqualTo("literature");
        });
        assertThat(mappings.getValue()).hasSize(3);
        verifyNoInteractions(fullContentStore);
    }

    @Test
    @SuppressWarnings("unchecked")
    public void chunksAreIndexedInBoundedBulkBatches() {
        WriteOutcome outcome = coordinator.execute(record(6L, "literature", "book"), paragraphs(70, 800),
            "hash-f", StorageStrategy.VECTOR_STORE);

        assertThat(outcome.allSucceeded()).isTrue();
        assertThat(outcome.getLegs().get(0).getVectorChunkCount()).isEqualTo(70);
        ArgumentCaptor<List<VectorChunkDocument>> batches = ArgumentCaptor.forClass(List.class);
        verify(vectorGateway, times(2)).indexChunks(batches.capture());
        assertThat(batches.getAllValues()).extracting(List::size)
            .containsExactly(StorageCoordinator.BULK_BATCH_SIZE, 70 - StorageCoordinator.BULK_BATCH_SIZE);
        verify(batchLedger).commit(anyString(), anyList());
    }

    @Test
    public void failedChunkWriteNeverCommitsTheBatch() {
        Mockito.doThrow(new TransientStoreException("es unavailable", StorageErrorCode.ELASTICSEARCH_ERROR))
            .when(vectorGateway).indexChunks(anyList());

        WriteOutcome outcome = coordinator.execute(record(3L, "literature", "book"), paragraphs(2, 800),
            "hash-c", StorageStrategy.VECTOR_STORE);

        assertThat(outcome.failedLegs()).containsExactly(StorageLeg.VECTOR);
        verify(batchLedger, times(3)).stage(eq(3L), anyString(), anyString(), anyInt());
        verify(batchLedger, never()).commit(anyString(), anyList());
    }

    @Test
    public void hybridReportsOnlyTheFailedLeg() {
        when(fullContentStore.writeIdempotent(anyString(), anyString(), any(), anyLong())).thenReturn(21L);
        Mockito.doThrow(new TransientStoreException("es unavailable", StorageErrorCode.ELASTICSEARCH_ERROR))
            .when(vectorGateway).indexChunks(anyList());

        WriteOutcome outcome = coordinator.execute(record(4L, "science", "article"), paragraphs(1, 300),
            "hash-d", StorageStrategy.HYBRID);

        assertThat(outcome.failedLegs()).containsExactly(StorageLeg.VECTOR);
        assertThat(outcome.succeeded()).extracting(LegResult::getFullBlobId).containsExactly(21L);
    }

    @Test
    public void metadataOnlyWritesNothing() {
        WriteOutcome outcome = coordinator.execute(record(5L, "general", "article"), "text", "hash-e",
            StorageStrategy.METADATA_ONLY);

        assertThat(outcome.getLegs()).isEmpty();
        assertThat(outcome.allSucceeded()).isTrue();
        verifyNoInteractions(fullContentStore, vectorGateway, batchLedger, specializedWriter);
    }
}
