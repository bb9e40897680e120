package yggdrasil.storage.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.dao.QueryTimeoutException;
import yggdrasil.storage.repository.ContentRecordRepository;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class AccessStatsRecorderTest {

    private ContentRecordRepository recordRepository;
    private AccessStatsRecorder recorder;

    @BeforeEach
    public void setUp() {
        recordRepository = Mockito.mock(ContentRecordRepository.class);
        recorder = new AccessStatsRecorder(recordRepository);
    }

    @Test
    public void hitsAccumulateUntilFlushed() {
        recorder.recordHits(List.of(1L, 2L));
        recorder.recordHits(List.of(1L));

        assertThat(recorder.pendingHits(1L)).isEqualTo(2L);
        assertThat(recorder.flush()).isEqualTo(2);

        verify(recordRepository).addAccessHits(eq(1L), eq(2L), eq(0.9), any(LocalDateTime.class));
        verify(recordRepository).addAccessHits(eq(2L), eq(1L), eq(0.9), any(LocalDateTime.class));
        assertThat(recorder.pendingHits(1L)).isZero();
    }

    @Test
    public void databaseFailureDropsBatchWithoutThrowing() {
        when(recordRepository.addAccessHits(anyLong(), anyLong(), anyDouble(), any()))
            .thenThrow(new QueryTimeoutException("timeout"));
        recorder.recordHits(List.of(5L));

        assertThat(recorder.flush()).isZero();
        assertThat(recorder.pendingHits(5L)).isZero();
    }
}
