package com.cinegen.api.store;

import com.cinegen.api.entity.GenerationJob;
import com.cinegen.api.mapper.GenerationJobMapper;
import com.cinegen.common.enums.JobStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MybatisJobStoreTest {

    @Mock
    private GenerationJobMapper generationJobMapper;

    @InjectMocks
    private MybatisJobStore store;

    @Test
    void transitionsAreAppliedOnlyWhenARowChanged() {
        when(generationJobMapper.claim("j1", "w1")).thenReturn(1);
        when(generationJobMapper.claim("j2", "w1")).thenReturn(0);

        assertThat(store.claim("j1", "w1")).isTrue();
        assertThat(store.claim("j2", "w1")).isFalse();
    }

    @Test
    void completePassesMetadataThrough() {
        Map<String, Object> metadata = Map.of("providerUsed", "veo");
        when(generationJobMapper.complete("j1", "w1", "gs://x.mp4", metadata)).thenReturn(1);

        assertThat(store.complete("j1", "w1", "gs://x.mp4", metadata)).isTrue();
    }

    @Test
    void cancelRejectedForTerminalRow() {
        when(generationJobMapper.cancel("j1")).thenReturn(0);

        assertThat(store.cancel("j1")).isFalse();
    }

    @Test
    void findRecentPassesStatusName() {
        when(generationJobMapper.findRecent("FAILED", 5)).thenReturn(List.of(GenerationJob.builder().jobId("j1").build()));

        assertThat(store.findRecent(JobStatus.FAILED, 5)).hasSize(1);
        store.findRecent(null, 10);
        verify(generationJobMapper).findRecent(null, 10);
    }
}
