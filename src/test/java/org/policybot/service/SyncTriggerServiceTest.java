package org.policybot.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.policybot.DTO.ChangeSet;
import org.policybot.DTO.FileChange;
import org.policybot.config.SyncProperties;
import org.policybot.entity.SyncJob;
import org.policybot.exception.CustomException;
import org.policybot.exception.ErrorKind;
import org.policybot.repository.RedisRepository;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SyncTriggerServiceTest {

    @Mock
    private SyncJobService jobService;
    @Mock
    private SyncDispatcher dispatcher;
    @Mock
    private RedisRepository redisRepository;

    private SyncTriggerService triggerService;
    private ChangeSet changeSet;

    @BeforeEach
    void setUp() {
        SyncProperties properties = new SyncProperties();
        properties.setRepoId("acme/policies");
        triggerService = new SyncTriggerService(jobService, dispatcher, new ChangeClassificationService(properties),
                redisRepository, properties);
        changeSet = new ChangeSet("abc123", "main",
                List.of(new FileChange("policies/leave.md", FileChange.Status.MODIFIED)));
    }

    @Test
    void firstDeliveryCreatesAndDispatchesJob() {
        SyncJob job = new SyncJob();
        job.setJobId("job-1");
        when(redisRepository.markIfAbsent(startsWith("webhook:push:"), eq("abc123"), any(Duration.class))).thenReturn(true);
        when(jobService.createJob(SyncJob.TriggerType.INCREMENTAL, "abc123", "main", false)).thenReturn(job);

        SyncJob result = triggerService.submitIncremental(changeSet);

        assertThat(result).isSameAs(job);
        verify(dispatcher).dispatchIncremental("job-1", changeSet);
    }

    @Test
    void duplicateDeliveryIsIgnored() {
        when(redisRepository.markIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(false);

        SyncJob result = triggerService.submitIncremental(changeSet);

        assertThat(result).isNull();
        verifyNoInteractions(jobService, dispatcher);
    }

    @Test
    void failedJobCreationReleasesDedupeKey() {
        when(redisRepository.markIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(true);
        when(jobService.createJob(any(), anyString(), anyString(), anyBoolean()))
                .thenThrow(new CustomException("db down", ErrorKind.JOB_SETUP, HttpStatus.INTERNAL_SERVER_ERROR));

        assertThatThrownBy(() -> triggerService.submitIncremental(changeSet)).isInstanceOf(CustomException.class);

        verify(redisRepository).delete(startsWith("webhook:push:"));
        verifyNoInteractions(dispatcher);
    }

    @Test
    void rejectedDispatchFailsJobAndReleasesDedupeKey() {
        SyncJob job = new SyncJob();
        job.setJobId("job-3");
        when(redisRepository.markIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(true);
        when(jobService.createJob(SyncJob.TriggerType.INCREMENTAL, "abc123", "main", false)).thenReturn(job);
        doThrow(new TaskRejectedException("queue full")).when(dispatcher).dispatchIncremental("job-3", changeSet);

        assertThatThrownBy(() -> triggerService.submitIncremental(changeSet))
                .isInstanceOf(TaskRejectedException.class);

        verify(jobService).fail(same(job), contains("queue full"));
        verify(redisRepository).delete(startsWith("webhook:push:"));
    }

    @Test
    void rejectedFullDispatchFailsJob() {
        SyncJob job = new SyncJob();
        job.setJobId("job-4");
        when(jobService.createJob(SyncJob.TriggerType.FULL, null, "main", false)).thenReturn(job);
        doThrow(new TaskRejectedException("queue full")).when(dispatcher).dispatchFull("job-4");

        assertThatThrownBy(() -> triggerService.submitFull("main", false))
                .isInstanceOf(TaskRejectedException.class);

        verify(jobService).fail(same(job), contains("queue full"));
    }

    @Test
    void fullSyncDefaultsToConfiguredBranch() {
        SyncJob job = new SyncJob();
        job.setJobId("job-2");
        when(jobService.createJob(SyncJob.TriggerType.FULL, null, "main", true)).thenReturn(job);

        triggerService.submitFull(" ", true);

        verify(dispatcher).dispatchFull("job-2");
    }
}
