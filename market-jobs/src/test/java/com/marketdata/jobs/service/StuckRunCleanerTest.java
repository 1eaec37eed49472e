package com.marketdata.jobs.service;

import com.marketdata.jobs.controller.dto.CleanupResponse;
import com.marketdata.jobs.service.scan.ScanRunRecorder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Collections;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for StuckRunCleaner.
 */
@ExtendWith(MockitoExtension.class)
class StuckRunCleanerTest {

    @Mock
    private ExecutionTracker executionTracker;

    @Mock
    private ScanRunRecorder scanRunRecorder;

    @InjectMocks
    private StuckRunCleaner cleaner;

    @Test
    void testFailRunning_NothingLive_FailsRunsAndScans() {
        // Arrange
        when(executionTracker.failAllRunning("Interrupted by restart", Collections.emptySet())).thenReturn(2);
        when(scanRunRecorder.failAllRunning()).thenReturn(1);

        // Act
        CleanupResponse response = cleaner.failRunning("Interrupted by restart");

        // Assert
        assertEquals(2, response.getRunsFailed());
        assertEquals(1, response.getScansFailed());
    }

    @Test
    void testFailRunning_ScanJobLive_LeavesScansAlone() {
        // Arrange
        Set<String> live = Set.of("eod_scan");
        when(executionTracker.failAllRunning("Marked failed by stuck-run cleanup", live)).thenReturn(1);

        // Act
        CleanupResponse response = cleaner.failRunning("Marked failed by stuck-run cleanup", live);

        // Assert
        assertEquals(1, response.getRunsFailed());
        assertEquals(0, response.getScansFailed());
        verifyNoInteractions(scanRunRecorder);
    }
}
