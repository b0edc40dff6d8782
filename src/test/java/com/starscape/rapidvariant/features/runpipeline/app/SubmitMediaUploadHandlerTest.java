package com.starscape.rapidvariant.features.runpipeline.app;

import com.starscape.rapidvariant.common.config.PipelineProperties;
import com.starscape.rapidvariant.common.exception.BusinessException;
import com.starscape.rapidvariant.features.runpipeline.api.dto.CropRequest;
import com.starscape.rapidvariant.features.runpipeline.api.dto.FocalPointRequest;
import com.starscape.rapidvariant.features.runpipeline.api.dto.MediaUploadRequest;
import com.starscape.rapidvariant.features.runpipeline.api.dto.SubmitMediaUploadResponse;
import com.starscape.rapidvariant.features.runpipeline.domain.PipelineRun;
import com.starscape.rapidvariant.support.TestImages;
import com.starscape.rapidvariant.support.TestPlans;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.mock.web.MockMultipartFile;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class SubmitMediaUploadHandlerTest {
    
    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);
    
    @Mock
    private VariantPipelineRunner runner;
    
    private PipelineRunRegistry registry;
    private List<Runnable> submitted;
    
    @BeforeEach
    void setUp() {
        registry = new PipelineRunRegistry(new PipelineProperties(), CLOCK);
        submitted = new ArrayList<>();
    }
    
    @Test
    void registersRunAndExecutesItOnThePipelineExecutor() {
        SubmitMediaUploadHandler handler = handler(submitted::add);
        MediaUploadRequest request = new MediaUploadRequest("Sunset Over Lake", "A lake at dusk", "Evening", null, "1:1",
            new FocalPointRequest(25.0, 75.0), new CropRequest(0, 0, 32, 32), 90.0);
        
        SubmitMediaUploadResponse response = handler.handle(file(), request);
        
        assertTrue(response.runId().startsWith("run_"));
        assertTrue(response.uploadId().startsWith("1700000000000-"));
        assertEquals("IDLE", response.state());
        
        PipelineRun run = registry.require(response.runId());
        assertEquals("sunset-over-lake", run.getBaseName());
        assertEquals(90.0, run.getCropSpec().rotation());
        assertEquals(32, run.getCropSpec().rect().width());
        assertEquals(25.0, run.getFields().focalPoint().x());
        assertEquals("image/jpeg", run.getSource().mimeType());
        
        assertEquals(1, submitted.size());
        submitted.get(0).run();
        ArgumentCaptor<PipelineRun> executed = ArgumentCaptor.forClass(PipelineRun.class);
        verify(runner).run(executed.capture());
        assertSame(run, executed.getValue());
    }
    
    @Test
    void missingRequestPartStillStartsRunFromFilename() {
        SubmitMediaUploadResponse response = handler(submitted::add).handle(file(), null);
        
        PipelineRun run = registry.require(response.runId());
        assertEquals("holiday-photo-jpg", run.getBaseName());
        assertNull(run.getFields().name());
    }
    
    @Test
    void rejectedExecutionReportsBusyAndForgetsTheRun() {
        SubmitMediaUploadHandler handler = handler(task -> {
            throw new TaskRejectedException("queue full");
        });
        
        BusinessException e = assertThrows(BusinessException.class, () -> handler.handle(file(), null));
        
        assertEquals("PIPELINE_BUSY", e.getCode());
        assertEquals(0, registry.size());
        verify(runner, never()).run(any());
    }
    
    @Test
    void missingFileIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> handler(submitted::add).handle(null, null));
    }
    
    private SubmitMediaUploadHandler handler(TaskExecutor executor) {
        return new SubmitMediaUploadHandler(runner, registry, TestPlans.smallPlan(), executor, CLOCK);
    }
    
    private static MockMultipartFile file() {
        return new MockMultipartFile("file", "Holiday Photo.jpg", "image/jpeg", TestImages.jpeg(64, 64));
    }
}
