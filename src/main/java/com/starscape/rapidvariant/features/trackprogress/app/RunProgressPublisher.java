package com.starscape.rapidvariant.features.trackprogress.app;

import com.starscape.rapidvariant.features.runpipeline.api.dto.PipelineResultResponse;
import com.starscape.rapidvariant.features.runpipeline.domain.PipelineResult;
import com.starscape.rapidvariant.features.runpipeline.domain.PipelineRun;
import com.starscape.rapidvariant.features.runpipeline.domain.PipelineRunListener;
import com.starscape.rapidvariant.features.runpipeline.domain.PipelineState;
import com.starscape.rapidvariant.features.runpipeline.domain.Progress;
import com.starscape.rapidvariant.features.trackprogress.api.dto.PipelineProgressUpdate;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Pushes every state change, progress change and final result of a run to its topic.
 */
@Component
public class RunProgressPublisher implements PipelineRunListener {
    
    private final ProgressBroadcaster broadcaster;
    private final Clock clock;
    
    public RunProgressPublisher(ProgressBroadcaster broadcaster, Clock clock) {
        this.broadcaster = broadcaster;
        this.clock = clock;
    }
    
    @Override
    public void onStateChanged(PipelineRun run, PipelineState state) {
        publish(run, state, run.getProgress().snapshot(), null);
    }
    
    @Override
    public void onProgress(PipelineRun run, Progress progress) {
        publish(run, run.getState(), progress, null);
    }
    
    @Override
    public void onSettled(PipelineRun run, PipelineResult result) {
        PipelineResultResponse response = PipelineResultResponse.from(result, run.getPendingCommit().isPresent());
        publish(run, run.getState(), run.getProgress().snapshot(), response);
    }
    
    private void publish(PipelineRun run, PipelineState state, Progress progress, PipelineResultResponse result) {
        broadcaster.broadcastProgress(new PipelineProgressUpdate(
            run.getRunId(),
            run.getUploadId(),
            state.name(),
            progress.generating(),
            progress.uploading(),
            progress.finalizing(),
            progress.overall(),
            result,
            clock.instant()
        ));
    }
}
