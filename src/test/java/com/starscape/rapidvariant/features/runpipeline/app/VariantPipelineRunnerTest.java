package com.starscape.rapidvariant.features.runpipeline.app;

import com.starscape.rapidvariant.common.config.PipelineProperties;
import com.starscape.rapidvariant.common.exception.ErrorKind;
import com.starscape.rapidvariant.features.finalizemedia.app.MediaFinalizer;
import com.starscape.rapidvariant.features.finalizemedia.domain.CommitReceipt;
import com.starscape.rapidvariant.features.finalizemedia.domain.CommitRequest;
import com.starscape.rapidvariant.features.finalizemedia.domain.DescriptiveFields;
import com.starscape.rapidvariant.features.finalizemedia.domain.MediaCommitter;
import com.starscape.rapidvariant.features.generatevariants.app.EncodingOffload;
import com.starscape.rapidvariant.features.generatevariants.app.ImageTransformer;
import com.starscape.rapidvariant.features.generatevariants.app.VariantEncoder;
import com.starscape.rapidvariant.features.generatevariants.domain.CropRect;
import com.starscape.rapidvariant.features.generatevariants.domain.CropSpec;
import com.starscape.rapidvariant.features.generatevariants.domain.SourceImage;
import com.starscape.rapidvariant.features.generatevariants.domain.VariantPlan;
import com.starscape.rapidvariant.features.generatevariants.domain.VariantSpec;
import com.starscape.rapidvariant.features.runpipeline.domain.PipelineResult;
import com.starscape.rapidvariant.features.runpipeline.domain.PipelineRun;
import com.starscape.rapidvariant.features.runpipeline.domain.PipelineRunListener;
import com.starscape.rapidvariant.features.runpipeline.domain.PipelineState;
import com.starscape.rapidvariant.features.runpipeline.domain.Progress;
import com.starscape.rapidvariant.features.uploadvariants.app.FailureClassifier;
import com.starscape.rapidvariant.features.uploadvariants.app.RetryExecutor;
import com.starscape.rapidvariant.features.uploadvariants.app.UploadOrchestrator;
import com.starscape.rapidvariant.features.uploadvariants.domain.RetryPolicy;
import com.starscape.rapidvariant.features.uploadvariants.domain.StorageException;
import com.starscape.rapidvariant.features.uploadvariants.domain.UploadResult;
import com.starscape.rapidvariant.support.InMemoryVariantStorage;
import com.starscape.rapidvariant.support.TestImages;
import com.starscape.rapidvariant.support.TestPlans;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class VariantPipelineRunnerTest {
    
    private ExecutorService uploadPool;
    private EncodingOffload offload;
    private InMemoryVariantStorage storage;
    private RecordingCommitter committer;
    private VariantPipelineRunner runner;
    
    @BeforeEach
    void setUp() {
        uploadPool = Executors.newFixedThreadPool(3);
        VariantEncoder encoder = new VariantEncoder();
        offload = new EncodingOffload(encoder, 2, true);
        storage = new InMemoryVariantStorage();
        committer = new RecordingCommitter();
        RetryExecutor retryExecutor = new RetryExecutor((duration, token) -> { });
        FailureClassifier classifier = new FailureClassifier();
        
        runner = new VariantPipelineRunner(
            new FileValidator(),
            new ImageTransformer(),
            encoder,
            offload,
            new UploadOrchestrator(uploadPool, retryExecutor, classifier),
            storage,
            new MediaFinalizer(committer, retryExecutor, classifier),
            new RetryPolicy(2, Duration.ZERO),
            new PipelineProperties(),
            List.of()
        );
    }
    
    @AfterEach
    void tearDown() {
        offload.shutdown();
        uploadPool.shutdownNow();
    }
    
    @Test
    void completeRunUploadsEveryVariantAndCommitsOnce() {
        PipelineRun run = run(TestImages.jpegSource(400, 300), CropSpec.none(), TestPlans.smallPlan(), fields());
        List<Progress> progress = recordProgress(run);
        
        PipelineResult result = runner.run(run);
        
        PipelineResult.Success success = assertInstanceOf(PipelineResult.Success.class, result);
        assertEquals("med_1", success.recordId());
        assertEquals(run.getPlan().uploadedVariantNames(), success.variants().keySet());
        assertEquals(120, success.variants().get("md").width());
        assertEquals(90, success.variants().get("md").height());
        assertEquals(400, success.variants().get("original").width());
        assertTrue(success.placeholder().startsWith("data:image/jpeg;base64,"));
        
        assertEquals(PipelineState.COMPLETE, run.getState());
        assertEquals(4, storage.objects().size());
        assertEquals(1, committer.calls.get());
        CommitRequest committed = committer.requests.get(0);
        assertEquals(List.of("original", "md", "sm", "xs"), committed.variants().stream().map(UploadResult::name).toList());
        assertTrue(run.getResources().isReleased());
        assertTrue(run.isSourceReleased());
        
        assertEquals(100, progress.get(progress.size() - 1).overall());
        for (int i = 1; i < progress.size(); i++) {
            Progress previous = progress.get(i - 1);
            Progress current = progress.get(i);
            assertTrue(current.overall() >= previous.overall());
            assertTrue(current.generating() >= previous.generating());
            assertTrue(current.uploading() >= previous.uploading());
        }
    }
    
    @Test
    void squareCropOfLandscapeSourceYieldsSquareVariants() {
        VariantPlan plan = TestPlans.plan(new VariantSpec("lg", 2048), new VariantSpec("md", 1200));
        CropSpec crop = CropSpec.of(new CropRect(500, 0, 3000, 3000));
        PipelineRun run = run(TestImages.jpegSource(4000, 3000), crop, plan, fields());
        
        PipelineResult.Success success = assertInstanceOf(PipelineResult.Success.class, runner.run(run));
        
        UploadResult lg = success.variants().get("lg");
        UploadResult md = success.variants().get("md");
        UploadResult original = success.variants().get("original");
        assertEquals(List.of(2048, 2048), List.of(lg.width(), lg.height()));
        assertEquals(List.of(1200, 1200), List.of(md.width(), md.height()));
        assertEquals(List.of(3000, 3000), List.of(original.width(), original.height()));
    }
    
    @Test
    void recordCarriesOutputFormatRatherThanSourceType() {
        SourceImage png = SourceImage.of("diagram.png", TestImages.png(200, 100), "image/png");
        PipelineRun run = run(png, CropSpec.none(), TestPlans.smallPlan(), fields());
        
        assertInstanceOf(PipelineResult.Success.class, runner.run(run));
        
        CommitRequest committed = committer.requests.get(0);
        assertEquals("image/jpeg", committed.mimeType());
        UploadResult original = committed.variants().get(0);
        assertEquals("original", original.name());
        assertEquals("image/png", original.contentType());
        assertTrue(run.isSourceReleased());
    }
    
    @Test
    void validationFailureTouchesNoStorage() {
        PipelineRun run = run(TestImages.jpegSource(64, 64), CropSpec.none(), TestPlans.smallPlan(),
            DescriptiveFields.of("Sunset", null));
        
        PipelineResult.Failed failed = assertInstanceOf(PipelineResult.Failed.class, runner.run(run));
        
        assertEquals(ErrorKind.VALIDATION_ERROR, failed.kind());
        assertEquals("VALIDATING", failed.stage());
        assertEquals(0, storage.totalAttempts());
        assertEquals(0, committer.calls.get());
        assertTrue(run.getPendingCommit().isEmpty());
    }
    
    @Test
    void cropOutsideImageFailsTransforming() {
        PipelineRun run = run(TestImages.jpegSource(64, 64), CropSpec.of(new CropRect(32, 32, 64, 64)),
            TestPlans.smallPlan(), fields());
        
        PipelineResult.Failed failed = assertInstanceOf(PipelineResult.Failed.class, runner.run(run));
        
        assertEquals(ErrorKind.CROP_FAILED, failed.kind());
        assertEquals(0, storage.totalAttempts());
    }
    
    @Test
    void uploadFailureNeverCommits() {
        storage.failTimes("sm", 10, () -> StorageException.rejected(403, "access denied"));
        PipelineRun run = run(TestImages.jpegSource(200, 100), CropSpec.none(), TestPlans.smallPlan(), fields());
        
        PipelineResult.Failed failed = assertInstanceOf(PipelineResult.Failed.class, runner.run(run));
        
        assertEquals(ErrorKind.UPLOAD_FAILED, failed.kind());
        assertEquals("UPLOADING", failed.stage());
        assertEquals("sm", failed.variantName());
        assertEquals(0, committer.calls.get());
        assertTrue(run.getPendingCommit().isEmpty());
        assertTrue(run.getResources().isReleased());
    }
    
    @Test
    void cancelDuringGeneratingAbortsWithoutUploading() {
        PipelineRun run = run(TestImages.jpegSource(200, 100), CropSpec.none(), TestPlans.smallPlan(), fields());
        cancelOnEntering(run, PipelineState.GENERATING);
        
        PipelineResult result = runner.run(run);
        
        assertInstanceOf(PipelineResult.Aborted.class, result);
        assertEquals(PipelineState.ABORTED, run.getState());
        assertEquals(0, storage.totalAttempts());
        assertEquals(0, committer.calls.get());
        assertTrue(run.getResources().isReleased());
    }
    
    @Test
    void cancelDuringUploadingAbortsWithoutCommit() {
        PipelineRun run = run(TestImages.jpegSource(200, 100), CropSpec.none(), TestPlans.smallPlan(), fields());
        cancelOnEntering(run, PipelineState.UPLOADING);
        
        assertInstanceOf(PipelineResult.Aborted.class, runner.run(run));
        assertEquals(0, committer.calls.get());
    }
    
    @Test
    void failedCommitCanBeRetriedWithoutReuploading() {
        committer.failuresLeft.set(1);
        PipelineRun run = run(TestImages.jpegSource(200, 100), CropSpec.none(), TestPlans.smallPlan(), fields());
        
        PipelineResult.Failed failed = assertInstanceOf(PipelineResult.Failed.class, runner.run(run));
        assertEquals(ErrorKind.COMMIT_FAILED, failed.kind());
        assertEquals("FINALIZING", failed.stage());
        assertTrue(run.getPendingCommit().isPresent());
        int uploadsBefore = storage.totalAttempts();
        
        PipelineResult retried = runner.retryCommit(run);
        
        assertInstanceOf(PipelineResult.Success.class, retried);
        assertEquals(PipelineState.COMPLETE, run.getState());
        assertEquals(uploadsBefore, storage.totalAttempts());
        assertEquals(2, committer.calls.get());
        assertSame(committer.requests.get(0), committer.requests.get(1));
    }
    
    @Test
    void runCannotBeExecutedTwice() {
        PipelineRun run = run(TestImages.jpegSource(64, 64), CropSpec.none(), TestPlans.smallPlan(), fields());
        runner.run(run);
        
        assertThrows(IllegalStateException.class, () -> runner.run(run));
    }
    
    private static PipelineRun run(SourceImage source, CropSpec crop, VariantPlan plan, DescriptiveFields fields) {
        return new PipelineRun("run_test", "1700000000000-abcd1234", "sunset", source, crop, plan, fields, Instant.now());
    }
    
    private static DescriptiveFields fields() {
        return DescriptiveFields.of("Sunset", "A lake at dusk");
    }
    
    private static List<Progress> recordProgress(PipelineRun run) {
        List<Progress> progress = new CopyOnWriteArrayList<>();
        run.addListener(new PipelineRunListener() {
            @Override
            public void onProgress(PipelineRun r, Progress snapshot) {
                progress.add(snapshot);
            }
        });
        return progress;
    }
    
    private static void cancelOnEntering(PipelineRun run, PipelineState target) {
        run.addListener(new PipelineRunListener() {
            @Override
            public void onStateChanged(PipelineRun r, PipelineState state) {
                if (state == target) {
                    r.cancel();
                }
            }
        });
    }
    
    private static final class RecordingCommitter implements MediaCommitter {
        
        private final AtomicInteger calls = new AtomicInteger();
        private final AtomicInteger failuresLeft = new AtomicInteger();
        private final List<CommitRequest> requests = new ArrayList<>();
        
        @Override
        public synchronized CommitReceipt confirm(CommitRequest request) {
            calls.incrementAndGet();
            requests.add(request);
            if (failuresLeft.getAndDecrement() > 0) {
                throw new DataIntegrityViolationException("constraint violated");
            }
            return new CommitReceipt("med_1", false);
        }
    }
}
