package com.starscape.rapidvariant.features.generatevariants.app;

import com.starscape.rapidvariant.common.concurrent.CancellationToken;
import com.starscape.rapidvariant.common.exception.AbortedException;
import com.starscape.rapidvariant.common.exception.ErrorKind;
import com.starscape.rapidvariant.common.exception.PipelineException;
import com.starscape.rapidvariant.features.generatevariants.domain.EncodeRequest;
import com.starscape.rapidvariant.features.generatevariants.domain.EncodedVariant;
import com.starscape.rapidvariant.features.generatevariants.domain.ImageFormat;
import com.starscape.rapidvariant.features.generatevariants.domain.SourceRaster;
import com.starscape.rapidvariant.features.generatevariants.domain.VariantSpec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EncodingOffloadTest {
    
    private static final EncodeRequest REQUEST =
        EncodeRequest.sized(new VariantSpec("sm", 64), ImageFormat.JPEG, 85);
    
    private VariantEncoder encoder;
    private SourceRaster raster;
    private CancellationToken token;
    private EncodingOffload offload;
    
    @BeforeEach
    void setUp() {
        encoder = mock(VariantEncoder.class);
        raster = new SourceRaster(new BufferedImage(128, 128, BufferedImage.TYPE_INT_RGB), ImageFormat.JPEG);
        token = new CancellationToken();
    }
    
    @AfterEach
    void tearDown() {
        if (offload != null) {
            offload.shutdown();
        }
    }
    
    @Test
    void encodesOnWorkerThread() {
        AtomicReference<String> thread = new AtomicReference<>();
        when(encoder.encode(any(), any())).thenAnswer(invocation -> {
            thread.set(Thread.currentThread().getName());
            return variant();
        });
        offload = new EncodingOffload(encoder, 2, true);
        
        EncodedVariant result = offload.submit(raster, REQUEST, token).join();
        
        assertEquals("sm", result.name());
        assertTrue(thread.get().startsWith("variant-encoder-"));
        assertEquals(0, offload.pendingCount());
        assertEquals(2, offload.getWorkerCount());
    }
    
    @Test
    void encoderFailureCompletesFutureExceptionally() {
        when(encoder.encode(any(), any())).thenThrow(
            new PipelineException(ErrorKind.ENCODING_FAILED, "GENERATING", "sm", "boom", null));
        offload = new EncodingOffload(encoder, 1, true);
        
        CompletionException e = assertThrows(CompletionException.class,
            () -> offload.submit(raster, REQUEST, token).join());
        
        assertInstanceOf(PipelineException.class, e.getCause());
    }
    
    @Test
    void cancellationResolvesPendingAsAbortedAndDropsLateReply() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(encoder.encode(any(), any())).thenAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return variant();
        });
        offload = new EncodingOffload(encoder, 1, true);
        
        CompletableFuture<EncodedVariant> future = offload.submit(raster, REQUEST, token);
        assertTrue(started.await(5, TimeUnit.SECONDS));
        token.cancel();
        
        CompletionException e = assertThrows(CompletionException.class, future::join);
        assertInstanceOf(AbortedException.class, e.getCause());
        assertEquals(0, offload.pendingCount());
        
        release.countDown();
        // the late success must not overwrite the aborted outcome
        await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(2))
            .until(future::isCompletedExceptionally);
    }
    
    @Test
    void queuedRequestIsSkippedAfterCancel() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(encoder.encode(any(), any())).thenAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return variant();
        });
        offload = new EncodingOffload(encoder, 1, true);
        CancellationToken other = new CancellationToken();
        
        CompletableFuture<EncodedVariant> running = offload.submit(raster, REQUEST, other);
        assertTrue(started.await(5, TimeUnit.SECONDS));
        CompletableFuture<EncodedVariant> queued = offload.submit(raster, REQUEST, token);
        token.cancel();
        release.countDown();
        
        assertEquals("sm", running.join().name());
        assertThrows(CompletionException.class, queued::join);
        verify(encoder, times(1)).encode(any(), any());
    }
    
    @Test
    void alreadyCancelledTokenNeverReachesEncoder() {
        offload = new EncodingOffload(encoder, 1, true);
        token.cancel();
        
        CompletableFuture<EncodedVariant> future = offload.submit(raster, REQUEST, token);
        
        assertTrue(future.isCompletedExceptionally());
        verify(encoder, never()).encode(any(), any());
    }
    
    @Test
    void disabledPoolEncodesOnCaller() {
        AtomicReference<Thread> thread = new AtomicReference<>();
        when(encoder.encode(any(), any())).thenAnswer(invocation -> {
            thread.set(Thread.currentThread());
            return variant();
        });
        offload = new EncodingOffload(encoder, 2, false);
        
        CompletableFuture<EncodedVariant> future = offload.submit(raster, REQUEST, token);
        
        assertTrue(future.isDone());
        assertSame(Thread.currentThread(), thread.get());
        assertFalse(offload.isPoolAvailable());
    }
    
    @Test
    void shutdownAbortsOutstandingAndFallsBackToCaller() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        when(encoder.encode(any(), any())).thenAnswer(invocation -> {
            started.countDown();
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return variant();
        }).thenReturn(variant());
        offload = new EncodingOffload(encoder, 1, true);
        
        CompletableFuture<EncodedVariant> future = offload.submit(raster, REQUEST, token);
        assertTrue(started.await(5, TimeUnit.SECONDS));
        offload.shutdown();
        
        CompletionException e = assertThrows(CompletionException.class, future::join);
        assertInstanceOf(AbortedException.class, e.getCause());
        assertFalse(offload.isPoolAvailable());
        assertTrue(offload.submit(raster, REQUEST, token).isDone());
    }
    
    private static EncodedVariant variant() {
        return new EncodedVariant("sm", new byte[] {1, 2, 3}, 64, 64, ImageFormat.JPEG);
    }
}
