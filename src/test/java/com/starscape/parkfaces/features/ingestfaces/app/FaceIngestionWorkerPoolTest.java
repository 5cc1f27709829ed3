package com.starscape.parkfaces.features.ingestfaces.app;

import com.starscape.parkfaces.features.extraction.domain.ExtractionUnavailableException;
import com.starscape.parkfaces.features.photos.domain.events.PhotoStored;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FaceIngestionWorkerPoolTest {

    @Mock
    private FaceIngestionService ingestionService;

    private ThreadPoolTaskExecutor executor;
    private FaceIngestionWorkerPool workerPool;
    private final CountDownLatch release = new CountDownLatch(1);

    @BeforeEach
    void setUp() {
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(2);
        executor.initialize();
        workerPool = new FaceIngestionWorkerPool(executor, ingestionService);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        executor.shutdown();
    }

    @Test
    @DisplayName("submit returns before the task has run")
    void submitDoesNotWait() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        when(ingestionService.ingest("ph_1", "a.jpg")).thenAnswer(inv -> {
            started.countDown();
            release.await();
            return 1;
        });

        workerPool.submit("ph_1", "a.jpg");

        assertTrue(started.await(5, TimeUnit.SECONDS));
        verify(ingestionService).ingest("ph_1", "a.jpg");
    }

    @Test
    @DisplayName("Full queue rejects with IngestionBackpressureException")
    void backpressure() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        when(ingestionService.ingest(anyString(), anyString())).thenAnswer(inv -> {
            started.countDown();
            release.await();
            return 1;
        });

        workerPool.submit("ph_1", "1.jpg");
        assertTrue(started.await(5, TimeUnit.SECONDS));
        workerPool.submit("ph_2", "2.jpg");
        workerPool.submit("ph_3", "3.jpg");

        IngestionBackpressureException ex = assertThrows(IngestionBackpressureException.class,
                () -> workerPool.submit("ph_4", "4.jpg"));
        assertEquals("ph_4", ex.getPhotoId());
        assertEquals(2, workerPool.getQueuedTaskCount());
    }

    @Test
    @DisplayName("Submit after shutdown is not reported as backpressure")
    void shutdownIsNotBackpressure() {
        executor.shutdown();

        IngestionShutdownException ex = assertThrows(IngestionShutdownException.class,
                () -> workerPool.submit("ph_late", "late.jpg"));
        assertEquals("ph_late", ex.getPhotoId());
        assertDoesNotThrow(() -> workerPool.onPhotoStored(new PhotoStored("ph_late", "late.jpg", Instant.now())));
        verifyNoInteractions(ingestionService);
    }

    @Test
    @DisplayName("A failing task is logged and dropped, the pool keeps working")
    void failedTaskIsNotRetried() {
        when(ingestionService.ingest("ph_bad", "bad.jpg"))
                .thenThrow(new ExtractionUnavailableException("model down"));
        when(ingestionService.ingest("ph_ok", "ok.jpg")).thenReturn(1);

        workerPool.submit("ph_bad", "bad.jpg");
        workerPool.submit("ph_ok", "ok.jpg");

        await().atMost(Duration.ofSeconds(5))
                .untilAsserted(() -> verify(ingestionService).ingest("ph_ok", "ok.jpg"));
        verify(ingestionService, times(1)).ingest("ph_bad", "bad.jpg");
    }

    @Test
    @DisplayName("Blank arguments are rejected without queueing")
    void rejectsBlankArguments() {
        assertThrows(IllegalArgumentException.class, () -> workerPool.submit(" ", "a.jpg"));
        assertThrows(IllegalArgumentException.class, () -> workerPool.submit("ph_1", null));
        verifyNoInteractions(ingestionService);
    }

    @Test
    @DisplayName("PhotoStored event queues the photo; backpressure on it is swallowed")
    void photoStoredEvent() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        when(ingestionService.ingest(anyString(), anyString())).thenAnswer(inv -> {
            started.countDown();
            release.await();
            return 1;
        });

        workerPool.onPhotoStored(new PhotoStored("ph_1", "1.jpg", Instant.now()));
        assertTrue(started.await(5, TimeUnit.SECONDS));
        workerPool.onPhotoStored(new PhotoStored("ph_2", "2.jpg", Instant.now()));
        workerPool.onPhotoStored(new PhotoStored("ph_3", "3.jpg", Instant.now()));

        assertDoesNotThrow(() -> workerPool.onPhotoStored(new PhotoStored("ph_4", "4.jpg", Instant.now())));
        assertEquals(2, workerPool.getQueuedTaskCount());
    }
}
