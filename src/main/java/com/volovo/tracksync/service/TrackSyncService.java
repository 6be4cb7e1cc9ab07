package com.volovo.tracksync.service;

import com.volovo.tracksync.config.AsyncConfig;
import com.volovo.tracksync.config.TrackSyncProperties;
import com.volovo.tracksync.dto.DeviceSyncResult;
import com.volovo.tracksync.dto.SyncReport;
import com.volovo.tracksync.exception.AuthenticationException;
import com.volovo.tracksync.fetch.ChunkedFetcher;
import com.volovo.tracksync.fetch.FetchedWindow;
import com.volovo.tracksync.model.TrackPoint;
import com.volovo.tracksync.util.PortalTimes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * Ingestion loop: portal windows → idempotent writer → sync cursor.
 *
 * Per device, windows are fetched in time order and buffered points are flushed
 * every {@code buffer-limit} points and once at the end. Only after the last flush
 * succeeded does the cursor move, and only up to the end of the unbroken run of
 * successful windows. A rerun after any failure therefore starts at the first
 * window that was not stored and relies on the writer to absorb the overlap.
 *
 * A device failing never stops the others. Failing to log in stops the run.
 */
@Service
@Slf4j
public class TrackSyncService {

    private final ChunkedFetcher fetcher;
    private final IdempotentPointWriter writer;
    private final SyncCursorStore cursorStore;
    private final SyncEventPublisher eventPublisher;
    private final DeviceCatalogService deviceCatalog;
    private final TrackSyncProperties.Sync sync;
    private final Executor syncExecutor;

    // One run at a time, whether started by the CLI, the scheduler or HTTP
    private final ReentrantLock runLock = new ReentrantLock();

    public TrackSyncService(ChunkedFetcher fetcher,
                            IdempotentPointWriter writer,
                            SyncCursorStore cursorStore,
                            SyncEventPublisher eventPublisher,
                            DeviceCatalogService deviceCatalog,
                            TrackSyncProperties properties,
                            @Qualifier(AsyncConfig.SYNC_EXECUTOR) Executor syncExecutor) {
        this.fetcher = fetcher;
        this.writer = writer;
        this.cursorStore = cursorStore;
        this.eventPublisher = eventPublisher;
        this.deviceCatalog = deviceCatalog;
        this.sync = properties.getSync();
        this.syncExecutor = syncExecutor;
    }

    /**
     * Syncs every device of {@code command}. Never throws for device-level failures;
     * they are reported per device.
     *
     * @throws IllegalStateException when another run is in progress
     */
    public SyncReport sync(SyncCommand command) {
        if (!runLock.tryLock()) {
            throw new IllegalStateException("A sync run is already in progress");
        }
        try {
            return runLocked(command);
        } finally {
            runLock.unlock();
        }
    }

    public boolean isRunning() {
        return runLock.isLocked();
    }

    private SyncReport runLocked(SyncCommand command) {
        LocalDateTime startedAt = LocalDateTime.now();
        int chunkHours = Optional.ofNullable(command.chunkHours()).orElse(sync.getChunkHours());
        log.info("Sync run started: {} device(s), chunk {}h{}", command.deviceIds().size(), chunkHours,
                command.resetState() ? ", cursors reset" : "");

        AtomicReference<String> authError = new AtomicReference<>();
        List<DeviceSyncResult> results = sync.getParallelism() > 1
                ? syncConcurrently(command, chunkHours, authError)
                : syncSequentially(command, chunkHours, authError);

        SyncReport report = SyncReport.builder()
                .startedAt(startedAt)
                .finishedAt(LocalDateTime.now())
                .devices(results)
                .authenticationError(authError.get())
                .build();

        deviceCatalog.evict();
        eventPublisher.runFinished(report);
        log.info("Sync run finished: {} device(s), {} failed, fetched {}, inserted {}, matched {}, exit code {}",
                results.size(), report.getFailedDevices(), report.getTotalFetched(),
                report.getTotalInserted(), report.getTotalMatched(), report.exitCode());
        return report;
    }

    private List<DeviceSyncResult> syncSequentially(SyncCommand command, int chunkHours,
                                                    AtomicReference<String> authError) {
        List<DeviceSyncResult> results = new ArrayList<>();
        for (Long deviceId : command.deviceIds()) {
            syncGuarded(deviceId, command, chunkHours, authError).ifPresent(results::add);
            if (authError.get() != null) {
                break;
            }
        }
        return results;
    }

    // Devices run side by side; each device's windows stay in order on its own thread.
    private List<DeviceSyncResult> syncConcurrently(SyncCommand command, int chunkHours,
                                                    AtomicReference<String> authError) {
        List<CompletableFuture<Optional<DeviceSyncResult>>> futures = command.deviceIds().stream()
                .map(deviceId -> CompletableFuture.supplyAsync(
                        () -> syncGuarded(deviceId, command, chunkHours, authError), syncExecutor))
                .toList();

        List<DeviceSyncResult> results = new ArrayList<>();
        for (CompletableFuture<Optional<DeviceSyncResult>> future : futures) {
            try {
                future.join().ifPresent(results::add);
            } catch (CompletionException e) {
                log.error("Device task ended abnormally", e.getCause());
            }
        }
        return results;
    }

    private Optional<DeviceSyncResult> syncGuarded(long deviceId, SyncCommand command, int chunkHours,
                                                   AtomicReference<String> authError) {
        if (authError.get() != null) {
            log.info("Device {} skipped: no portal session", deviceId);
            return Optional.empty();
        }
        try {
            DeviceSyncResult result = syncDevice(deviceId, command, chunkHours);
            eventPublisher.deviceFinished(result);
            return Optional.of(result);
        } catch (AuthenticationException e) {
            log.error("Authentication failed ({}), stopping the run: {}", e.getReason(), e.getMessage());
            authError.compareAndSet(null, e.getReason() + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * @throws AuthenticationException when no portal session can be obtained
     */
    DeviceSyncResult syncDevice(long deviceId, SyncCommand command, int chunkHours) {
        DeviceProgress progress = new DeviceProgress(deviceId);
        try {
            LocalDateTime from = resolveFrom(deviceId, command);
            LocalDateTime to = command.to() != null ? command.to() : PortalTimes.nowSeconds();
            progress.from = from;
            progress.to = to;
            if (!to.isAfter(from)) {
                log.info("Device {}: up to date at {}", deviceId, PortalTimes.format(from));
                return progress.result(DeviceSyncResult.Status.OK, null);
            }

            log.info("Device {}: syncing {} → {}", deviceId, PortalTimes.format(from), PortalTimes.format(to));
            String runKey = deviceId + "|" + PortalTimes.format(from) + "|" + PortalTimes.format(to);
            LocalDateTime covered = from;
            boolean unbroken = true;
            List<PendingPoint> buffer = new ArrayList<>();

            try (Stream<FetchedWindow> windows = fetcher.fetchRange(deviceId, from, to, chunkHours)) {
                Iterator<FetchedWindow> it = windows.iterator();
                while (it.hasNext()) {
                    FetchedWindow window = it.next();
                    progress.windows++;
                    if (window.isFailed()) {
                        progress.failedWindows++;
                        unbroken = false;
                        continue;
                    }
                    progress.skipped += window.skipped();
                    progress.fetched += window.points().size();
                    for (TrackPoint point : window.points()) {
                        buffer.add(new PendingPoint(point, window.window(), runKey));
                    }
                    if (buffer.size() >= sync.getBufferLimit()) {
                        progress.add(writer.writeBatch(buffer));
                        buffer.clear();
                    }
                    if (unbroken) {
                        covered = window.window().to();
                    }
                }
            }
            progress.add(writer.writeBatch(buffer));

            if (rewinds(command)) {
                cursorStore.rewind(deviceId, covered);
                progress.cursorAdvancedTo = covered;
            } else if (covered.isAfter(from)) {
                cursorStore.advance(deviceId, covered);
                progress.cursorAdvancedTo = covered;
            }

            DeviceSyncResult.Status status;
            if (progress.failedWindows == 0) {
                status = DeviceSyncResult.Status.OK;
            } else if (progress.failedWindows < progress.windows) {
                status = DeviceSyncResult.Status.PARTIAL;
            } else {
                status = DeviceSyncResult.Status.FAILED;
            }
            log.info("Device {}: {} window(s), {} failed, fetched {}, inserted {}, matched {}, skipped {}",
                    deviceId, progress.windows, progress.failedWindows, progress.fetched,
                    progress.written.inserted(), progress.written.matched(), progress.skipped);
            return progress.result(status, status == DeviceSyncResult.Status.FAILED ? "every window failed" : null);

        } catch (AuthenticationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Device {}: sync failed, cursor left unchanged", deviceId, e);
            return progress.result(DeviceSyncResult.Status.FAILED, e.getMessage());
        }
    }

    // Nothing is written here: a reset only takes effect once the run has stored its points
    private LocalDateTime resolveFrom(long deviceId, SyncCommand command) {
        if (command.from() != null) {
            return command.from();
        }
        return command.resetState() ? PortalTimes.startOfCurrentMonth() : cursorStore.read(deviceId);
    }

    private static boolean rewinds(SyncCommand command) {
        return command.resetState() && command.from() == null;
    }

    /** Mutable tally for one device while its windows are processed. */
    private static final class DeviceProgress {

        private final long deviceId;
        private LocalDateTime from;
        private LocalDateTime to;
        private int windows;
        private int failedWindows;
        private int fetched;
        private int skipped;
        private WriteResult written = WriteResult.EMPTY;
        private LocalDateTime cursorAdvancedTo;

        private DeviceProgress(long deviceId) {
            this.deviceId = deviceId;
        }

        private void add(WriteResult result) {
            written = written.plus(result);
        }

        private DeviceSyncResult result(DeviceSyncResult.Status status, String error) {
            return DeviceSyncResult.builder()
                    .deviceId(deviceId)
                    .status(status)
                    .from(from)
                    .to(to)
                    .windows(windows)
                    .failedWindows(failedWindows)
                    .fetched(fetched)
                    .skipped(skipped)
                    .matched(written.matched())
                    .inserted(written.inserted())
                    .modified(written.modified())
                    .conflicts(written.conflicts())
                    .cursorAdvancedTo(cursorAdvancedTo)
                    .error(error)
                    .build();
        }
    }
}
