package com.playlistmigrator.engine;

import com.playlistmigrator.error.ErrorKind;
import com.playlistmigrator.error.MigrationException;
import com.playlistmigrator.model.DiffResult;
import com.playlistmigrator.model.PlaylistRef;
import com.playlistmigrator.model.Track;
import com.playlistmigrator.model.TransferResult;
import com.playlistmigrator.progress.Phase;
import com.playlistmigrator.progress.ProgressUpdate;
import com.playlistmigrator.service.FakeMusicService;
import com.playlistmigrator.service.ServiceRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

class TransferRunnerTest {

    private TransferRunner runner;

    @BeforeEach
    void setUp() {
        Track[] tracks = new Track[10];
        Track[] catalog = new Track[10];
        for (int i = 0; i < tracks.length; i++) {
            tracks[i] = new Track("s" + i, "Song " + i, "Artist");
            catalog[i] = new Track("d" + i, "Song " + i, "Artist");
        }
        FakeMusicService source = new FakeMusicService("Source").withPlaylist("src", "Mix", tracks);
        FakeMusicService destination = new FakeMusicService("Destination").withCatalog(catalog)
                .withPlaylist("dst", "Mix", catalog);
        ServiceRegistry registry = new ServiceRegistry()
                .register("source", source)
                .register("destination", destination);
        // A one-slot queue keeps the engine waiting on the consumer
        runner = new TransferRunner(new TransferEngine(registry), 1);
    }

    @AfterEach
    void tearDown() {
        runner.close();
    }

    @Test
    void shouldDeliverEveryUpdateBeforeReturning() throws MigrationException {
        List<ProgressUpdate> received = new CopyOnWriteArrayList<>();

        TransferResult result = runner.run("source", "destination", "src", "Copy", received::add);

        Assertions.assertEquals(10, result.successCount());
        ProgressUpdate last = received.get(received.size() - 1);
        Assertions.assertEquals(Phase.DONE, last.phase());
        long searchSteps = received.stream().filter(u -> u.phase() == Phase.SEARCH_TRACKS && u.step() > 0).count();
        Assertions.assertEquals(10, searchSteps);
    }

    @Test
    void shouldKeepRunningWhenListenerFails() throws MigrationException {
        AtomicInteger calls = new AtomicInteger();

        TransferResult result = runner.run("source", "destination", "src", "Copy", update -> {
            calls.incrementAndGet();
            throw new IllegalStateException("display broke");
        });

        Assertions.assertEquals(10, result.successCount());
        Assertions.assertTrue(calls.get() > 10);
    }

    @Test
    void shouldReleaseConsumerWhenOperationFails() {
        List<ProgressUpdate> received = new CopyOnWriteArrayList<>();

        MigrationException exception = Assertions.assertThrows(
                MigrationException.class,
                () -> runner.run("source", "destination", "unknown", "Copy", received::add)
        );

        Assertions.assertEquals(ErrorKind.PLAYLIST_NOT_FOUND, exception.getKind());
        Assertions.assertFalse(received.isEmpty());
    }

    @Test
    void shouldRunDiffWithProgress() throws MigrationException {
        List<ProgressUpdate> received = new CopyOnWriteArrayList<>();

        DiffResult diff = runner.diff(new PlaylistRef("source", "src"), new PlaylistRef("destination", "dst"),
                received::add);

        Assertions.assertEquals(10, diff.matchedCount());
        Assertions.assertEquals("Comparison complete: 10 matched, 0 missing, 0 extra",
                received.get(received.size() - 1).message());
    }
}
