package com.playlistmigrator.engine;

import com.playlistmigrator.error.EmptyResultSetException;
import com.playlistmigrator.error.ErrorKind;
import com.playlistmigrator.error.MigrationException;
import com.playlistmigrator.error.PlaylistNotFoundException;
import com.playlistmigrator.matching.TrackIndex;
import com.playlistmigrator.model.DiffResult;
import com.playlistmigrator.model.Playlist;
import com.playlistmigrator.model.PlaylistExport;
import com.playlistmigrator.model.PlaylistRef;
import com.playlistmigrator.model.Track;
import com.playlistmigrator.model.TrackMatch;
import com.playlistmigrator.model.TransferResult;
import com.playlistmigrator.progress.ProgressChannel;
import com.playlistmigrator.progress.ProgressUpdate;
import com.playlistmigrator.progress.ProgressUpdates;
import com.playlistmigrator.service.MusicService;
import com.playlistmigrator.service.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Migrates playlists between services (run) and reconciles two existing playlists (diff).
 * <p>
 * Both operations execute on the calling thread, one service call at a time. Progress goes to an optional
 * {@link ProgressChannel}, which is always closed when the operation returns or fails. Interrupting the calling
 * thread cancels the operation with {@link ErrorKind#CANCELLED}; partial results are discarded.
 */
public class TransferEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(TransferEngine.class);

    public static final String DEFAULT_DESCRIPTION_PREFIX = "Migrated from";

    private final ServiceRegistry services;
    private final String descriptionPrefix;

    public TransferEngine(ServiceRegistry services) {
        this(services, DEFAULT_DESCRIPTION_PREFIX);
    }

    public TransferEngine(ServiceRegistry services, String descriptionPrefix) {
        this.services = services;
        this.descriptionPrefix = descriptionPrefix;
    }

    /**
     * Copies a playlist from the source service to a new playlist on the destination service.
     * @param sourceLabel     Label of the source service.
     * @param destLabel       Label of the destination service.
     * @param sourceIdOrName  The source playlist ID, or its exact name.
     * @param destName        The name of the playlist to create; the source name is used when blank.
     * @param progress        Where to publish progress, may be {@code null}. Closed on return.
     * @return The per-track breakdown and the created playlist.
     * @throws EmptyResultSetException if no track could be matched; nothing is created then.
     * @throws MigrationException      if a required phase fails or the thread is interrupted.
     */
    public TransferResult run(String sourceLabel, String destLabel, String sourceIdOrName, String destName,
                              ProgressChannel progress) throws MigrationException {
        try {
            MusicService source = services.resolve(sourceLabel);
            MusicService destination = services.resolve(destLabel);
            return transfer(source, destination, sourceIdOrName, destName, progress);
        } finally {
            closeChannel(progress);
        }
    }

    /**
     * Compares two playlists, possibly on different services.
     * @param sourceRef      The playlist treated as the reference.
     * @param destinationRef The playlist checked against it.
     * @param progress       Where to publish progress, may be {@code null}. Closed on return.
     * @return Matched count, tracks missing from the destination and tracks only in the destination.
     * @throws MigrationException if a label is invalid, either playlist cannot be fetched, or the thread is interrupted.
     */
    public DiffResult diff(PlaylistRef sourceRef, PlaylistRef destinationRef, ProgressChannel progress)
            throws MigrationException {
        try {
            MusicService source = services.resolve(sourceRef.serviceLabel());
            MusicService destination = services.resolve(destinationRef.serviceLabel());
            return compare(source, destination, sourceRef.playlistId(), destinationRef.playlistId(), progress);
        } finally {
            closeChannel(progress);
        }
    }

    TransferResult transfer(MusicService source, MusicService destination, String sourceIdOrName, String destName,
                            ProgressChannel progress) throws MigrationException {
        if (sourceIdOrName == null || sourceIdOrName.isBlank()) {
            throw new MigrationException(ErrorKind.MISSING_ARGUMENT, "source playlist ID or name");
        }
        LOGGER.info("Starting transfer of '{}' from {} to {}", sourceIdOrName, source.name(), destination.name());

        // Resolve + fetch
        publish(progress, ProgressUpdates.resolvingSource(sourceIdOrName, source.name()));
        PlaylistExport sourceExport = resolveSource(source, sourceIdOrName, progress);
        int total = sourceExport.size();
        publish(progress, ProgressUpdates.foundPlaylist(sourceExport));

        // Search, one track at a time; a miss is recorded, not fatal
        publish(progress, ProgressUpdates.searchingTracks(total, destination.name()));
        List<TrackMatch> matches = new ArrayList<>(total);
        int step = 0;
        for (Track track : sourceExport.tracks()) {
            step++;
            publish(progress, ProgressUpdates.searchingTrack(step, total, track));
            checkCancelled();
            try {
                Track found = destination.searchTrack(track.title(), track.artist());
                matches.add(TrackMatch.found(track, found));
            } catch (MigrationException e) {
                if (e.is(ErrorKind.CANCELLED)) {
                    throw e;
                }
                LOGGER.warn("Track not found on {}: '{}' by '{}' ({})",
                        destination.name(), track.title(), track.artist(), e.getMessage());
                matches.add(TrackMatch.notFound(track, e));
            }
        }

        TransferResult result = TransferResult.of(sourceExport, null, matches);
        LOGGER.info("Matched {}/{} tracks ({}%)", result.successCount(), total,
                String.format("%.1f", result.successRate()));

        if (result.successCount() == 0) {
            throw new EmptyResultSetException(
                    String.format("no tracks were matched out of %d - cannot create empty playlist", total), result);
        }

        // Create
        publish(progress, ProgressUpdates.creatingPlaylist(destination.name()));
        String name = destName == null || destName.isBlank() ? sourceExport.playlist().name() : destName;
        String description = String.format("%s %s: %s", descriptionPrefix, source.name(), sourceExport.playlist().name());
        List<Track> matchedTracks = result.matchedTracks();
        PlaylistExport toImport = new PlaylistExport(
                new Playlist(null, name, description, false, matchedTracks.size()), matchedTracks);

        checkCancelled();
        Playlist created;
        try {
            created = destination.importPlaylist(toImport);
        } catch (MigrationException e) {
            throw rethrowUnlessCancelled(e, ErrorKind.API_REQUEST_FAILED, "failed to create playlist '" + name + "'");
        }
        LOGGER.info("Created playlist '{}' (ID: {}) on {}", created.name(), created.id(), destination.name());
        publish(progress, ProgressUpdates.playlistCreated(created));
        publish(progress, ProgressUpdates.transferComplete(result.successCount(), total));

        return result.withDestination(created);
    }

    private PlaylistExport resolveSource(MusicService source, String idOrName, ProgressChannel progress)
            throws MigrationException {
        checkCancelled();
        try {
            return source.exportPlaylist(idOrName);
        } catch (MigrationException byIdFailure) {
            if (byIdFailure.is(ErrorKind.CANCELLED)) {
                throw byIdFailure;
            }
            LOGGER.info("Source '{}' not found by ID, searching by name ({})", idOrName, byIdFailure.getMessage());
        }

        publish(progress, ProgressUpdates.searchingByName(idOrName));
        checkCancelled();
        List<Playlist> playlists;
        try {
            playlists = source.getPlaylists();
        } catch (MigrationException e) {
            throw rethrowUnlessCancelled(e, ErrorKind.API_REQUEST_FAILED, "failed to get playlists");
        }

        Optional<Playlist> byName = playlists.stream()
                .filter(p -> idOrName.equals(p.name()))
                .findFirst();
        if (byName.isEmpty()) {
            throw new PlaylistNotFoundException("no playlist found with name '" + idOrName + "'");
        }

        publish(progress, ProgressUpdates.fetchingSource(1, 1, source.name()));
        checkCancelled();
        try {
            return source.exportPlaylist(byName.get().id());
        } catch (MigrationException e) {
            throw rethrowUnlessCancelled(e, ErrorKind.API_REQUEST_FAILED, "failed to export playlist");
        }
    }

    DiffResult compare(MusicService source, MusicService destination, String sourceId, String destId,
                       ProgressChannel progress) throws MigrationException {
        LOGGER.info("Comparing {} playlist '{}' with {} playlist '{}'",
                source.name(), sourceId, destination.name(), destId);

        publish(progress, ProgressUpdates.fetchingSource(1, 2, source.name()));
        PlaylistExport sourceExport = fetchForDiff(source, sourceId, "source");
        publish(progress, ProgressUpdates.fetchingDestination(2, 2, destination.name()));
        PlaylistExport destExport = fetchForDiff(destination, destId, "destination");

        publish(progress, ProgressUpdates.buildingLookups(1, 2));
        TrackIndex destIndex = TrackIndex.of(destExport.tracks());
        TrackIndex sourceIndex = TrackIndex.of(sourceExport.tracks());

        publish(progress, ProgressUpdates.comparingTracks(2, 2));
        List<Track> missingInDest = new ArrayList<>();
        int matchedCount = 0;
        for (Track sourceTrack : sourceExport.tracks()) {
            if (destIndex.contains(sourceTrack)) {
                matchedCount++;
            } else {
                missingInDest.add(sourceTrack);
            }
        }

        List<Track> extraInDest = new ArrayList<>();
        for (Track destTrack : destExport.tracks()) {
            if (!sourceIndex.contains(destTrack)) {
                extraInDest.add(destTrack);
            }
        }

        LOGGER.info("Comparison done: {} matched, {} missing from destination, {} extra in destination",
                matchedCount, missingInDest.size(), extraInDest.size());
        publish(progress, ProgressUpdates.diffComplete(matchedCount, missingInDest.size(), extraInDest.size()));
        return new DiffResult(sourceExport, destExport, matchedCount, missingInDest, extraInDest);
    }

    private PlaylistExport fetchForDiff(MusicService service, String playlistId, String role)
            throws MigrationException {
        checkCancelled();
        try {
            return service.exportPlaylist(playlistId);
        } catch (MigrationException e) {
            throw rethrowUnlessCancelled(e, ErrorKind.PLAYLIST_NOT_FOUND,
                    String.format("failed to export %s playlist '%s' from %s", role, playlistId, service.name()));
        }
    }

    private static MigrationException rethrowUnlessCancelled(MigrationException e, ErrorKind kind, String detail) {
        if (e.is(ErrorKind.CANCELLED)) {
            return e;
        }
        return new MigrationException(kind, detail + ": " + e.getMessage(), e);
    }

    private static void publish(ProgressChannel progress, ProgressUpdate update) throws MigrationException {
        if (progress == null) {
            return;
        }
        try {
            progress.publish(update);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MigrationException(ErrorKind.CANCELLED, "interrupted while reporting progress", e);
        }
    }

    private static void checkCancelled() throws MigrationException {
        if (Thread.currentThread().isInterrupted()) {
            throw new MigrationException(ErrorKind.CANCELLED, "transfer interrupted");
        }
    }

    private static void closeChannel(ProgressChannel progress) {
        if (progress != null) {
            progress.close();
        }
    }
}
