package com.playlistmigrator.service.youtube;

import com.google.api.client.auth.oauth2.BearerToken;
import com.google.api.client.auth.oauth2.ClientParametersAuthentication;
import com.google.api.client.auth.oauth2.Credential;
import com.google.api.client.auth.oauth2.TokenResponseException;
import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.services.youtube.YouTube;
import com.google.api.services.youtube.model.PlaylistItem;
import com.google.api.services.youtube.model.PlaylistItemListResponse;
import com.google.api.services.youtube.model.PlaylistItemSnippet;
import com.google.api.services.youtube.model.PlaylistListResponse;
import com.google.api.services.youtube.model.PlaylistSnippet;
import com.google.api.services.youtube.model.PlaylistStatus;
import com.google.api.services.youtube.model.ResourceId;
import com.google.api.services.youtube.model.SearchListResponse;
import com.google.api.services.youtube.model.SearchResult;
import com.playlistmigrator.auth.CredentialTokenSource;
import com.playlistmigrator.auth.NotifyingTokenSource;
import com.playlistmigrator.auth.TokenRefreshListener;
import com.playlistmigrator.auth.TokenSourceRequestInitializer;
import com.playlistmigrator.error.ErrorKind;
import com.playlistmigrator.error.MigrationException;
import com.playlistmigrator.error.PlaylistNotFoundException;
import com.playlistmigrator.error.TrackNotFoundException;
import com.playlistmigrator.model.Playlist;
import com.playlistmigrator.model.PlaylistExport;
import com.playlistmigrator.model.Track;
import com.playlistmigrator.service.ImportBatches;
import com.playlistmigrator.service.MusicService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link MusicService} over the YouTube Data API v3. A track is a video; its artist is the uploading channel.
 */
public class YouTubePlaylistService implements MusicService {

    private static final Logger LOGGER = LoggerFactory.getLogger(YouTubePlaylistService.class);

    static final String APPLICATION_NAME = "Playlist Migrator";
    static final String DEFAULT_TOKEN_URI = "https://oauth2.googleapis.com/token";
    private static final long PAGE_SIZE = 50L;
    private static final long SEARCH_RESULTS = 5L;
    private static final JsonFactory JSON_FACTORY = GsonFactory.getDefaultInstance();

    private final HttpTransport transport;
    private final TokenRefreshListener refreshListener;
    private final int batchSize;

    private volatile YouTube youtubeService;

    /**
     * @param transport       The HTTP transport for API and token calls.
     * @param refreshListener Told about each new access token, may be {@code null}.
     * @param batchSize       How many videos to add between progress log lines.
     */
    public YouTubePlaylistService(HttpTransport transport, TokenRefreshListener refreshListener, int batchSize) {
        this.transport = transport;
        this.refreshListener = refreshListener;
        this.batchSize = batchSize;
    }

    @Override
    public String name() {
        return "YouTube";
    }

    /**
     * Expects {@code access_token}; {@code refresh_token}, {@code client_id}, {@code client_secret},
     * {@code token_uri} and {@code expires_in} enable refreshing.
     */
    @Override
    public void authenticate(Map<String, String> credentials) throws MigrationException {
        String accessToken = credentials.get("access_token");
        if (accessToken == null || accessToken.isEmpty()) {
            throw new MigrationException(ErrorKind.NOT_AUTHENTICATED, "access_token is required");
        }

        Credential.Builder builder = new Credential.Builder(BearerToken.authorizationHeaderAccessMethod())
                .setTransport(transport)
                .setJsonFactory(JSON_FACTORY)
                .setTokenServerEncodedUrl(credentials.getOrDefault("token_uri", DEFAULT_TOKEN_URI));
        String clientId = credentials.get("client_id");
        if (clientId != null) {
            builder.setClientAuthentication(new ClientParametersAuthentication(clientId, credentials.get("client_secret")));
        }
        Credential credential = builder.build()
                .setAccessToken(accessToken)
                .setRefreshToken(credentials.get("refresh_token"));
        String expiresIn = credentials.get("expires_in");
        if (expiresIn != null) {
            try {
                credential.setExpiresInSeconds(Long.parseLong(expiresIn));
            } catch (NumberFormatException e) {
                throw new MigrationException(ErrorKind.INVALID_ARGUMENT, "expires_in is not a number: " + expiresIn, e);
            }
        }

        TokenSourceRequestInitializer initializer = new TokenSourceRequestInitializer(
                new NotifyingTokenSource(new CredentialTokenSource(credential), refreshListener));
        youtubeService = new YouTube.Builder(transport, JSON_FACTORY, initializer)
                .setApplicationName(APPLICATION_NAME)
                .build();
        LOGGER.debug("YouTube client initialized");
    }

    /**
     * Retrieves the playlists of the authenticated user, 50 per page.
     */
    @Override
    public List<Playlist> getPlaylists() throws MigrationException {
        YouTube youtube = client();
        List<Playlist> allPlaylists = new ArrayList<>();
        String nextPageToken = null;
        try {
            do {
                YouTube.Playlists.List request = youtube.playlists()
                        .list(List.of("snippet", "contentDetails", "status"));
                request.setMine(true);
                request.setMaxResults(PAGE_SIZE);
                request.setPageToken(nextPageToken);

                PlaylistListResponse response = request.execute();
                if (response.getItems() != null) {
                    for (com.google.api.services.youtube.model.Playlist item : response.getItems()) {
                        allPlaylists.add(toPlaylist(item));
                    }
                }
                nextPageToken = response.getNextPageToken();
            } while (nextPageToken != null);
        } catch (IOException e) {
            throw translate(e, "failed to list playlists");
        }
        LOGGER.debug("Fetched {} YouTube playlists", allPlaylists.size());
        return allPlaylists;
    }

    @Override
    public Playlist getPlaylist(String playlistId) throws MigrationException {
        YouTube youtube = client();
        PlaylistListResponse response;
        try {
            YouTube.Playlists.List request = youtube.playlists()
                    .list(List.of("snippet", "contentDetails", "status"));
            request.setId(List.of(playlistId));
            response = request.execute();
        } catch (IOException e) {
            throw translate(e, "failed to get playlist " + playlistId);
        }
        if (response.getItems() == null || response.getItems().isEmpty()) {
            throw new PlaylistNotFoundException(playlistId);
        }
        return toPlaylist(response.getItems().get(0));
    }

    /**
     * Reads the playlist and all of its items, in playlist order. Items without a video ID are skipped.
     */
    @Override
    public PlaylistExport exportPlaylist(String playlistId) throws MigrationException {
        Playlist playlist = getPlaylist(playlistId);
        YouTube youtube = client();
        List<Track> tracks = new ArrayList<>();
        String nextPageToken = null;
        try {
            do {
                YouTube.PlaylistItems.List request = youtube.playlistItems()
                        .list(List.of("snippet", "contentDetails"));
                request.setPlaylistId(playlistId);
                request.setMaxResults(PAGE_SIZE);
                request.setPageToken(nextPageToken);

                PlaylistItemListResponse response = request.execute();
                if (response.getItems() != null) {
                    for (PlaylistItem item : response.getItems()) {
                        Track track = toTrack(item);
                        if (track == null) {
                            LOGGER.debug("Skipping item {} without a video in playlist {}", item.getId(), playlistId);
                        } else {
                            tracks.add(track);
                        }
                    }
                }
                nextPageToken = response.getNextPageToken();
            } while (nextPageToken != null);
        } catch (IOException e) {
            throw translate(e, "failed to get items of playlist " + playlistId);
        }
        return new PlaylistExport(playlist.withTrackCount(tracks.size()), tracks);
    }

    /**
     * Creates the playlist, then adds each video. The Data API inserts one item per call, so batches only pace the
     * progress log.
     */
    @Override
    public Playlist importPlaylist(PlaylistExport export) throws MigrationException {
        YouTube youtube = client();
        Playlist requested = export.playlist();

        PlaylistSnippet playlistSnippet = new PlaylistSnippet();
        playlistSnippet.setTitle(requested.name());
        playlistSnippet.setDescription(requested.description());

        PlaylistStatus playlistStatus = new PlaylistStatus();
        playlistStatus.setPrivacyStatus(requested.publicVisible() ? "public" : "private");

        com.google.api.services.youtube.model.Playlist playlist = new com.google.api.services.youtube.model.Playlist();
        playlist.setSnippet(playlistSnippet);
        playlist.setStatus(playlistStatus);

        com.google.api.services.youtube.model.Playlist created;
        try {
            created = youtube.playlists().insert(List.of("snippet", "status"), playlist).execute();
        } catch (IOException e) {
            throw translate(e, "failed to create playlist '" + requested.name() + "'");
        }
        LOGGER.info("Created YouTube playlist '{}' (ID: {})", requested.name(), created.getId());

        int added = 0;
        for (List<Track> batch : ImportBatches.partition(export.tracks(), batchSize)) {
            for (Track track : batch) {
                try {
                    addVideoToPlaylist(youtube, created.getId(), track.id());
                } catch (IOException e) {
                    throw translate(e, "failed to add video " + track.id() + " to playlist " + created.getId());
                }
                added++;
            }
            LOGGER.debug("Added {}/{} videos to playlist {}", added, export.size(), created.getId());
        }
        return new Playlist(created.getId(), requested.name(), requested.description(),
                requested.publicVisible(), added);
    }

    private static void addVideoToPlaylist(YouTube youtube, String playlistId, String videoId) throws IOException {
        ResourceId resourceId = new ResourceId();
        resourceId.setKind("youtube#video");
        resourceId.setVideoId(videoId);

        PlaylistItemSnippet playlistItemSnippet = new PlaylistItemSnippet();
        playlistItemSnippet.setPlaylistId(playlistId);
        playlistItemSnippet.setResourceId(resourceId);

        PlaylistItem playlistItem = new PlaylistItem();
        playlistItem.setSnippet(playlistItemSnippet);

        youtube.playlistItems().insert(List.of("snippet"), playlistItem).execute();
    }

    /**
     * @return The first video for {@code "<title> <artist>"}.
     */
    @Override
    public Track searchTrack(String title, String artist) throws MigrationException {
        YouTube youtube = client();
        String query = (title + " " + artist).trim();
        SearchListResponse response;
        try {
            YouTube.Search.List request = youtube.search().list(List.of("snippet"));
            request.setQ(query);
            request.setType(List.of("video"));
            request.setMaxResults(SEARCH_RESULTS);
            response = request.execute();
        } catch (IOException e) {
            MigrationException failure = translate(e, "search for '" + query + "' failed");
            if (failure.is(ErrorKind.PLAYLIST_NOT_FOUND)) {
                throw new TrackNotFoundException(query, e);
            }
            throw failure;
        }
        if (response.getItems() != null) {
            for (SearchResult result : response.getItems()) {
                if (result.getId() != null && result.getId().getVideoId() != null) {
                    String channel = result.getSnippet() == null ? null : result.getSnippet().getChannelTitle();
                    String videoTitle = result.getSnippet() == null ? title : result.getSnippet().getTitle();
                    return new Track(result.getId().getVideoId(), videoTitle, channel);
                }
            }
        }
        throw new TrackNotFoundException(query);
    }

    private YouTube client() throws MigrationException {
        YouTube youtube = youtubeService;
        if (youtube == null) {
            throw new MigrationException(ErrorKind.NOT_AUTHENTICATED, "YouTube client not initialized");
        }
        return youtube;
    }

    private static Playlist toPlaylist(com.google.api.services.youtube.model.Playlist item) {
        PlaylistSnippet snippet = item.getSnippet();
        String title = snippet == null ? null : snippet.getTitle();
        String description = snippet == null || snippet.getDescription() == null ? "" : snippet.getDescription();
        boolean isPublic = item.getStatus() != null && "public".equals(item.getStatus().getPrivacyStatus());
        int count = 0;
        if (item.getContentDetails() != null && item.getContentDetails().getItemCount() != null) {
            count = item.getContentDetails().getItemCount().intValue();
        }
        return new Playlist(item.getId(), title, description, isPublic, count);
    }

    private static Track toTrack(PlaylistItem item) {
        PlaylistItemSnippet snippet = item.getSnippet();
        if (snippet == null || snippet.getResourceId() == null || snippet.getResourceId().getVideoId() == null) {
            return null;
        }
        return new Track(snippet.getResourceId().getVideoId(), snippet.getTitle(), snippet.getVideoOwnerChannelTitle());
    }

    static MigrationException translate(IOException e, String detail) {
        if (e instanceof GoogleJsonResponseException) {
            int status = ((GoogleJsonResponseException) e).getStatusCode();
            if (status == 404) {
                return new PlaylistNotFoundException(detail, e);
            }
            if (status == 401) {
                return new MigrationException(ErrorKind.NOT_AUTHENTICATED, detail, e);
            }
        }
        if (e instanceof TokenResponseException) {
            return new MigrationException(ErrorKind.REFRESH_FAILED, detail + ": " + e.getMessage(), e);
        }
        if (e instanceof InterruptedIOException && !(e instanceof SocketTimeoutException)) {
            Thread.currentThread().interrupt();
            return new MigrationException(ErrorKind.CANCELLED, detail, e);
        }
        return new MigrationException(ErrorKind.API_REQUEST_FAILED, detail + ": " + e.getMessage(), e);
    }
}
