package com.playlistmigrator.service.spotify;

import com.google.api.client.auth.oauth2.BearerToken;
import com.google.api.client.auth.oauth2.ClientParametersAuthentication;
import com.google.api.client.auth.oauth2.Credential;
import com.google.api.client.auth.oauth2.TokenResponseException;
import com.google.api.client.http.GenericUrl;
import com.google.api.client.http.HttpRequestFactory;
import com.google.api.client.http.HttpResponseException;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.JsonObjectParser;
import com.google.api.client.json.gson.GsonFactory;
import com.playlistmigrator.auth.CredentialTokenSource;
import com.playlistmigrator.auth.NotifyingTokenSource;
import com.playlistmigrator.auth.TokenRefreshListener;
import com.playlistmigrator.auth.TokenSourceRequestInitializer;
import com.playlistmigrator.error.ErrorKind;
import com.playlistmigrator.error.MigrationException;
import com.playlistmigrator.error.PlaylistNotFoundException;
import com.playlistmigrator.model.Playlist;
import com.playlistmigrator.model.PlaylistExport;
import com.playlistmigrator.model.Track;
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
 * Read-only {@link MusicService} over the Spotify Web API. Playlists can be listed and exported, with each track's
 * ISRC; creating playlists and searching the catalog are not available.
 */
public class SpotifyPlaylistService implements MusicService {

    private static final Logger LOGGER = LoggerFactory.getLogger(SpotifyPlaylistService.class);

    static final String BASE_URL = "https://api.spotify.com/v1";
    static final String DEFAULT_TOKEN_URI = "https://accounts.spotify.com/api/token";
    private static final int PAGE_SIZE = 50;
    private static final JsonFactory JSON_FACTORY = GsonFactory.getDefaultInstance();

    private final HttpTransport transport;
    private final TokenRefreshListener refreshListener;

    private volatile HttpRequestFactory requestFactory;

    /**
     * @param transport       The HTTP transport for API and token calls.
     * @param refreshListener Told about each new access token, may be {@code null}.
     */
    public SpotifyPlaylistService(HttpTransport transport, TokenRefreshListener refreshListener) {
        this.transport = transport;
        this.refreshListener = refreshListener;
    }

    @Override
    public String name() {
        return "Spotify";
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
        JsonObjectParser parser = new JsonObjectParser(JSON_FACTORY);
        requestFactory = transport.createRequestFactory(request -> {
            initializer.initialize(request);
            request.setParser(parser);
        });
        LOGGER.debug("Spotify client initialized");
    }

    /**
     * Retrieves the playlists of the authenticated user, 50 per page.
     */
    @Override
    public List<Playlist> getPlaylists() throws MigrationException {
        List<Playlist> allPlaylists = new ArrayList<>();
        int offset = 0;
        SpotifyObjects.PlaylistPage page;
        do {
            GenericUrl url = new GenericUrl(BASE_URL + "/me/playlists");
            url.set("limit", PAGE_SIZE);
            url.set("offset", offset);
            page = get(url, SpotifyObjects.PlaylistPage.class, "failed to list playlists");
            if (page.items != null) {
                for (SpotifyObjects.SimplePlaylist item : page.items) {
                    int count = item.tracks == null ? 0 : item.tracks.total;
                    allPlaylists.add(toPlaylist(item.id, item.name, item.description, item.isPublic, count));
                }
            }
            offset += PAGE_SIZE;
        } while (page.next != null);
        LOGGER.debug("Fetched {} Spotify playlists", allPlaylists.size());
        return allPlaylists;
    }

    @Override
    public Playlist getPlaylist(String playlistId) throws MigrationException {
        SpotifyObjects.FullPlaylist playlist = fetchPlaylist(playlistId);
        int count = playlist.tracks == null ? 0 : playlist.tracks.total;
        return toPlaylist(playlist.id, playlist.name, playlist.description, playlist.isPublic, count);
    }

    /**
     * Reads the playlist and follows the {@code next} links of its track pages. Entries whose track is gone
     * (removed from the catalog, or a local file) are skipped.
     */
    @Override
    public PlaylistExport exportPlaylist(String playlistId) throws MigrationException {
        SpotifyObjects.FullPlaylist playlist = fetchPlaylist(playlistId);
        List<Track> tracks = new ArrayList<>();
        SpotifyObjects.PlaylistTrackPage page = playlist.tracks;
        while (page != null) {
            if (page.items != null) {
                for (SpotifyObjects.PlaylistTrack item : page.items) {
                    if (item.track == null || item.track.id == null) {
                        LOGGER.debug("Skipping unavailable entry added {} in playlist {}", item.addedAt, playlistId);
                    } else {
                        tracks.add(toTrack(item.track));
                    }
                }
            }
            page = page.next == null ? null : get(new GenericUrl(page.next), SpotifyObjects.PlaylistTrackPage.class,
                    "failed to get tracks of playlist " + playlistId);
        }
        Playlist metadata = toPlaylist(playlist.id, playlist.name, playlist.description, playlist.isPublic,
                tracks.size());
        return new PlaylistExport(metadata, tracks);
    }

    @Override
    public Playlist importPlaylist(PlaylistExport export) throws MigrationException {
        throw new MigrationException(ErrorKind.SERVICE_UNAVAILABLE,
                "Spotify cannot create playlists yet; it can only be used as a source");
    }

    @Override
    public Track searchTrack(String title, String artist) throws MigrationException {
        throw new MigrationException(ErrorKind.SERVICE_UNAVAILABLE,
                "Spotify catalog search is not supported; it can only be used as a source");
    }

    private SpotifyObjects.FullPlaylist fetchPlaylist(String playlistId) throws MigrationException {
        GenericUrl url = new GenericUrl(BASE_URL);
        url.getPathParts().add("playlists");
        url.getPathParts().add(playlistId);
        return get(url, SpotifyObjects.FullPlaylist.class, "failed to get playlist " + playlistId);
    }

    private <T> T get(GenericUrl url, Class<T> type, String detail) throws MigrationException {
        HttpRequestFactory factory = requestFactory;
        if (factory == null) {
            throw new MigrationException(ErrorKind.NOT_AUTHENTICATED, "Spotify client not initialized");
        }
        try {
            return factory.buildGetRequest(url).execute().parseAs(type);
        } catch (IOException e) {
            throw translate(e, detail);
        }
    }

    private static Playlist toPlaylist(String id, String name, String description, Boolean isPublic, int count) {
        return new Playlist(id, name, description == null ? "" : description, Boolean.TRUE.equals(isPublic), count);
    }

    private static Track toTrack(SpotifyObjects.FullTrack track) {
        String artist = track.artists == null || track.artists.isEmpty() ? null : track.artists.get(0).name;
        String album = track.album == null || track.album.name == null || track.album.name.isEmpty()
                ? null : track.album.name;
        String isrc = track.externalIds == null ? null : track.externalIds.isrc;
        return new Track(track.id, track.name, artist, album, track.durationMs / 1000, isrc);
    }

    static MigrationException translate(IOException e, String detail) {
        if (e instanceof TokenResponseException) {
            return new MigrationException(ErrorKind.REFRESH_FAILED, detail + ": " + e.getMessage(), e);
        }
        if (e instanceof HttpResponseException) {
            int status = ((HttpResponseException) e).getStatusCode();
            if (status == 404) {
                return new PlaylistNotFoundException(detail, e);
            }
            if (status == 401) {
                return new MigrationException(ErrorKind.NOT_AUTHENTICATED, detail, e);
            }
        }
        if (e instanceof InterruptedIOException && !(e instanceof SocketTimeoutException)) {
            Thread.currentThread().interrupt();
            return new MigrationException(ErrorKind.CANCELLED, detail, e);
        }
        return new MigrationException(ErrorKind.API_REQUEST_FAILED, detail + ": " + e.getMessage(), e);
    }
}
