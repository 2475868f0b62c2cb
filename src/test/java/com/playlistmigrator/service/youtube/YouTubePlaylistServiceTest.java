package com.playlistmigrator.service.youtube;

import com.google.api.client.http.LowLevelHttpRequest;
import com.google.api.client.http.LowLevelHttpResponse;
import com.google.api.client.json.Json;
import com.google.api.client.testing.http.MockHttpTransport;
import com.google.api.client.testing.http.MockLowLevelHttpRequest;
import com.google.api.client.testing.http.MockLowLevelHttpResponse;
import com.playlistmigrator.auth.OAuthToken;
import com.playlistmigrator.error.ErrorKind;
import com.playlistmigrator.error.MigrationException;
import com.playlistmigrator.error.PlaylistNotFoundException;
import com.playlistmigrator.model.Playlist;
import com.playlistmigrator.model.PlaylistExport;
import com.playlistmigrator.model.Track;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

class YouTubePlaylistServiceTest {

    private final List<String> requests = new CopyOnWriteArrayList<>();
    private final List<String> bodies = new CopyOnWriteArrayList<>();
    private final List<String> authorizations = new CopyOnWriteArrayList<>();
    private final List<OAuthToken> refreshed = new ArrayList<>();
    private Router router;
    private YouTubePlaylistService service;

    @BeforeEach
    void setUp() throws MigrationException {
        router = (method, url) -> response(404, "{'error':{'code':404,'message':'Not Found'}}");
        MockHttpTransport transport = new MockHttpTransport() {
            @Override
            public LowLevelHttpRequest buildRequest(String method, String url) {
                return new MockLowLevelHttpRequest(url) {
                    @Override
                    public LowLevelHttpResponse execute() throws IOException {
                        requests.add(method + " " + url);
                        bodies.add(getContentAsString());
                        authorizations.add(getFirstHeaderValue("Authorization"));
                        return router.route(method, url);
                    }
                };
            }
        };
        service = new YouTubePlaylistService(transport, refreshed::add, 2);
        service.authenticate(Map.of("access_token", "yt-token"));
    }

    @Test
    void shouldRequireAccessToken() {
        YouTubePlaylistService fresh = new YouTubePlaylistService(new MockHttpTransport(), null, 2);

        MigrationException exception = Assertions.assertThrows(
                MigrationException.class,
                () -> fresh.authenticate(Map.of("refresh_token", "rt"))
        );

        Assertions.assertEquals(ErrorKind.NOT_AUTHENTICATED, exception.getKind());
    }

    @Test
    void shouldRejectCallsBeforeAuthentication() {
        YouTubePlaylistService fresh = new YouTubePlaylistService(new MockHttpTransport(), null, 2);

        MigrationException exception = Assertions.assertThrows(MigrationException.class, fresh::getPlaylists);

        Assertions.assertEquals(ErrorKind.NOT_AUTHENTICATED, exception.getKind());
    }

    @Test
    void shouldPageThroughPlaylistsWithBearerToken() throws MigrationException {
        router = (method, url) -> {
            if (url.contains("pageToken=page2")) {
                return response(200, "{'items':[" + playlistJson("PL3", "Third", "public", 7) + "]}");
            }
            return response(200, "{'nextPageToken':'page2','items':["
                    + playlistJson("PL1", "First", "private", 3) + "," + playlistJson("PL2", "Second", "private", 0)
                    + "]}");
        };

        List<Playlist> playlists = service.getPlaylists();

        Assertions.assertEquals(List.of("First", "Second", "Third"), playlists.stream().map(Playlist::name).toList());
        Assertions.assertTrue(playlists.get(2).publicVisible());
        Assertions.assertEquals(7, playlists.get(2).trackCount());
        Assertions.assertEquals(2, requests.size());
        Assertions.assertTrue(requests.get(0).contains("mine=true"));
        Assertions.assertTrue(requests.get(0).contains("maxResults=50"));
        Assertions.assertEquals(List.of("Bearer yt-token", "Bearer yt-token"), authorizations);
        Assertions.assertEquals("yt-token", refreshed.get(0).accessToken());
        Assertions.assertEquals(1, refreshed.size());
    }

    @Test
    void shouldExportVideosAsTracks() throws MigrationException {
        router = (method, url) -> {
            if (url.contains("/playlistItems")) {
                return response(200, "{'items':["
                        + itemJson("vid-1", "Never Gonna Give You Up", "Rick Astley") + ","
                        + "{'id':'gone','snippet':{'title':'Deleted video'}},"
                        + itemJson("vid-2", "Take On Me", "a-ha")
                        + "]}");
            }
            return response(200, "{'items':[" + playlistJson("PL1", "80s", "private", 3) + "]}");
        };

        PlaylistExport export = service.exportPlaylist("PL1");

        Assertions.assertEquals("80s", export.playlist().name());
        Assertions.assertEquals(2, export.playlist().trackCount());
        Assertions.assertEquals(new Track("vid-1", "Never Gonna Give You Up", "Rick Astley"), export.tracks().get(0));
        Assertions.assertEquals("a-ha", export.tracks().get(1).artist());
    }

    @Test
    void shouldReportUnknownPlaylist() {
        router = (method, url) -> response(200, "{'items':[]}");

        Assertions.assertThrows(PlaylistNotFoundException.class, () -> service.getPlaylist("nope"));
    }

    @Test
    void shouldMapNotFoundResponse() {
        MigrationException exception = Assertions.assertThrows(
                MigrationException.class,
                () -> service.exportPlaylist("PL404")
        );

        Assertions.assertEquals(ErrorKind.PLAYLIST_NOT_FOUND, exception.getKind());
    }

    @Test
    void shouldMapServerErrorToApiFailure() {
        router = (method, url) -> response(500, "{'error':{'code':500,'message':'Backend Error'}}");

        MigrationException exception = Assertions.assertThrows(MigrationException.class, service::getPlaylists);

        Assertions.assertEquals(ErrorKind.API_REQUEST_FAILED, exception.getKind());
    }

    @Test
    void shouldCreatePlaylistAndAddEveryVideo() throws MigrationException {
        router = (method, url) -> {
            if (url.contains("/playlistItems")) {
                return response(200, "{'id':'item'}");
            }
            return response(200, "{'id':'NEW','snippet':{'title':'Copy'}}");
        };
        PlaylistExport export = new PlaylistExport(
                new Playlist(null, "Copy", "Migrated from Spotify: Mix", false, 3),
                List.of(new Track("v1", "A", "X"), new Track("v2", "B", "Y"), new Track("v3", "C", "Z")));

        Playlist created = service.importPlaylist(export);

        Assertions.assertEquals("NEW", created.id());
        Assertions.assertEquals(3, created.trackCount());
        Assertions.assertEquals(4, requests.size());
        Assertions.assertTrue(requests.get(0).startsWith("POST") && requests.get(0).contains("/playlists"));
        Assertions.assertTrue(bodies.get(0).contains("\"privacyStatus\":\"private\""));
        Assertions.assertTrue(bodies.get(0).contains("Migrated from Spotify: Mix"));
        Assertions.assertTrue(bodies.get(3).contains("\"videoId\":\"v3\""));
        Assertions.assertTrue(bodies.get(3).contains("\"playlistId\":\"NEW\""));
    }

    @Test
    void shouldReturnFirstVideoFromSearch() throws MigrationException {
        router = (method, url) -> response(200, "{'items':["
                + "{'id':{'kind':'youtube#channel','channelId':'UC1'},'snippet':{'title':'Rick Astley'}},"
                + "{'id':{'kind':'youtube#video','videoId':'dQw4w9WgXcQ'},"
                + "'snippet':{'title':'Never Gonna Give You Up','channelTitle':'Rick Astley'}}"
                + "]}");

        Track track = service.searchTrack("Never Gonna Give You Up", "Rick Astley");

        Assertions.assertEquals("dQw4w9WgXcQ", track.id());
        Assertions.assertEquals("Rick Astley", track.artist());
        Assertions.assertTrue(requests.get(0).contains("q=Never"));
        Assertions.assertTrue(requests.get(0).contains("type=video"));
    }

    @Test
    void shouldReportTrackNotFoundForEmptySearch() {
        router = (method, url) -> response(200, "{'items':[]}");

        MigrationException exception = Assertions.assertThrows(
                MigrationException.class,
                () -> service.searchTrack("Unknown", "Nobody")
        );

        Assertions.assertEquals(ErrorKind.TRACK_NOT_FOUND, exception.getKind());
    }

    private static String playlistJson(String id, String title, String privacy, int count) {
        return "{'id':'" + id + "','snippet':{'title':'" + title + "','description':''},"
                + "'status':{'privacyStatus':'" + privacy + "'},'contentDetails':{'itemCount':" + count + "}}";
    }

    private static String itemJson(String videoId, String title, String channel) {
        return "{'id':'item-" + videoId + "','snippet':{'title':'" + title + "','videoOwnerChannelTitle':'"
                + channel + "','resourceId':{'kind':'youtube#video','videoId':'" + videoId + "'}}}";
    }

    private static MockLowLevelHttpResponse response(int status, String singleQuotedJson) {
        return new MockLowLevelHttpResponse()
                .setStatusCode(status)
                .setContentType(Json.MEDIA_TYPE)
                .setContent(singleQuotedJson.replace('\'', '"'));
    }

    @FunctionalInterface
    private interface Router {
        LowLevelHttpResponse route(String method, String url);
    }
}
