package com.playlistmigrator.matching;

import com.playlistmigrator.model.Track;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Lookup structures over one playlist's tracks: by ISRC and by normalized title/artist key.
 */
public final class TrackIndex {

    private final Set<String> isrcs = new HashSet<>();
    private final Set<String> keys = new HashSet<>();

    private TrackIndex() {
    }

    public static TrackIndex of(Collection<Track> tracks) {
        TrackIndex index = new TrackIndex();
        for (Track track : tracks) {
            index.keys.add(TrackMatcher.key(track));
            if (track.hasIsrc()) {
                index.isrcs.add(track.isrc());
            }
        }
        return index;
    }

    /**
     * Checks the ISRC lookup first, then the normalized key.
     */
    public boolean contains(Track track) {
        if (track.hasIsrc() && isrcs.contains(track.isrc())) {
            return true;
        }
        return keys.contains(TrackMatcher.key(track));
    }
}
