package com.playlistmigrator.matching;

import com.playlistmigrator.model.Track;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decides whether two tracks from different catalogs are the same recording.
 * <p>
 * Textual metadata diverges across catalogs (punctuation, "feat." placement, remaster suffixes), while an ISRC,
 * when both sides carry one, identifies a recording exactly. Two tracks are therefore the same if their ISRCs are
 * equal, or else if their normalized title and artist are equal.
 */
public final class TrackMatcher {

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern EDGE_SPACE = Pattern.compile("^ | $");
    private static final String KEY_SEPARATOR = "|";

    private TrackMatcher() {
    }

    /**
     * Lowercases, trims and collapses whitespace runs to one space. Any Unicode space counts, so a no-break space
     * separates words like an ordinary one. Idempotent.
     * @param value The text to normalize, may be {@code null}.
     * @return The normalized text, never {@code null}.
     */
    public static String normalize(String value) {
        if (value == null) {
            return "";
        }
        String collapsed = WHITESPACE_RUN.matcher(value).replaceAll(" ");
        return EDGE_SPACE.matcher(collapsed).replaceAll("").toLowerCase(Locale.ROOT);
    }

    /**
     * @return The normalized title/artist key used as the fallback identity.
     */
    public static String key(Track track) {
        return key(track.title(), track.artist());
    }

    public static String key(String title, String artist) {
        return normalize(title) + KEY_SEPARATOR + normalize(artist);
    }

    public static boolean isrcMatches(Track a, Track b) {
        return a.hasIsrc() && b.hasIsrc() && a.isrc().equals(b.isrc());
    }

    public static boolean sameRecording(Track a, Track b) {
        if (isrcMatches(a, b)) {
            return true;
        }
        return key(a).equals(key(b));
    }
}
