package com.playlistmigrator.progress;

/**
 * Phases reported by the transfer engine, in the order a run passes through them.
 */
public enum Phase {
    RESOLVE_SOURCE,
    FETCH_SOURCE,
    FETCH_DESTINATION,
    COMPARE,
    SEARCH_TRACKS,
    CREATE_PLAYLIST,
    DONE
}
