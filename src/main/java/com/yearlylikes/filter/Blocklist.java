package com.yearlylikes.filter;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Artist names whose tracks get removed from the library. Names match exactly, case included.
 */
public final class Blocklist {

    private final Set<String> artists;

    private Blocklist(Set<String> artists) {
        this.artists = Collections.unmodifiableSet(artists);
    }

    /** Builds a blocklist from names; blank entries are dropped and surrounding whitespace trimmed. */
    public static Blocklist of(Collection<String> names) {
        Set<String> set = new LinkedHashSet<>();
        if (names != null) {
            for (String name : names) {
                if (name != null && !name.isBlank()) {
                    set.add(name.trim());
                }
            }
        }
        return new Blocklist(set);
    }

    public static Blocklist of(String... names) {
        return of(List.of(names));
    }

    public boolean contains(String artist) {
        return artist != null && artists.contains(artist);
    }

    /** First blocked name among {@code trackArtists}, or null. */
    public String firstMatch(List<String> trackArtists) {
        for (String artist : trackArtists) {
            if (contains(artist)) {
                return artist;
            }
        }
        return null;
    }

    public boolean isEmpty() {
        return artists.isEmpty();
    }

    public int size() {
        return artists.size();
    }

    public Set<String> names() {
        return artists;
    }
}
