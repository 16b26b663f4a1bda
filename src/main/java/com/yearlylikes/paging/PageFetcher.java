package com.yearlylikes.paging;

import com.yearlylikes.spotify.SpotifyClientException;

/**
 * Reads one page of a remote collection.
 */
@FunctionalInterface
public interface PageFetcher<T> {

    Page<T> fetch(int offset, int limit) throws SpotifyClientException;
}
