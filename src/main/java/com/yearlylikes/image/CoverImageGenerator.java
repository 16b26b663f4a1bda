package com.yearlylikes.image;

import java.io.IOException;

/**
 * Renders a playlist cover. The same name always yields the same image.
 */
public interface CoverImageGenerator {

    /** Returns JPEG bytes. */
    byte[] generateForPlaylist(String name) throws IOException;
}
