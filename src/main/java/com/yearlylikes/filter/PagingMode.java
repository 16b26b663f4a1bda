package com.yearlylikes.filter;

/**
 * How the library offset moves on after a page whose tracks were removed.
 */
public enum PagingMode {

    /**
     * Advance by the page size minus the number of tracks removed from that page, so reading
     * resumes at the first track not yet seen.
     */
    COMPENSATED,

    /**
     * Always advance by the page size. Tracks that slide into already-read positions after a
     * removal are never looked at in this run.
     */
    FIXED_STRIDE
}
