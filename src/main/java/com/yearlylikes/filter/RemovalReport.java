package com.yearlylikes.filter;

/**
 * Outcome of an artist removal run.
 */
public record RemovalReport(
        int pagesScanned,
        int tracksScanned,
        int tracksMarked,
        int tracksRemoved,
        int failedPages
) {}
