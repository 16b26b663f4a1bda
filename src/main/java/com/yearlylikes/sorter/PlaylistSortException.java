package com.yearlylikes.sorter;

import com.yearlylikes.processor.ProcessorException;
import com.yearlylikes.processor.RunCancelledException;

/**
 * The sorter stopped at a given year and stage. Later years were left untouched.
 */
public class PlaylistSortException extends ProcessorException {

    private final Integer year;
    private final SortStage stage;

    public PlaylistSortException(Integer year, SortStage stage, String message, Throwable cause) {
        super(describe(year, stage, message), cause);
        this.year = year;
        this.stage = stage;
    }

    /** The year being processed, or null when the failure happened before the first year. */
    public Integer getYear() {
        return year;
    }

    public SortStage getStage() {
        return stage;
    }

    public boolean isCancellation() {
        return getCause() instanceof RunCancelledException;
    }

    private static String describe(Integer year, SortStage stage, String message) {
        String where = (year != null) ? "Year " + year + " failed during " + stage : "Failed during " + stage;
        return where + ": " + message;
    }
}
