package com.yearlylikes.sorter;

/**
 * Steps of the sorter. {@link #FETCH} covers reading the library before any year is processed.
 */
public enum SortStage {
    FETCH,
    LOCATE,
    CREATE,
    CLEAR,
    IMAGE,
    FILL
}
