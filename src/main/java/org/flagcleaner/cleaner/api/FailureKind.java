package org.flagcleaner.cleaner.api;

/**
 * Why a file could not be cleaned.
 */
public enum FailureKind {
    /** The file does not exist. */
    FILE_NOT_FOUND,
    /** The file could not be read or decoded. */
    READ_FAILURE,
    /** The source did not parse; the file was left untouched. */
    PARSE_FAILURE,
    /** The cleaned text could not be written. */
    WRITE_FAILURE,
    /** The emptied file could not be deleted. */
    DELETE_FAILURE,
    /** Processing did not finish within the configured timeout. */
    TIMED_OUT,
    /** Any other error. */
    UNEXPECTED
}
