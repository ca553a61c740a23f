package io.textimport.source;

/**
 * Point-in-time view of a source's counters.
 *
 * @param processed records handed out so far
 * @param bytesRead bytes consumed from the underlying stream, header included
 */
public record SourceProgress(long processed, long bytesRead) {}
