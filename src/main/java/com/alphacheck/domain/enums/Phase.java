package com.alphacheck.domain.enums;

/**
 * Pipeline stage an alpha target was observed at.
 *
 * <p>PM targets are merged into group targets (MERGED), which are then split across
 * execution traders (SPLIT). Volume must be conserved across both boundaries.
 */
public enum Phase {
    PM,
    MERGED,
    SPLIT
}
