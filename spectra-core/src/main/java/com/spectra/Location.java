package com.spectra;

/**
 * Half-open range {@code [start, end)} of UTF-8 byte offsets into the source buffer.
 */
public record Location(int start, int end) {

    public Location {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid location [" + start + ", " + end + ")");
        }
    }

    /**
     * Location covering everything from the start of {@code from} to the end of {@code to}.
     */
    public static Location span(Location from, Location to) {
        return new Location(from.start(), to.end());
    }

    public int length() {
        return end - start;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
