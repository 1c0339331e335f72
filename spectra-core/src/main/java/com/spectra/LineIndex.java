package com.spectra;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps UTF-8 byte offsets back to line/column positions for diagnostics.
 * Lines are 1-based, columns are 0-based and counted in code points.
 */
public final class LineIndex {
    private final String source;
    private final int[] lineByteOffsets;
    private final int[] lineCharIndexes;
    private final int sourceLength;

    public record Position(int line, int column) {
        @Override
        public String toString() {
            return line + ":" + column;
        }
    }

    private LineIndex(String source, int[] lineByteOffsets, int[] lineCharIndexes, int sourceLength) {
        this.source = source;
        this.lineByteOffsets = lineByteOffsets;
        this.lineCharIndexes = lineCharIndexes;
        this.sourceLength = sourceLength;
    }

    // Line terminators: LF, CR, CRLF, LS, PS
    public static LineIndex of(String source) {
        List<int[]> starts = new ArrayList<>();
        starts.add(new int[] {0, 0});

        int offset = 0;
        for (int i = 0; i < source.length(); ) {
            int c = source.codePointAt(i);
            int width = Character.charCount(c);
            offset += Lexer.utf8Length(c);
            i += width;
            if (c == '\r' && i < source.length() && source.charAt(i) == '\n') {
                offset += 1;
                i += 1;
                starts.add(new int[] {offset, i});
            } else if (c == '\n' || c == '\r' || c == 0x2028 || c == 0x2029) {
                starts.add(new int[] {offset, i});
            }
        }

        int[] byteOffsets = new int[starts.size()];
        int[] charIndexes = new int[starts.size()];
        for (int line = 0; line < starts.size(); line++) {
            byteOffsets[line] = starts.get(line)[0];
            charIndexes[line] = starts.get(line)[1];
        }
        return new LineIndex(source, byteOffsets, charIndexes, offset);
    }

    public int lineCount() {
        return lineByteOffsets.length;
    }

    public Position position(int byteOffset) {
        int target = Math.max(0, Math.min(byteOffset, sourceLength));

        int low = 0;
        int high = lineByteOffsets.length - 1;
        int line = 0;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            if (lineByteOffsets[mid] <= target) {
                line = mid;
                low = mid + 1;
            } else {
                high = mid - 1;
            }
        }

        int column = 0;
        int offset = lineByteOffsets[line];
        for (int i = lineCharIndexes[line]; offset < target && i < source.length(); ) {
            int c = source.codePointAt(i);
            offset += Lexer.utf8Length(c);
            i += Character.charCount(c);
            column++;
        }
        return new Position(line + 1, column);
    }
}
