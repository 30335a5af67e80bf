package com.hdltree;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps character offsets to line and column numbers with a binary search over line starts.
 */
public final class LineMap {

    private final int length;
    private final int[] lineOffsets; // Starting offset of each line

    public LineMap(String source) {
        this.length = source.length();
        List<Integer> offsets = new ArrayList<>();
        offsets.add(0); // Line 1 starts at offset 0

        for (int i = 0; i < length; i++) {
            char ch = source.charAt(i);
            if (ch == '\n') {
                offsets.add(i + 1);
            } else if (ch == '\r') {
                // CRLF counts as one terminator
                if (i + 1 < length && source.charAt(i + 1) == '\n') {
                    i++;
                }
                offsets.add(i + 1);
            }
        }
        this.lineOffsets = offsets.stream().mapToInt(Integer::intValue).toArray();
    }

    public int line(int offset) {
        offset = Math.max(0, Math.min(offset, length));
        int low = 0;
        int high = lineOffsets.length - 1;
        int line = 1;
        while (low <= high) {
            int mid = (low + high) / 2;
            if (lineOffsets[mid] <= offset) {
                line = mid + 1;
                low = mid + 1;
            } else {
                high = mid - 1;
            }
        }
        return line;
    }

    public int column(int offset) {
        offset = Math.max(0, Math.min(offset, length));
        return offset - lineOffsets[line(offset) - 1];
    }

    public Span span(int start, int end) {
        return new Span(start, end, line(start), column(start), line(end), column(end));
    }
}
