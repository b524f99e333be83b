package com.dcruver.kepwaretags.export;

/**
 * Line terminator written after every CSV line.
 */
public enum LineEnding {
    CRLF("\r\n"),
    LF("\n");

    private final String separator;

    LineEnding(String separator) {
        this.separator = separator;
    }

    public String getSeparator() {
        return separator;
    }
}
