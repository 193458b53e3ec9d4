package com.itguru.sources;

public final class Excerpts {

    public static final int MAX_CHARS = 200;

    private Excerpts() {}

    /** First 200 characters followed by an ellipsis. */
    public static String of(String text) {
        String t = text == null ? "" : text.strip();
        if (t.length() > MAX_CHARS) t = t.substring(0, MAX_CHARS);
        return t + "...";
    }
}
