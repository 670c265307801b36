package com.williamcallahan.eventstream.domain.event;

/**
 * A source reference attached to generated text.
 *
 * @param uri location of the cited source
 * @param title display title, may be empty
 * @param start start offset in the generated text
 * @param end end offset in the generated text
 */
public record Citation(String uri, String title, int start, int end) {
    public Citation {
        if (uri == null || uri.isBlank()) {
            throw new IllegalArgumentException("uri cannot be null or blank");
        }
        title = title == null ? "" : title;
    }
}
