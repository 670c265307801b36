package com.williamcallahan.eventstream.domain.event;

/**
 * Describes the encoding of an audio chunk.
 *
 * @param mimeType media type such as {@code audio/pcm}
 * @param sampleRate samples per second, zero when unknown
 * @param channels channel count, zero when unknown
 * @param bitDepth bits per sample, zero when unknown
 */
public record AudioFormat(String mimeType, int sampleRate, int channels, int bitDepth) {
    public AudioFormat {
        if (mimeType == null || mimeType.isBlank()) {
            throw new IllegalArgumentException("mimeType cannot be null or blank");
        }
        if (sampleRate < 0 || channels < 0 || bitDepth < 0) {
            throw new IllegalArgumentException("audio format values cannot be negative");
        }
    }
}
