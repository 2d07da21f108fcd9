package com.livedesk.support.media;

/**
 * OCR or transcription produced no usable text. Terminal for the unit being ingested.
 */
public class MediaExtractionException extends RuntimeException {

    public MediaExtractionException(String code) {
        super(code);
    }

    public MediaExtractionException(String code, Throwable cause) {
        super(code, cause);
    }
}
