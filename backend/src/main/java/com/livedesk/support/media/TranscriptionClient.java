package com.livedesk.support.media;

import java.util.Optional;

public interface TranscriptionClient {

    /**
     * @return the recognized speech, empty when nothing intelligible was heard
     * @throws MediaExtractionException {@code transcription_failed} on service or format errors
     */
    Optional<String> transcribe(byte[] audio, String filename);
}
