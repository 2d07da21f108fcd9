package com.livedesk.support.media;

import java.util.Optional;

public interface OcrClient {

    /**
     * @return the text read from the image, empty when the image holds no text
     * @throws MediaExtractionException {@code ocr_failed} when the service cannot be reached or rejects the image
     */
    Optional<String> extractText(byte[] image, String contentType);
}
