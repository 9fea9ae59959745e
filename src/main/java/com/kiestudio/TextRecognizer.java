package com.kiestudio;

/**
 * OCR engine seam.
 */
public interface TextRecognizer {

    /** False when the engine or its language data is not installed. */
    boolean isAvailable();

    String recognize(byte[] image) throws RecognitionException;

    class RecognitionException extends Exception {
        public RecognitionException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
