package com.kiestudio;

import java.io.IOException;

/**
 * Access to files users upload through the chat.
 */
public interface MediaFiles {

    byte[] download(String fileRef) throws IOException;

    /** Re-hosts an uploaded file at a public URL the generation API can read. */
    String publish(String fileRef, String fileName) throws IOException;
}
