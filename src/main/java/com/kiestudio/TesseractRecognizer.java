package com.kiestudio;

import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;

/**
 * Tesseract via Tess4J. Reads Russian and English together and retries English-only when the combined pass fails.
 */
public class TesseractRecognizer implements TextRecognizer {
    private static final Logger log = LoggerFactory.getLogger(TesseractRecognizer.class);

    private final String dataPath;

    public TesseractRecognizer(String dataPath) {
        this.dataPath = dataPath == null || dataPath.isBlank() ? System.getenv("TESSDATA_PREFIX") : dataPath;
    }

    @Override
    public boolean isAvailable() {
        if (dataPath == null || dataPath.isBlank()) {
            return false;
        }
        return new File(dataPath, "eng.traineddata").isFile();
    }

    @Override
    public String recognize(byte[] image) throws RecognitionException {
        BufferedImage bitmap;
        try {
            bitmap = ImageIO.read(new ByteArrayInputStream(image));
        } catch (IOException e) {
            throw new RecognitionException("Unreadable image", e);
        }
        if (bitmap == null) {
            throw new RecognitionException("Unsupported image format", null);
        }
        try {
            return ocr(bitmap, "rus+eng");
        } catch (TesseractException | LinkageError e) {
            log.warn("Bilingual OCR failed, retrying with eng: {}", e.getMessage());
        }
        try {
            return ocr(bitmap, "eng");
        } catch (TesseractException | LinkageError e) {
            throw new RecognitionException("OCR failed", e);
        }
    }

    private String ocr(BufferedImage bitmap, String language) throws TesseractException {
        // Tesseract instances are not thread-safe.
        Tesseract tesseract = new Tesseract();
        tesseract.setDatapath(dataPath);
        tesseract.setLanguage(language);
        String text = tesseract.doOCR(bitmap);
        return text == null ? "" : text;
    }
}
