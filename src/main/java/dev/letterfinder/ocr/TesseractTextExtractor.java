package dev.letterfinder.ocr;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

import javax.imageio.ImageIO;

import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;

/**
 * Tess4J-backed extractor. Images are decoded with {@link ImageIO} and recognised with the
 * configured tessdata directory and language.
 *
 * <p>Tesseract instances are not thread-safe; pages are processed one at a time.
 */
public class TesseractTextExtractor implements TextExtractor {

    private final ITesseract tesseract;

    public TesseractTextExtractor(Path dataPath, String language) {
        Tesseract engine = new Tesseract();
        engine.setDatapath(dataPath.toString());
        engine.setLanguage(language);
        this.tesseract = engine;
    }

    TesseractTextExtractor(ITesseract tesseract) {
        this.tesseract = tesseract;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public String extractText(Path image) throws TextExtractionException {
        BufferedImage decoded;
        try {
            decoded = ImageIO.read(image.toFile());
        } catch (IOException e) {
            throw new TextExtractionException("Could not read image " + image, e);
        }
        if (decoded == null) {
            throw new TextExtractionException("No image decoder for " + image);
        }

        try {
            return tesseract.doOCR(decoded);
        } catch (TesseractException e) {
            throw new TextExtractionException("Tesseract failed on " + image, e);
        } catch (LinkageError e) {
            // native library missing or incompatible
            throw new TextExtractionException("Tesseract native library unavailable", e);
        }
    }
}
