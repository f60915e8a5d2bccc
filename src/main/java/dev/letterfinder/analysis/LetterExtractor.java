package dev.letterfinder.analysis;

import dev.letterfinder.download.DownloadedDocument;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Segments OCR text into date, salutation, body and signature with a single pass over its
 * non-blank lines.
 *
 * <p>Two states: while seeking, a date-like line becomes the date and a line starting with
 * "Dear" becomes the salutation and opens the body; inside the body, a line containing
 * "Sincerely" or "Yours" becomes the signature and closes it, any other line is body text.
 * Each field is recorded at most once.
 */
@Component
public class LetterExtractor {

  private static final Logger log = LoggerFactory.getLogger(LetterExtractor.class);

  /** Fewer recognised parts than this and the text is not treated as a letter. */
  static final int MIN_FIELDS = 2;

  private static final Pattern LOOSE_DATE = Pattern.compile("\\d{1,2}\\s+\\w+\\s+\\d{4}");
  private static final String SALUTATION_PREFIX = "Dear";
  private static final List<String> CLOSINGS = List.of("Sincerely", "Yours");

  private enum State {
    SEEKING,
    IN_BODY
  }

  /**
   * Recognise letter parts in raw text.
   *
   * @param text OCR text, lines separated by newlines
   * @return the recognised fields; the body is present only if at least one body line was seen
   */
  public Map<LetterField, String> extractFields(String text) {
    Map<LetterField, String> fields = new EnumMap<>(LetterField.class);
    if (text == null || text.isBlank()) {
      return fields;
    }

    State state = State.SEEKING;
    List<String> bodyLines = new ArrayList<>();
    for (String rawLine : text.split("\n")) {
      String line = rawLine.strip();
      if (line.isEmpty()) {
        continue;
      }
      if (state == State.SEEKING) {
        if (!fields.containsKey(LetterField.DATE) && LOOSE_DATE.matcher(line).find()) {
          fields.put(LetterField.DATE, line);
        } else if (!fields.containsKey(LetterField.SALUTATION)
            && line.startsWith(SALUTATION_PREFIX)) {
          fields.put(LetterField.SALUTATION, line);
          state = State.IN_BODY;
        }
      } else if (isClosing(line)) {
        fields.put(LetterField.SIGNATURE, line);
        state = State.SEEKING;
      } else {
        bodyLines.add(line);
      }
    }

    if (!bodyLines.isEmpty()) {
      fields.put(LetterField.BODY, String.join("\n", bodyLines));
    }
    return fields;
  }

  /**
   * Build letter candidates from analyzed documents, most relevant first.
   *
   * @param documents analyzed documents in processing order
   * @return candidates from likely-correspondence documents with enough letter structure, sorted
   *     by relevance score descending (ties keep processing order)
   */
  public List<ExtractedLetter> extractLetters(List<AnalyzedDocument> documents) {
    log.info("Analyzing OCR results for potential letter content");
    List<ExtractedLetter> letters = new ArrayList<>();
    for (AnalyzedDocument analyzed : documents) {
      if (!analyzed.analysis().likelyCorrespondence()) {
        continue;
      }
      String fullText = analyzed.ocr().fullText();
      Map<LetterField, String> fields = extractFields(fullText);
      if (fields.size() < MIN_FIELDS) {
        log.debug(
            "Skipping {}: only {} letter fields recognised",
            analyzed.ocr().document().reference(),
            fields.size());
        continue;
      }
      DownloadedDocument source = analyzed.ocr().document();
      letters.add(
          new ExtractedLetter(
              source.archive(),
              source.reference(),
              source.title(),
              source.date(),
              fields,
              analyzed.analysis().relevanceScore(),
              fullText));
    }
    letters.sort(Comparator.comparingInt(ExtractedLetter::relevanceScore).reversed());
    log.info("Found {} potential letters", letters.size());
    return letters;
  }

  private static boolean isClosing(String line) {
    for (String closing : CLOSINGS) {
      if (line.contains(closing)) {
        return true;
      }
    }
    return false;
  }
}
