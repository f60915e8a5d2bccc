package dev.letterfinder.analysis;

/** Structural parts of a letter recognised by {@link LetterExtractor}. */
public enum LetterField {
  DATE,
  SALUTATION,
  BODY,
  SIGNATURE
}
