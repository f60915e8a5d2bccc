package dev.letterfinder.analysis;

import static org.assertj.core.api.Assertions.assertThat;

import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

/**
 * Property-based checks of the relevance scoring rules: scores are bounded and non-negative, a
 * mention of both parties always makes a likely letter, and a missing party never does.
 */
class RelevanceScorerPropertyTest {

  private final RelevanceScorer scorer = new RelevanceScorer();

  @Provide
  Arbitrary<String> filler() {
    return Arbitraries.strings()
        .withChars("abdeghijklmnopqrstuvwxz ,.\n0123456789")
        .ofMaxLength(200);
  }

  @Provide
  Arbitrary<String> churchillMentions() {
    return Arbitraries.of("Churchill", "WINSTON", "prime minister", "Prime  Minister");
  }

  @Provide
  Arbitrary<String> fairfaxMentions() {
    return Arbitraries.of("Fairfax", "bryan", "COLONEL");
  }

  @Property
  void scoreIsAlwaysWithinBounds(@ForAll String text) {
    Analysis analysis = scorer.analyze(text);

    assertThat(analysis.relevanceScore()).isBetween(0, 50);
    assertThat(analysis.relevanceScore() % 10).isZero();
  }

  @Property
  void bothPartiesAlwaysMakeLikelyCorrespondence(
      @ForAll("filler") String before,
      @ForAll("churchillMentions") String churchill,
      @ForAll("filler") String between,
      @ForAll("fairfaxMentions") String fairfax,
      @ForAll("filler") String after) {
    Analysis analysis = scorer.analyze(before + " " + churchill + " " + between + " " + fairfax + " " + after);

    assertThat(analysis.relevanceScore()).isGreaterThanOrEqualTo(20);
    assertThat(analysis.likelyCorrespondence()).isTrue();
  }

  @Property
  void withoutFairfaxNothingIsLikely(
      @ForAll("filler") String text, @ForAll("churchillMentions") String churchill) {
    // filler has no "c", "f" or "y", so it cannot spell a Fairfax pattern
    Analysis analysis = scorer.analyze(text + " " + churchill + " 12 November 1946");

    assertThat(analysis.mentionsFairfax()).isFalse();
    assertThat(analysis.likelyCorrespondence()).isFalse();
  }

  @Property
  void scoringIsDeterministic(@ForAll String text) {
    assertThat(scorer.analyze(text)).isEqualTo(scorer.analyze(text));
  }
}
