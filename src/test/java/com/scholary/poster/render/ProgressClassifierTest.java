package com.scholary.poster.render;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class ProgressClassifierTest {

  private final ProgressClassifier classifier = new ProgressClassifier();

  @Test
  void classify_shouldMapKeywordsToMilestones() {
    assertThat(classifier.classify("Fetching map data..."))
        .contains(new ProgressSignal(15, "Fetching map data from OpenStreetMap..."));
    assertThat(classifier.classify("Downloading street network"))
        .contains(new ProgressSignal(15, "Fetching map data from OpenStreetMap..."));
    assertThat(classifier.classify("Building graph"))
        .contains(new ProgressSignal(40, "Processing map data..."));
    assertThat(classifier.classify("Rendering layers"))
        .contains(new ProgressSignal(70, "Rendering poster..."));
    assertThat(classifier.classify("Saving to /tmp/out.png"))
        .contains(new ProgressSignal(90, "Saving poster image..."));
  }

  @Test
  void classify_shouldMatchKeywordsCaseInsensitively() {
    assertThat(classifier.classify("DRAWING roads")).map(ProgressSignal::progress).contains(70);
  }

  @Test
  void classify_shouldUseExplicitPercentage() {
    Optional<ProgressSignal> signal = classifier.classify("Progress: 45%");

    assertThat(signal).isPresent();
    assertThat(signal.get().progress()).isEqualTo(45);
    assertThat(signal.get().message()).isNull();
  }

  @Test
  void classify_shouldPreferPercentageOverMilestoneProgress() {
    assertThat(classifier.classify("Rendering 82% complete"))
        .contains(new ProgressSignal(82, "Rendering poster..."));
  }

  @Test
  void classify_shouldIgnoreUnrecognizedLines() {
    assertThat(classifier.classify("Loaded 1532 nodes")).isEmpty();
    assertThat(classifier.classify("")).isEmpty();
    assertThat(classifier.classify("   ")).isEmpty();
    assertThat(classifier.classify(null)).isEmpty();
  }

  @Test
  void classify_shouldIgnoreOutOfRangePercentages() {
    assertThat(classifier.classify("Progress: 150%")).isEmpty();
    assertThat(classifier.classify("Progress: 99999999999999%")).isEmpty();
  }

  @Test
  void classify_shouldNotMatchKeywordInsideAnotherWord() {
    assertThat(classifier.classify("Rewriting cache")).isEmpty();
  }

  @Test
  void parsePercent_shouldSkipInvalidTokenAndTakeNextValidOne() {
    assertThat(classifier.parsePercent("200% then 30%")).contains(30);
    assertThat(classifier.parsePercent("100%")).contains(100);
    assertThat(classifier.parsePercent("0%")).contains(0);
  }
}
