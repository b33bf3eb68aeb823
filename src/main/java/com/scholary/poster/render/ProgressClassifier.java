package com.scholary.poster.render;

import java.util.Arrays;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Best-effort translation of renderer output into progress hints.
 *
 * <p>The renderer prints free text. Two kinds of signal are recognised:
 *
 * <ul>
 *   <li>a percentage token such as {@code 45%}, taken as the progress value directly
 *   <li>keywords naming a phase, mapped to a coarse milestone:
 *       <ul>
 *         <li>fetching / downloading: 15%
 *         <li>processing / building: 40%
 *         <li>rendering / drawing: 70%
 *         <li>saving / writing: 90%
 *       </ul>
 * </ul>
 *
 * <p>When a line carries both, the explicit percentage wins for the progress value and the
 * milestone supplies the message. Anything else yields nothing. This class is stateless and never
 * throws on odd input.
 */
@Component
public class ProgressClassifier {

  private static final Pattern PERCENT_PATTERN = Pattern.compile("(\\d+)%");

  enum Milestone {
    FETCHING(15, "Fetching map data from OpenStreetMap...", "fetching|downloading"),
    PROCESSING(40, "Processing map data...", "processing|building"),
    RENDERING(70, "Rendering poster...", "rendering|drawing"),
    SAVING(90, "Saving poster image...", "saving|writing");

    private final int progress;
    private final String message;
    private final Pattern pattern;

    Milestone(int progress, String message, String keywords) {
      this.progress = progress;
      this.message = message;
      this.pattern = Pattern.compile("\\b(" + keywords + ")\\b", Pattern.CASE_INSENSITIVE);
    }

    int progress() {
      return progress;
    }

    String message() {
      return message;
    }
  }

  /**
   * Classify one line of renderer output.
   *
   * @param line a standard output line, possibly {@code null}
   * @return the progress hint, or empty if the line carries none
   */
  public Optional<ProgressSignal> classify(String line) {
    if (line == null || line.isBlank()) {
      return Optional.empty();
    }

    Optional<Integer> percent = parsePercent(line);
    // First matching milestone wins, in declaration order.
    Optional<Milestone> milestone =
        Arrays.stream(Milestone.values()).filter(m -> m.pattern.matcher(line).find()).findFirst();

    if (milestone.isPresent()) {
      Milestone m = milestone.get();
      return Optional.of(new ProgressSignal(percent.orElse(m.progress()), m.message()));
    }
    return percent.map(p -> new ProgressSignal(p, null));
  }

  /** The first well-formed percentage (0-100) in the line. */
  Optional<Integer> parsePercent(String line) {
    Matcher matcher = PERCENT_PATTERN.matcher(line);
    while (matcher.find()) {
      String digits = matcher.group(1);
      if (digits.length() > 3) {
        continue;
      }
      int value = Integer.parseInt(digits);
      if (value <= 100) {
        return Optional.of(value);
      }
    }
    return Optional.empty();
  }
}
