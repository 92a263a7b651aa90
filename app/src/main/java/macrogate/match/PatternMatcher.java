package macrogate.match;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.IntStream;
import macrogate.model.OperationSequence;
import macrogate.signature.CanonicalSignature;
import macrogate.signature.SignatureCanonicalizer;
import macrogate.signature.SignatureCanonicalizer.CanonicalWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sliding-window search for repeated structures.
 *
 * <p>For every window size k in {@code [minWindowSize, maxWindowSize]} (capped at N), each of the
 * N-k+1 windows is canonicalized and grouped by signature. Groups with at least {@code
 * minRepetitions} windows become candidates; overlapping occurrences are kept as they are.
 *
 * <p>The per-size passes share nothing and can run on a {@link ForkJoinPool}; results are always
 * returned ordered by window size, then by first occurrence, whatever the parallelism.
 */
public final class PatternMatcher {
  private static final Logger LOG = LoggerFactory.getLogger(PatternMatcher.class);

  private final int minRepetitions;
  private final int minWindowSize;
  private final int maxWindowSize;
  private final int parallelism;

  public PatternMatcher(int minRepetitions, int maxWindowSize) {
    this(minRepetitions, 1, maxWindowSize, 1);
  }

  public PatternMatcher(int minRepetitions, int minWindowSize, int maxWindowSize, int parallelism) {
    if (minRepetitions < 2) {
      throw new IllegalArgumentException("minRepetitions must be at least 2: " + minRepetitions);
    }
    if (minWindowSize < 1) {
      throw new IllegalArgumentException("minWindowSize must be at least 1: " + minWindowSize);
    }
    if (maxWindowSize < 0) {
      throw new IllegalArgumentException("maxWindowSize must be non-negative: " + maxWindowSize);
    }
    if (parallelism < 1) {
      throw new IllegalArgumentException("parallelism must be at least 1: " + parallelism);
    }
    this.minRepetitions = minRepetitions;
    this.minWindowSize = minWindowSize;
    this.maxWindowSize = maxWindowSize;
    this.parallelism = parallelism;
  }

  public List<MacroCandidate> findCandidates(OperationSequence sequence) {
    int upper = Math.min(maxWindowSize, sequence.size());
    if (upper < minWindowSize) {
      return List.of();
    }
    List<List<MacroCandidate>> perSize;
    if (parallelism > 1 && upper > minWindowSize) {
      ForkJoinPool pool = new ForkJoinPool(parallelism);
      try {
        perSize =
            pool.submit(
                    () ->
                        IntStream.rangeClosed(minWindowSize, upper)
                            .parallel()
                            .mapToObj(k -> scanWindowSize(sequence, k))
                            .toList())
                .join();
      } finally {
        pool.shutdown();
      }
    } else {
      perSize = new ArrayList<>();
      for (int k = minWindowSize; k <= upper; k++) {
        perSize.add(scanWindowSize(sequence, k));
      }
    }

    List<MacroCandidate> candidates = new ArrayList<>();
    for (List<MacroCandidate> group : perSize) {
      candidates.addAll(group);
    }
    LOG.debug(
        "Window sizes {}..{} over {} operations produced {} candidates",
        minWindowSize,
        upper,
        sequence.size(),
        candidates.size());
    return candidates;
  }

  /** Candidates of a single window size, in order of first occurrence. */
  List<MacroCandidate> scanWindowSize(OperationSequence sequence, int windowSize) {
    Map<CanonicalSignature, List<Occurrence>> index = new LinkedHashMap<>();
    int lastStart = sequence.size() - windowSize;
    for (int start = 0; start <= lastStart; start++) {
      CanonicalWindow window =
          SignatureCanonicalizer.canonicalize(sequence.window(start, windowSize));
      index
          .computeIfAbsent(window.signature(), key -> new ArrayList<>())
          .add(new Occurrence(start, start + windowSize, window.binding()));
    }
    List<MacroCandidate> candidates = new ArrayList<>();
    for (Map.Entry<CanonicalSignature, List<Occurrence>> entry : index.entrySet()) {
      if (entry.getValue().size() >= minRepetitions) {
        candidates.add(new MacroCandidate(entry.getKey(), windowSize, entry.getValue()));
      }
    }
    return candidates;
  }
}
