package macrogate.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Wall-clock timer that records the duration of consecutive named stages. */
public final class StageTimer {
  private final long startedAt;
  private final Map<String, Long> stageNanos = new LinkedHashMap<>();
  private long lastMark;

  private StageTimer(long startedAt) {
    this.startedAt = startedAt;
    this.lastMark = startedAt;
  }

  public static StageTimer start() {
    return new StageTimer(System.nanoTime());
  }

  /** Closes the running stage under {@code name} and starts the next one. */
  public void mark(String name) {
    long now = System.nanoTime();
    stageNanos.merge(name, now - lastMark, Long::sum);
    lastMark = now;
  }

  public long elapsedMillis() {
    return (System.nanoTime() - startedAt) / 1_000_000L;
  }

  /** Stage durations in milliseconds, in the order the stages were first marked. */
  public Map<String, Long> stageMillis() {
    Map<String, Long> millis = new LinkedHashMap<>();
    stageNanos.forEach((name, nanos) -> millis.put(name, nanos / 1_000_000L));
    return Collections.unmodifiableMap(millis);
  }
}
