package io.wxpanel.application.pipeline;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * <strong>What:</strong> Summary of a product run: every unit outcome plus the canvases written and
 * those that could not be saved.
 * <p><strong>Role:</strong> Returned by {@link ForecastPanelUseCase#run}; the CLI logs
 * {@link #summary()} and derives its exit code from {@link #hasSaveFailures()}.</p>
 *
 * @param product product name
 * @param units unit results in configured order
 * @param savedCanvases files written
 * @param failedCanvases identifiers of canvases whose save failed
 * @since 0.1.0
 */
public record RunReport(
    String product, List<UnitResult> units, List<Path> savedCanvases, List<String> failedCanvases) {

  public RunReport {
    Objects.requireNonNull(product, "product");
    units = List.copyOf(units);
    savedCanvases = List.copyOf(savedCanvases);
    failedCanvases = List.copyOf(failedCanvases);
  }

  public Optional<UnitResult> unit(String unitId) {
    return units.stream().filter(u -> u.unitId().equals(unitId)).findFirst();
  }

  public long count(UnitOutcome outcome) {
    return units.stream().filter(u -> u.outcome() == outcome).count();
  }

  /** Outcome counts, in enum order, omitting zero entries. */
  public Map<UnitOutcome, Long> countsByOutcome() {
    Map<UnitOutcome, Long> counts = units.stream()
        .collect(Collectors.groupingBy(UnitResult::outcome, () -> new EnumMap<>(UnitOutcome.class),
            Collectors.counting()));
    return Collections.unmodifiableMap(counts);
  }

  public boolean hasSaveFailures() {
    return !failedCanvases.isEmpty();
  }

  /**
   * One-line summary for operator logs.
   *
   * @return e.g. {@code two-day: 6/8 composited, 2 skipped, 0 failed; 2 canvas(es) saved, 0 failed}
   */
  public String summary() {
    long composited = count(UnitOutcome.COMPOSITED);
    long skipped = units.stream().filter(u -> u.outcome().isSkip()).count();
    long failed = units.stream().filter(u -> u.outcome().isFailure()).count();
    return product + ": " + composited + "/" + units.size() + " composited, "
        + skipped + " skipped, " + failed + " failed; "
        + savedCanvases.size() + " canvas(es) saved, " + failedCanvases.size() + " failed";
  }
}
