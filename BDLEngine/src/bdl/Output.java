package bdl;

import java.util.ArrayList;
import java.util.List;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** What a session emitted since the previous call into the {@link Navigator}. */
@AutoValue
public abstract class Output {
  // Rendered text, in order.
  public abstract ImmutableList<String> segments();

  // Recovered errors: scope violations, failed calls, unresolved destinations.
  public abstract ImmutableList<String> warnings();

  public abstract boolean exited();

  public String text() {
    return String.join("\n", segments());
  }

  static Output exitedOutput() {
    return new AutoValue_Output(ImmutableList.of(), ImmutableList.of(), true);
  }

  // Accumulates the output of one step.
  static final class Collector {
    private final List<String> segments = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    void emit(String segment) {
      segments.add(segment);
    }

    void warn(String warning) {
      warnings.add(warning);
    }

    Output build(boolean exited) {
      return new AutoValue_Output(
          ImmutableList.copyOf(segments), ImmutableList.copyOf(warnings), exited);
    }
  }
}
