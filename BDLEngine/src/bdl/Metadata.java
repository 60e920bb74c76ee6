package bdl;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** The '# Key: value' header of a script. */
@AutoValue
public abstract class Metadata {
  public abstract String topic();

  public abstract String description();

  public abstract String author();

  public abstract String version();

  // File names this script depends on, in declaration order.
  public abstract ImmutableList<String> required();

  public static Metadata create(
      String topic, String description, String author, String version, Iterable<String> required) {
    return new AutoValue_Metadata(
        topic, description, author, version, ImmutableList.copyOf(required));
  }
}
