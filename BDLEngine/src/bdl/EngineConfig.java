package bdl;

import java.util.Optional;
import java.util.Properties;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.ForOverride;

/** Tunables of a {@link Navigator}. */
@AutoValue
public abstract class EngineConfig {
  public static final String START_NODE = "bdl.start-node";
  public static final String FALLBACK_MESSAGE = "bdl.fallback.message";
  public static final String FALLBACK_DESTINATION = "bdl.fallback.destination";
  public static final String REPROMPT_MESSAGE = "bdl.reprompt.message";
  public static final String MAX_AUTO_TRANSITIONS = "bdl.max-auto-transitions";

  // The node a session starts at in the entry file.
  public abstract String startNode();

  public abstract String fallbackMessage();

  // 'file:node' or a node of the entry file. Defaults to the start node of the entry file.
  public abstract Optional<String> fallbackDestination();

  public abstract String repromptMessage();

  // Nodes rendered in one step before the session stops and waits for input.
  public abstract int maxAutoTransitions();

  public String fallbackReference(String entryFile) {
    return fallbackDestination().orElse(entryFile + ":" + startNode());
  }

  public abstract Builder toBuilder();

  public static Builder builder() {
    return new AutoValue_EngineConfig.Builder()
        .setStartNode("start")
        .setFallbackMessage("Something went wrong. Let's go back to the beginning.")
        .setRepromptMessage("Sorry, I didn't understand that. Please try again.")
        .setMaxAutoTransitions(50);
  }

  public static EngineConfig defaults() {
    return builder().build();
  }

  /** Reads the {@code bdl.*} keys of {@code properties}; absent keys keep their defaults. */
  public static EngineConfig fromProperties(Properties properties) {
    Builder builder = builder();

    String value = properties.getProperty(START_NODE);
    if (value != null) builder.setStartNode(value.trim());

    value = properties.getProperty(FALLBACK_MESSAGE);
    if (value != null) builder.setFallbackMessage(value);

    value = properties.getProperty(FALLBACK_DESTINATION);
    if (value != null && !value.trim().isEmpty()) builder.setFallbackDestination(value.trim());

    value = properties.getProperty(REPROMPT_MESSAGE);
    if (value != null) builder.setRepromptMessage(value);

    value = properties.getProperty(MAX_AUTO_TRANSITIONS);
    if (value != null) {
      try {
        builder.setMaxAutoTransitions(Integer.parseInt(value.trim()));
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException(
            String.format("%s must be an integer, got '%s'", MAX_AUTO_TRANSITIONS, value), ex);
      }
    }

    return builder.build();
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setStartNode(String startNode);

    public abstract Builder setFallbackMessage(String fallbackMessage);

    public abstract Builder setFallbackDestination(String fallbackDestination);

    public abstract Builder setRepromptMessage(String repromptMessage);

    public abstract Builder setMaxAutoTransitions(int maxAutoTransitions);

    @ForOverride
    abstract EngineConfig autoBuild();

    public EngineConfig build() {
      EngineConfig config = autoBuild();
      Preconditions.checkArgument(
          config.maxAutoTransitions() > 0,
          "maxAutoTransitions must be positive: %s",
          config.maxAutoTransitions());
      Preconditions.checkArgument(!config.startNode().isEmpty(), "startNode must not be empty");
      return config;
    }
  }
}
