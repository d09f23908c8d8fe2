package dlg;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;

@AutoValue
public abstract class CompilerConfig {
  public static final int DEFAULT_MAX_NODES = 512;
  public static final int DEFAULT_MAX_COMMANDS = 3;
  public static final int DEFAULT_MAX_CHOICES = 4;
  public static final int DEFAULT_INDENT_THRESHOLD = 4;
  public static final String DEFAULT_INITIAL_TAG = "start";
  public static final String DEFAULT_TAG_PREFIX = "node_";

  private static final CompilerConfig DEFAULTS = builder().build();

  public static CompilerConfig defaults() {
    return DEFAULTS;
  }

  public abstract int maxNodes();

  public abstract int maxCommands();

  public abstract int maxChoices();

  // Leading whitespace count at which a line opens or continues a choice block.
  public abstract int indentThreshold();

  // Tag of the first node when the script does not tag it.
  public abstract String initialTag();

  public abstract String defaultTagPrefix();

  // Whether a node or choice block still open at end of input is emitted.
  public abstract boolean flushAtEndOfInput();

  public abstract Builder toBuilder();

  public static Builder builder() {
    return new AutoValue_CompilerConfig.Builder()
        .setMaxNodes(DEFAULT_MAX_NODES)
        .setMaxCommands(DEFAULT_MAX_COMMANDS)
        .setMaxChoices(DEFAULT_MAX_CHOICES)
        .setIndentThreshold(DEFAULT_INDENT_THRESHOLD)
        .setInitialTag(DEFAULT_INITIAL_TAG)
        .setDefaultTagPrefix(DEFAULT_TAG_PREFIX)
        .setFlushAtEndOfInput(true);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setMaxNodes(int maxNodes);

    public abstract Builder setMaxCommands(int maxCommands);

    public abstract Builder setMaxChoices(int maxChoices);

    public abstract Builder setIndentThreshold(int indentThreshold);

    public abstract Builder setInitialTag(String initialTag);

    public abstract Builder setDefaultTagPrefix(String defaultTagPrefix);

    public abstract Builder setFlushAtEndOfInput(boolean flushAtEndOfInput);

    abstract CompilerConfig autoBuild();

    public CompilerConfig build() {
      CompilerConfig config = autoBuild();
      Preconditions.checkState(config.maxNodes() > 0, "maxNodes must be positive");
      Preconditions.checkState(config.maxCommands() > 0, "maxCommands must be positive");
      Preconditions.checkState(config.maxChoices() > 0, "maxChoices must be positive");
      Preconditions.checkState(config.indentThreshold() > 0, "indentThreshold must be positive");
      Preconditions.checkState(!config.initialTag().isEmpty(), "initialTag must be non-empty");
      Preconditions.checkState(
          !config.defaultTagPrefix().isEmpty(), "defaultTagPrefix must be non-empty");
      return config;
    }
  }
}
