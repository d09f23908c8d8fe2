package dlg;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/**
 * The compiled form of a dialogue script: nodes in the order the compiler closed them.
 *
 * <p>Choices reference nodes by tag only. Nothing here guarantees that a target exists or that
 * tags are unique; see {@link GraphValidator} for an opt-in check.
 */
@AutoValue
public abstract class DialogueGraph {

  // A directive for the runtime to execute when its node is reached.
  @AutoValue
  public abstract static class Command {
    public abstract String name();

    // Absent for "@name", possibly empty for "@name ".
    public abstract Optional<String> parameter();

    public static Command create(String name, Optional<String> parameter) {
      return new AutoValue_DialogueGraph_Command(name, parameter);
    }

    @Override
    public String toString() {
      return parameter().map(p -> "@" + name() + " " + p).orElse("@" + name());
    }
  }

  @AutoValue
  public abstract static class Choice {
    public abstract String text();

    public abstract Optional<String> targetTag();

    public static Choice create(String text, Optional<String> targetTag) {
      return new AutoValue_DialogueGraph_Choice(text, targetTag);
    }

    @Override
    public String toString() {
      return text() + " -> " + targetTag().map(t -> "[" + t + "]").orElse("<none>");
    }
  }

  @AutoValue
  public abstract static class Node {
    public abstract String tag();

    public abstract Optional<String> characterId();

    public abstract String text();

    public abstract ImmutableList<Command> commands();

    public abstract ImmutableList<Choice> choices();

    public Node withChoices(Iterable<Choice> choices) {
      return create(tag(), characterId(), text(), commands(), choices);
    }

    public static Node create(
        String tag,
        Optional<String> characterId,
        String text,
        Iterable<Command> commands,
        Iterable<Choice> choices) {
      return new AutoValue_DialogueGraph_Node(
          tag, characterId, text, ImmutableList.copyOf(commands), ImmutableList.copyOf(choices));
    }
  }

  public abstract String sourceName();

  public abstract ImmutableList<Node> nodes();

  public int size() {
    return nodes().size();
  }

  public boolean isEmpty() {
    return nodes().isEmpty();
  }

  public Node node(int index) {
    return nodes().get(index);
  }

  // When a tag is reused, the last node carrying it wins.
  public Optional<Node> findNode(String tag) {
    for (Node node : nodes().reverse()) {
      if (node.tag().equals(tag)) return Optional.of(node);
    }
    return Optional.empty();
  }

  public static DialogueGraph create(String sourceName, Iterable<Node> nodes) {
    return new AutoValue_DialogueGraph(sourceName, ImmutableList.copyOf(nodes));
  }
}
