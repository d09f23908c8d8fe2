package dlg;

import java.util.List;
import java.util.OptionalInt;

public final class GraphAssembler {
  private final BoundedList<DialogueGraph.Node> nodes;

  // Index of the most recently closed node; empty before the first close or after a dropped one.
  private OptionalInt lastClosed = OptionalInt.empty();

  public GraphAssembler(int maxNodes) {
    this.nodes = new BoundedList<>(maxNodes);
  }

  public boolean append(DialogueGraph.Node node) {
    if (!nodes.tryAdd(node)) {
      lastClosed = OptionalInt.empty();
      return false;
    }

    lastClosed = OptionalInt.of(nodes.size() - 1);
    return true;
  }

  public boolean attachChoices(List<DialogueGraph.Choice> choices) {
    if (!lastClosed.isPresent()) return false;

    int index = lastClosed.getAsInt();
    nodes.set(index, nodes.get(index).withChoices(choices));
    return true;
  }

  public DialogueGraph build(String sourceName) {
    return DialogueGraph.create(sourceName, nodes.toList());
  }
}
