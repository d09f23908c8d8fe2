package dlg;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

// Opt-in lint: choice targets that name no node, and tags shared by several nodes.
public class GraphValidator {

  private final DialogueGraph graph;
  private ImmutableList<CompilerException> errors;

  public GraphValidator(DialogueGraph graph) {
    this.graph = Preconditions.checkNotNull(graph);
  }

  // The checks run on the first call only; later calls return the same list.
  public ImmutableList<CompilerException> computeErrors() {
    if (errors == null) {
      ImmutableSet<String> tags =
          graph.nodes().stream()
              .map(DialogueGraph.Node::tag)
              .collect(ImmutableSet.toImmutableSet());

      ImmutableList.Builder<CompilerException> builder = ImmutableList.builder();
      acceptAll(new DuplicateTagValidator(), builder);
      acceptAll(new ChoiceTargetValidator(tags), builder);
      errors = builder.build();
    }
    return errors;
  }

  private void acceptAll(
      ErrorCollectingValidator visitor, ImmutableList.Builder<CompilerException> builder) {
    visitor.validate(graph);
    builder.addAll(visitor.errors());
  }
}
