package dlg;

import com.google.common.collect.LinkedHashMultiset;
import com.google.common.collect.Multiset;

final class DuplicateTagValidator extends ErrorCollectingValidator {
  private final Multiset<String> counts = LinkedHashMultiset.create();

  @Override
  protected void visit(DialogueGraph graph, DialogueGraph.Node node) {
    counts.add(node.tag());
  }

  @Override
  protected void finish(DialogueGraph graph) {
    for (Multiset.Entry<String> entry : counts.entrySet()) {
      if (entry.getCount() <= 1) continue;

      logError(
          graph,
          String.format(
              "duplicate tag [%s] on %d nodes; lookups resolve to the last one",
              entry.getElement(),
              entry.getCount()));
    }
  }
}
