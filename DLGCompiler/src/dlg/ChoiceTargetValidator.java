package dlg;

import com.google.common.collect.ImmutableSet;

final class ChoiceTargetValidator extends ErrorCollectingValidator {

  private final ImmutableSet<String> tags;

  public ChoiceTargetValidator(ImmutableSet<String> tags) {
    this.tags = tags;
  }

  @Override
  protected void visit(DialogueGraph graph, DialogueGraph.Node node) {
    for (DialogueGraph.Choice choice : node.choices()) {
      if (!choice.targetTag().isPresent()) {
        logError(
            graph, String.format("[%s] choice '%s' has no target tag", node.tag(), choice.text()));
      } else if (!tags.contains(choice.targetTag().get())) {
        logError(
            graph,
            String.format(
                "[%s] choice '%s' targets undefined tag: %s",
                node.tag(),
                choice.text(),
                choice.targetTag().get()));
      }
    }
  }
}
