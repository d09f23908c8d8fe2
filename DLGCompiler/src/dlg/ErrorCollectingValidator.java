package dlg;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.ForOverride;

abstract class ErrorCollectingValidator {
  private final List<CompilerException> errors = new ArrayList<>();

  protected ImmutableList<CompilerException> errors() {
    return ImmutableList.copyOf(errors);
  }

  protected void logError(DialogueGraph graph, String msg) {
    logError(new CompilerException(ScriptReader.Pos.ofFile(graph.sourceName()), msg));
  }

  protected void logError(CompilerException ex) {
    errors.add(ex);
  }

  final void validate(DialogueGraph graph) {
    for (DialogueGraph.Node node : graph.nodes()) {
      visit(graph, node);
    }
    finish(graph);
  }

  @ForOverride
  protected void visit(DialogueGraph graph, DialogueGraph.Node node) {}

  @ForOverride
  protected void finish(DialogueGraph graph) {}
}
