package dlg;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Compiles a dialogue script into a {@link DialogueGraph}.
 *
 * <p>Script syntax, one construct per line:
 *
 * <pre>
 * [tag]                      names the next node
 * &#64;command parameter         runs when the next node is reached
 * Character Name:            starts a node spoken by that character
 * Dialogue text.             one or more lines of node text
 * &lt;tab&gt;Choice text           indented entries after a node offer choices
 * &lt;tab&gt;[target_tag]         the node a choice leads to
 * </pre>
 *
 * <p>Compilation never fails. Malformed lines degrade to defaults and entries beyond the configured
 * capacities are dropped. Instances hold no per-compile state and may be reused.
 */
public class DialogueCompiler {
  private static final Logger LOGGER = LogManager.getLogger(DialogueCompiler.class);

  public static final String DEFAULT_SOURCE_NAME = "<input>";

  // Result of dispatching one line: either it was consumed, or the state changed and the same
  // line must be dispatched again under the new state.
  private enum Dispatch {
    CONSUMED,
    REPROCESS;
  }

  private final CompilerConfig config;
  private final LineClassifier classifier;

  public DialogueCompiler() {
    this(CompilerConfig.defaults());
  }

  public DialogueCompiler(CompilerConfig config) {
    this.config = Preconditions.checkNotNull(config);
    this.classifier = new LineClassifier(config.indentThreshold());
  }

  public CompilerConfig config() {
    return config;
  }

  public DialogueGraph compile(String content) {
    return compile(DEFAULT_SOURCE_NAME, content);
  }

  public DialogueGraph compile(String sourceName, String content) {
    Preconditions.checkNotNull(sourceName);
    Preconditions.checkNotNull(content);

    CompileSession session = new CompileSession(sourceName, config);
    ImmutableList<ScriptReader.Line> lines =
        new ScriptReader(sourceName, content, classifier).read();
    for (ScriptReader.Line line : lines) {
      Dispatch result;
      do {
        result = dispatch(session, line);
      } while (result == Dispatch.REPROCESS);
    }
    finishInput(session);

    DialogueGraph graph = session.finish();
    LOGGER.debug("Compiled {} lines of {} into {} nodes", lines.size(), sourceName, graph.size());
    return graph;
  }

  private Dispatch dispatch(CompileSession session, ScriptReader.Line line) {
    switch (session.state()) {
      case IDLE:
        return processIdle(session, line);
      case DIALOGUE:
        return processDialogue(session, line);
      case CHOICE:
        return processChoice(session, line);
    }
    throw new AssertionError(session.state());
  }

  private Dispatch processIdle(CompileSession session, ScriptReader.Line line) {
    NodeBuilder builder = session.nodeBuilder();
    switch (line.type()) {
      case CHARACTER_ID:
        builder.setCharacterId(TokenParsers.parseCharacterId(line.text()));
        session.setState(CompileSession.State.DIALOGUE);
        return Dispatch.CONSUMED;
      case DIALOGUE_LINE:
        // Text before any character label is kept and joins the next node.
        builder.appendText(line.text());
        return Dispatch.CONSUMED;
      case COMMAND:
        {
          DialogueGraph.Command command = TokenParsers.parseCommand(line.text());
          if (!builder.addCommand(command)) {
            LOGGER.debug(
                "{}: dropped {}, a node holds at most {} commands",
                line.pos(),
                command,
                config.maxCommands());
          }
          return Dispatch.CONSUMED;
        }
      case TAG:
        // A malformed tag line cancels any earlier tag line and restores the synthesized default.
        builder.setTag(TokenParsers.parseTag(line.text()).orElse(session.defaultTag()));
        return Dispatch.CONSUMED;
      case CHOICE:
        session.setState(CompileSession.State.CHOICE);
        return Dispatch.REPROCESS;
    }
    throw new AssertionError(line.type());
  }

  private Dispatch processDialogue(CompileSession session, ScriptReader.Line line) {
    if (line.type() == LineClassifier.Type.DIALOGUE_LINE) {
      session.nodeBuilder().appendText(line.text());
      return Dispatch.CONSUMED;
    }

    closeNode(session, line.pos());
    session.setState(CompileSession.State.IDLE);
    return Dispatch.REPROCESS;
  }

  // Choice lines arrive already de-indented, so classifying them again tells choice text apart
  // from the target tag that ends an entry.
  private Dispatch processChoice(CompileSession session, ScriptReader.Line line) {
    NodeBuilder builder = session.nodeBuilder();
    LineClassifier.Type innerType = classifier.classify(line.text());

    if (innerType == LineClassifier.Type.DIALOGUE_LINE) {
      builder.appendText(line.text());
      return Dispatch.CONSUMED;
    }

    if (innerType == LineClassifier.Type.TAG) {
      builder.setChoiceTarget(TokenParsers.parseTag(line.text()));
    }

    if (line.type() == LineClassifier.Type.CHOICE) {
      if (innerType == LineClassifier.Type.TAG) {
        flushChoice(session, line.pos());
      } else {
        LOGGER.debug("{}: ignored {} line inside a choice block", line.pos(), innerType);
      }
      return Dispatch.CONSUMED;
    }

    closeChoiceBlock(session, line.pos());
    session.setState(CompileSession.State.IDLE);
    return Dispatch.REPROCESS;
  }

  private void finishInput(CompileSession session) {
    if (session.state() == CompileSession.State.IDLE) return;

    ScriptReader.Pos eof = ScriptReader.Pos.ofFile(session.sourceName());
    if (!config.flushAtEndOfInput()) {
      LOGGER.debug("{}: discarding {} block still open at end of input", eof, session.state());
      return;
    }

    if (session.state() == CompileSession.State.DIALOGUE) {
      closeNode(session, eof);
    } else {
      closeChoiceBlock(session, eof);
    }
    session.setState(CompileSession.State.IDLE);
  }

  private void closeNode(CompileSession session, ScriptReader.Pos pos) {
    DialogueGraph.Node node = session.nodeBuilder().closeNode();
    if (!session.assembler().append(node)) {
      LOGGER.debug(
          "{}: dropped node [{}], a graph holds at most {} nodes",
          pos,
          node.tag(),
          config.maxNodes());
    }

    // An explicit tag line before the next node overrides this.
    session.nodeBuilder().setTag(session.nextDefaultTag());
  }

  private void flushChoice(CompileSession session, ScriptReader.Pos pos) {
    if (!session.nodeBuilder().flushChoice()) {
      LOGGER.debug("{}: dropped choice, a node holds at most {} choices", pos, config.maxChoices());
    }
  }

  private void closeChoiceBlock(CompileSession session, ScriptReader.Pos pos) {
    flushChoice(session, pos);

    ImmutableList<DialogueGraph.Choice> choices = session.nodeBuilder().takeChoices();
    if (!session.assembler().attachChoices(choices) && !choices.isEmpty()) {
      LOGGER.debug("{}: dropped {} choices with no node to attach to", pos, choices.size());
    }
  }
}
