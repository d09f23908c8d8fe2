package dlg;

// Working state of a single DialogueCompiler.compile call.
final class CompileSession {
  enum State {
    IDLE,
    DIALOGUE,
    CHOICE;
  }

  private final String sourceName;
  private final NodeBuilder nodeBuilder;
  private final GraphAssembler assembler;
  private final String defaultTagPrefix;

  private State state = State.IDLE;
  private int nextDefaultTagId = 0;
  private String defaultTag;

  CompileSession(String sourceName, CompilerConfig config) {
    this.sourceName = sourceName;
    this.nodeBuilder = new NodeBuilder(config);
    this.assembler = new GraphAssembler(config.maxNodes());
    this.defaultTagPrefix = config.defaultTagPrefix();
    this.defaultTag = config.initialTag();
  }

  String sourceName() {
    return sourceName;
  }

  NodeBuilder nodeBuilder() {
    return nodeBuilder;
  }

  GraphAssembler assembler() {
    return assembler;
  }

  State state() {
    return state;
  }

  void setState(State state) {
    this.state = state;
  }

  // The tag the pending node gets when no valid tag line names it.
  String defaultTag() {
    return defaultTag;
  }

  String nextDefaultTag() {
    defaultTag = defaultTagPrefix + nextDefaultTagId++;
    return defaultTag;
  }

  DialogueGraph finish() {
    return assembler.build(sourceName);
  }
}
