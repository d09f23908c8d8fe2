package dlg;

public class CompilerException extends Exception {
  private static final long serialVersionUID = 1L;

  private final ScriptReader.Pos pos;
  private final String errorMsg;

  public CompilerException(ScriptReader.Pos pos, String errorMsg) {
    super(errorMsg);
    this.pos = pos;
    this.errorMsg = errorMsg;
  }

  public CompilerException(ScriptReader.Pos pos, String errorMsg, Throwable cause) {
    super(errorMsg, cause);
    this.pos = pos;
    this.errorMsg = errorMsg;
  }

  public ScriptReader.Pos pos() {
    return pos;
  }

  public String describe() {
    return String.format("%s %s", pos, errorMsg);
  }
}
