package dlg;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;

public class LineClassifier {
  public enum Type {
    CHARACTER_ID,
    DIALOGUE_LINE,
    COMMAND,
    CHOICE,
    TAG;
  }

  // Unicode White_Space, which unlike Character.isWhitespace includes the no-break spaces.
  static final CharMatcher WHITESPACE = CharMatcher.whitespace();

  private final int indentThreshold;

  public LineClassifier(int indentThreshold) {
    Preconditions.checkArgument(indentThreshold > 0, "indentThreshold must be positive");
    this.indentThreshold = indentThreshold;
  }

  // Indentation is checked first, so an indented "[tag]" is still a choice line.
  public Type classify(String line) {
    if (isIndented(line)) {
      return Type.CHOICE;
    } else if (line.length() > 1
        && line.charAt(0) == '['
        && line.charAt(line.length() - 1) == ']') {
      return Type.TAG;
    } else if (!line.isEmpty() && line.charAt(0) == '@') {
      return Type.COMMAND;
    } else if (!line.isEmpty() && line.charAt(line.length() - 1) == ':') {
      return Type.CHARACTER_ID;
    }

    return Type.DIALOGUE_LINE;
  }

  public boolean isIndented(String line) {
    if (line.isEmpty()) return false;
    if (line.charAt(0) == '\t') return true;

    int firstNonWhitespace = WHITESPACE.negate().indexIn(line);
    return firstNonWhitespace < 0 || firstNonWhitespace >= indentThreshold;
  }

  // One leading tab, or else the whole leading whitespace run.
  public static String stripIndent(String line) {
    if (line.isEmpty()) return line;
    if (line.charAt(0) == '\t') return line.substring(1);

    return WHITESPACE.trimLeadingFrom(line);
  }

  public static boolean isBlank(String line) {
    return WHITESPACE.matchesAllOf(line);
  }
}
