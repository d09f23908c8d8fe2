package dlg;

import java.util.Optional;

public final class TokenParsers {
  private TokenParsers() {}

  // "@name" or "@name parameter text"
  public static DialogueGraph.Command parseCommand(String line) {
    if (line.indexOf(' ') < 0) {
      return DialogueGraph.Command.create(line.substring(1), Optional.empty());
    }

    int nameEnd = 1;
    while (nameEnd < line.length() && !LineClassifier.WHITESPACE.matches(line.charAt(nameEnd))) {
      nameEnd++;
    }

    int paramStart = nameEnd;
    while (paramStart < line.length()
        && LineClassifier.WHITESPACE.matches(line.charAt(paramStart))) {
      paramStart++;
    }

    return DialogueGraph.Command.create(
        line.substring(1, nameEnd), Optional.of(line.substring(paramStart)));
  }

  // Truncates at the last colon, so "Dr: Who:" names "Dr: Who".
  public static String parseCharacterId(String line) {
    int colon = line.lastIndexOf(':');
    return colon < 0 ? line : line.substring(0, colon);
  }

  // Empty when the line is too short to hold a tag, has no closing bracket, or the brackets enclose
  // nothing.
  public static Optional<String> parseTag(String line) {
    if (line.length() < 3) return Optional.empty();

    int start = 0;
    for (int i = 0; i < line.length(); i++) {
      char ch = line.charAt(i);
      if (ch == '[') {
        start = i + 1;
      } else if (ch == ']') {
        return start == i ? Optional.empty() : Optional.of(line.substring(start, i));
      }
    }

    return Optional.empty();
  }
}
