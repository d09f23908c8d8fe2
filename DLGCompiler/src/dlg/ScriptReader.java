package dlg;

import java.util.Comparator;

import com.google.auto.value.AutoValue;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

public class ScriptReader {
  public static class Pos implements Comparable<Pos> {
    private final String file;
    private final int lineNumber;
    private final int column;

    public Pos(String file, int lineNumber, int column) {
      this.file = file;
      this.lineNumber = lineNumber;
      this.column = column;
    }

    // For diagnostics that concern a whole file rather than a line in it.
    public static Pos ofFile(String file) {
      return new Pos(file, -1, -1);
    }

    public String file() {
      return file;
    }

    public int lineNumber() {
      return lineNumber;
    }

    public int column() {
      return column;
    }

    public boolean hasLine() {
      return lineNumber >= 0;
    }

    @Override
    public int compareTo(Pos pos) {
      return Comparator.comparing(Pos::file)
          .thenComparing(Pos::lineNumber)
          .thenComparing(Pos::column)
          .compare(this, pos);
    }

    @Override
    public String toString() {
      return hasLine() ? String.format("%s@%d:%d", file, lineNumber + 1, column + 1) : file;
    }
  }

  // A non-blank script line, classified before its indentation was stripped.
  @AutoValue
  public abstract static class Line {
    public abstract LineClassifier.Type type();

    public abstract String text();

    public abstract Pos pos();

    public static Line create(LineClassifier.Type type, String text, Pos pos) {
      return new AutoValue_ScriptReader_Line(type, text, pos);
    }
  }

  private final String file;
  private final ImmutableList<String> lines;
  private final LineClassifier classifier;

  public ScriptReader(String file, String content, LineClassifier classifier) {
    this.file = file;
    this.lines = ImmutableList.copyOf(Splitter.on('\n').split(content));
    this.classifier = classifier;
  }

  public ImmutableList<Line> read() {
    ImmutableList.Builder<Line> builder = ImmutableList.builder();
    for (int i = 0; i < lines.size(); i++) {
      String raw = trimCarriageReturn(lines.get(i));
      if (LineClassifier.isBlank(raw)) continue;

      LineClassifier.Type type = classifier.classify(raw);
      String stripped = LineClassifier.stripIndent(raw);
      builder.add(Line.create(type, stripped, new Pos(file, i, raw.length() - stripped.length())));
    }
    return builder.build();
  }

  private static String trimCarriageReturn(String line) {
    return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
  }
}
