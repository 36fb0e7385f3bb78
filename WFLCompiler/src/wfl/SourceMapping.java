package wfl;

import com.google.auto.value.AutoValue;

/** A line of generated Java and the workflow source position it was generated from, 1-based. */
@AutoValue
public abstract class SourceMapping {
  public abstract int generatedLine();

  public abstract String sourceFile();

  public abstract int sourceLine();

  public abstract int sourceColumn();

  public static SourceMapping create(
      int generatedLine, String sourceFile, int sourceLine, int sourceColumn) {
    return new AutoValue_SourceMapping(generatedLine, sourceFile, sourceLine, sourceColumn);
  }

  static SourceMapping at(int generatedLine, Tokenizer.Pos pos) {
    return create(
        generatedLine,
        pos.file(),
        Math.max(pos.lineNumber(), 0) + 1,
        Math.max(pos.column(), 0) + 1);
  }

  @Override
  public final String toString() {
    return String.format(
        "%d -> %s:%d:%d", generatedLine(), sourceFile(), sourceLine(), sourceColumn());
  }
}
