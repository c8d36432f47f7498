package io.biblcal.report;

/** Line-oriented text consumer that reports are written to. */
public interface OutputSink {

  /**
   * Appends text to the current line.
   *
   * @param text the text
   */
  void write(String text);

  /**
   * Appends text and ends the current line.
   *
   * @param text the text
   */
  void writeLine(String text);

  /** Discards everything written so far. */
  void clear();
}
