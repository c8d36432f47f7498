package io.biblcal.report;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Keeps report output in memory as completed lines plus the line in progress. */
public final class BufferedOutputSink implements OutputSink {
  private final List<String> lines = new ArrayList<>();
  private final StringBuilder pending = new StringBuilder();

  @Override
  public void write(String text) {
    pending.append(Objects.requireNonNull(text, "text"));
  }

  @Override
  public void writeLine(String text) {
    write(text);
    lines.add(pending.toString());
    pending.setLength(0);
  }

  @Override
  public void clear() {
    lines.clear();
    pending.setLength(0);
  }

  /**
   * Returns the completed lines.
   *
   * @return the lines, oldest first
   */
  public List<String> lines() {
    return List.copyOf(lines);
  }

  /**
   * Returns the text of the line not yet ended.
   *
   * @return the pending text, possibly empty
   */
  public String pendingLine() {
    return pending.toString();
  }

  /**
   * Returns everything written, lines joined with newlines.
   *
   * @return the full text
   */
  public String text() {
    StringBuilder sb = new StringBuilder();
    for (String line : lines) {
      sb.append(line).append('\n');
    }
    return sb.append(pending).toString();
  }
}
