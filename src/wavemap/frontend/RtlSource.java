package wavemap.frontend;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One RTL source file reduced to the lines the scanners work on: comments removed, trailing whitespace trimmed,
 * blank lines dropped.
 */
public class RtlSource {
  private static final Pattern COMMENT = Pattern.compile("//[^\\n]*|/\\*.*?\\*/", Pattern.DOTALL);

  private final String name;
  private final List<String> lines;

  public RtlSource(String name, List<String> lines) {
    this.name = name;
    this.lines = Collections.unmodifiableList(new ArrayList<>(lines));
  }

  /**
   * Prepares RTL text for scanning.
   * @param name name used in messages, e.g. the file path
   * @param text the raw RTL text
   * @return the prepared source
   */
  public static RtlSource fromText(String name, String text) {
    List<String> lines = new ArrayList<>();
    for (String line : stripComments(text).split("\\r?\\n")) {
      String trimmed = line.stripTrailing();
      if (!trimmed.isBlank())
        lines.add(trimmed);
    }
    return new RtlSource(name, lines);
  }

  /**
   * Reads and prepares an RTL file (UTF-8; malformed bytes are replaced).
   * @param file path of the file
   * @return the prepared source
   * @throws IOException if the file cannot be read
   */
  public static RtlSource read(Path file) throws IOException {
    byte[] content = Files.readAllBytes(file);
    return fromText(file.toString(), new String(content, StandardCharsets.UTF_8));
  }

  /**
   * Removes line and block comments. A block comment is replaced by a single space, so tokens on either side stay
   * apart; an unterminated block comment is kept as text.
   */
  public static String stripComments(String text) {
    Matcher matcher = COMMENT.matcher(text);
    StringBuilder out = new StringBuilder(text.length());
    while (matcher.find())
      matcher.appendReplacement(out, matcher.group().startsWith("//") ? "" : " ");
    matcher.appendTail(out);
    return out.toString();
  }

  public String getName() { return name; }
  public List<String> getLines() { return lines; }
}
