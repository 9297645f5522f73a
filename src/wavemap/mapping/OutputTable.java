package wavemap.mapping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A mapped table: classification row, header row and data rows, all of the header's length.
 */
public class OutputTable {
  private final List<String> classes;
  private final List<String> header;
  private final List<List<String>> rows;

  public OutputTable(List<String> classes, List<String> header, List<List<String>> rows) {
    if (classes.size() != header.size())
      throw new IllegalArgumentException("classification row has " + classes.size() + " cells, header has " + header.size());
    this.classes = Collections.unmodifiableList(new ArrayList<>(classes));
    this.header = Collections.unmodifiableList(new ArrayList<>(header));
    List<List<String>> copy = new ArrayList<>();
    for (List<String> row : rows) {
      if (row.size() != header.size())
        throw new IllegalArgumentException("row has " + row.size() + " cells, header has " + header.size());
      copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
    }
    this.rows = Collections.unmodifiableList(copy);
  }

  public List<String> getClasses() { return classes; }
  public List<String> getHeader() { return header; }
  public List<List<String>> getRows() { return rows; }
  public int getWidth() { return header.size(); }

  /**
   * @param column header name
   * @return the column's values in row order
   * @throws IllegalArgumentException if there is no such column
   */
  public List<String> column(String column) {
    int index = header.indexOf(column);
    if (index < 0)
      throw new IllegalArgumentException("No column " + column);
    List<String> ret = new ArrayList<>();
    for (List<String> row : rows)
      ret.add(row.get(index));
    return ret;
  }
}
