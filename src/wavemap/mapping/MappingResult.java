package wavemap.mapping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import wavemap.netlist.AnalysisIssue;

/**
 * Output table of a mapping run, with the substitutions made and the rows that had to be skipped.
 */
public class MappingResult {
  private final OutputTable table;
  private final List<Resolution> substitutions;
  private final List<AnalysisIssue> issues;

  public MappingResult(OutputTable table, List<Resolution> substitutions, List<AnalysisIssue> issues) {
    this.table = table;
    this.substitutions = Collections.unmodifiableList(new ArrayList<>(substitutions));
    this.issues = Collections.unmodifiableList(new ArrayList<>(issues));
  }

  public OutputTable getTable() { return table; }
  /** First substitution of each filled signal, in order of occurrence. */
  public List<Resolution> getSubstitutions() { return substitutions; }
  public List<AnalysisIssue> getIssues() { return issues; }
}
