package asmsynth.diag;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Malformed chart. Carries every issue found in one validation pass.
 */
public class ChartValidationException extends CompileException {
  private static final long serialVersionUID = 1L;

  private final List<ValidationIssue> issues;

  public ChartValidationException(List<ValidationIssue> issues) {
    super(Stage.validate, DiagnosticKind.ValidationError, summarize(issues), collectIds(issues));
    this.issues = List.copyOf(issues);
  }

  public List<ValidationIssue> getIssues() { return issues; }

  private static String summarize(List<ValidationIssue> issues) {
    return issues.size() + " validation issue(s):\n" + issues.stream().map(issue -> "  " + issue).collect(Collectors.joining("\n"));
  }

  private static List<String> collectIds(List<ValidationIssue> issues) {
    LinkedHashSet<String> ids = new LinkedHashSet<>();
    issues.forEach(issue -> ids.addAll(issue.entityIds()));
    return List.copyOf(ids);
  }
}
