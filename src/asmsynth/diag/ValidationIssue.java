package asmsynth.diag;

import java.util.List;

/**
 * One problem found while validating a chart description.
 */
public record ValidationIssue(String message, List<String> entityIds) {

  public ValidationIssue {
    entityIds = List.copyOf(entityIds);
  }

  public static ValidationIssue of(String message, String... entityIds) { return new ValidationIssue(message, List.of(entityIds)); }

  @Override
  public String toString() {
    return message + (entityIds.isEmpty() ? "" : " " + entityIds);
  }
}
