package com.gentoro.usagereporting.report;

/** Keys that group traces and stats within a report. */
public final class StatsReportKeys {
  public static final String PARSE_FAILURE = "## GraphQLParseFailure\n";
  public static final String VALIDATION_FAILURE = "## GraphQLValidationFailure\n";
  public static final String UNKNOWN_OPERATION_NAME = "## GraphQLUnknownOperationName\n";

  private StatsReportKeys() {}

  public static String forOperation(String operationName, String signature) {
    String name = operationName == null || operationName.isEmpty() ? "-" : operationName;
    return "# " + name + "\n" + signature;
  }
}
