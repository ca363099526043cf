package com.profileparser.model;

/**
 * Kinds of profiled operations, in the order their summary tables are printed
 */
public enum OperationKind {
    FUNCTION_CALL("function_call", "Function calls"),
    RESOURCE_EVAL("resource_eval", "Resource evaluations"),
    PUPPETDB_CALL("puppetdb_call", "PuppetDB operations"),
    HTTP_REQUEST("http_request", "HTTP Requests"),
    OTHER("other", "Other evaluations");

    private final String tagValue;
    private final String summaryTitle;

    OperationKind(String tagValue, String summaryTitle) {
        this.tagValue = tagValue;
        this.summaryTitle = summaryTitle;
    }

    /**
     * Value of the {@code puppet.op_type} tag
     */
    public String getTagValue() {
        return tagValue;
    }

    public String getSummaryTitle() {
        return summaryTitle;
    }
}
