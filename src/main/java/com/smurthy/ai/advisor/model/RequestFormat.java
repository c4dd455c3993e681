package com.smurthy.ai.advisor.model;

/**
 * Name of the JSON field a downstream agent family expects the user question in.
 */
public enum RequestFormat {
    QUESTION("question"),
    USER_QUERY("user_query");

    private final String fieldName;

    RequestFormat(String fieldName) {
        this.fieldName = fieldName;
    }

    public String fieldName() {
        return fieldName;
    }
}
