package com.meridian.security;

/**
 * Kinds of objects the access policy speaks about. The {@link #value()} is the object
 * name used in policy rules.
 */
public enum EntityType {

    ASSET("asset"),
    UPLOADED_OBJECT("upload"),
    ACCESS_REQUEST("access_request"),
    WORKFLOW_JOB("workflow_job"),
    USER("user");

    private final String value;

    EntityType(String value) {
        this.value = value;
    }

    /** The object name as written in the policy file (e.g., "asset"). */
    public String value() {
        return value;
    }
}
