package com.dbexplorer.error;

/**
 * Reason codes for rejected user queries. The codes are part of the reply contract.
 */
public enum RejectionReason {
    MULTI_STATEMENT("multiStatement"),
    NOT_SELECT("notSelect"),
    BLOCKED_KEYWORD("blockedKeyword"),
    COMMENT_INJECTION("commentInjection"),
    LIMIT_EXCEEDED("limitExceeded"),
    UNKNOWN_IDENTIFIER("unknownIdentifier"),
    INVALID_FILTER_VALUE("invalidFilterValue");

    private final String code;

    RejectionReason(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
