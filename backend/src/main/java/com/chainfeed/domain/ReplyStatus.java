package com.chainfeed.domain;

/**
 * Status values used by gateway replies and broadcasts.
 */
public final class ReplyStatus {

    public static final String OK = "OK";
    public static final String FAIL = "fail";

    private ReplyStatus() {
    }

    public static boolean isOk(String status) {
        return OK.equals(status);
    }
}
