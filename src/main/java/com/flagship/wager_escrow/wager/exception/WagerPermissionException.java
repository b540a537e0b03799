package com.flagship.wager_escrow.wager.exception;

/**
 * The acting user is not allowed to perform this operation on this wager.
 */
public class WagerPermissionException extends WagerException {

    public static final String NOT_CREATOR = "NOT_CREATOR";
    public static final String NOT_PARTICIPANT = "NOT_PARTICIPANT";
    public static final String NOT_DISPUTER = "NOT_DISPUTER";
    public static final String NOT_ASSIGNED_MODERATOR = "NOT_ASSIGNED_MODERATOR";

    public WagerPermissionException(String reason, String message) {
        super(reason, message);
    }
}
