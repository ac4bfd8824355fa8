package com.gt.tsrs.notification;

public class NotificationException extends RuntimeException {

    public NotificationException(String errMsg) {
        super(errMsg);
    }

    public NotificationException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
