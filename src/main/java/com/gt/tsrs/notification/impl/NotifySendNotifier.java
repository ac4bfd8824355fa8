package com.gt.tsrs.notification.impl;

import java.util.List;

// Linux desktops (libnotify)
public class NotifySendNotifier extends CommandNotifier {

    private static final int EXPIRE_TIME_MS = 5000;

    @Override
    protected List<String> buildCommand(String title, String message) {
        return List.of("notify-send", "--expire-time=" + EXPIRE_TIME_MS, title, message);
    }
}
