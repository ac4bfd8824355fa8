package com.gt.tsrs.notification.impl;

import java.util.List;

// macOS Notification Center
public class OsascriptNotifier extends CommandNotifier {

    @Override
    protected List<String> buildCommand(String title, String message) {
        String script = "display notification " + quote(message) + " with title " + quote(title);
        return List.of("osascript", "-e", script);
    }

    static String quote(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
