package com.gt.tsrs.notification.impl;

import com.gt.tsrs.model.Topic;
import com.gt.tsrs.notification.DueReviewMessage;
import com.gt.tsrs.notification.NotificationException;
import com.gt.tsrs.notification.Notifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Sends a desktop notification by running an OS command. Arguments are passed directly to the
 * process, never through a shell.
 */
public abstract class CommandNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(CommandNotifier.class);

    private static final long COMMAND_TIMEOUT_SEC = 10;

    protected abstract List<String> buildCommand(String title, String message);

    @Override
    public void notify(List<Topic> dueTopics) {
        List<String> command = buildCommand(DueReviewMessage.TITLE, DueReviewMessage.buildMessage(dueTopics));

        try {
            Process process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .start();

            if (!process.waitFor(COMMAND_TIMEOUT_SEC, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new NotificationException("Notification command " + command.get(0) + " timed out");
            }
            if (process.exitValue() != 0) {
                throw new NotificationException("Notification command " + command.get(0) + " exited with " + process.exitValue());
            }

            log.debug("Sent desktop notification for {} topics", dueTopics.size());
        } catch (IOException ex) {
            throw new NotificationException("Unable to run notification command " + command.get(0), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new NotificationException("Interrupted while sending notification", ex);
        }
    }
}
