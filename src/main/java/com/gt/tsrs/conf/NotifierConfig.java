package com.gt.tsrs.conf;

import com.gt.tsrs.notification.Notifier;
import com.gt.tsrs.notification.impl.LoggingNotifier;
import com.gt.tsrs.notification.impl.NotifySendNotifier;
import com.gt.tsrs.notification.impl.OsascriptNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;

@Configuration
public class NotifierConfig {

    private static final Logger log = LoggerFactory.getLogger(NotifierConfig.class);

    public static final String NOTIFIER_AUTO = "auto";
    public static final String NOTIFIER_LOG = "log";

    @Bean
    public Notifier getNotifier(@Value("${tsrs.notification.notifier:" + NOTIFIER_AUTO + "}") String notifierType) {
        Notifier notifier = selectNotifier(notifierType, System.getProperty("os.name", ""));
        log.info("Using {} for due review notifications", notifier.getClass().getSimpleName());

        return notifier;
    }

    static Notifier selectNotifier(String notifierType, String osName) {
        if (!NOTIFIER_AUTO.equalsIgnoreCase(notifierType)) {
            if (!NOTIFIER_LOG.equalsIgnoreCase(notifierType)) {
                log.warn("Unknown notifier '{}', falling back to logging", notifierType);
            }
            return new LoggingNotifier();
        }

        String os = osName.toLowerCase(Locale.ROOT);
        if (os.contains("linux")) {
            return new NotifySendNotifier();
        } else if (os.contains("mac")) {
            return new OsascriptNotifier();
        }

        return new LoggingNotifier();
    }
}
