package com.schemagov.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingNotifier implements Notifier {
    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public void notifyTeam(String team, NotificationPayload payload) {
        log.info("notify.team team={} type={} subject={} target={} details={}",
                team, payload.type(), payload.subjectId(), payload.target(), payload.details());
    }
}
