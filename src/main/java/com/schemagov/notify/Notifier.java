package com.schemagov.notify;

/**
 * Delivers governance notifications to a team, or to a reviewer named individually on a review. Delivery is asynchronous and at-least-once. Retries belong to the
 * implementation, never to the caller.
 */
@FunctionalInterface
public interface Notifier {
    void notifyTeam(String team, NotificationPayload payload);
}
