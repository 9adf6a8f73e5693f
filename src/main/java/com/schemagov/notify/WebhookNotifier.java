package com.schemagov.notify;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Posts notifications as JSON to the webhooks configured for each team. Calls are enqueued on OkHttp's dispatcher
 * so the caller never waits on delivery. Teams without a webhook fall through to the fallback notifier.
 */
public class WebhookNotifier implements Notifier {
    private static final Logger log = LoggerFactory.getLogger(WebhookNotifier.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final Map<String, List<String>> webhooksByTeam;
    private final Notifier fallback;
    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();

    public WebhookNotifier(OkHttpClient httpClient, Map<String, List<String>> webhooksByTeam, Notifier fallback) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.webhooksByTeam = webhooksByTeam == null ? Map.of() : Map.copyOf(webhooksByTeam);
        this.fallback = fallback == null ? new LoggingNotifier() : fallback;
    }

    @Override
    public void notifyTeam(String team, NotificationPayload payload) {
        List<String> webhooks = webhooksByTeam.getOrDefault(team, List.of());
        if (webhooks.isEmpty()) {
            fallback.notifyTeam(team, payload);
            return;
        }
        String body;
        try {
            body = mapper.writeValueAsString(Map.of("team", team, "notification", payload));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize notification " + payload.type(), e);
        }
        for (String webhook : webhooks) {
            Request request = new Request.Builder()
                    .url(webhook)
                    .post(RequestBody.create(body, JSON))
                    .build();
            httpClient.newCall(request).enqueue(new DeliveryCallback(team, payload.type(), webhook));
        }
    }

    private static final class DeliveryCallback implements Callback {
        private final String team;
        private final String type;
        private final String webhook;

        private DeliveryCallback(String team, String type, String webhook) {
            this.team = team;
            this.type = type;
            this.webhook = webhook;
        }

        @Override
        public void onFailure(Call call, IOException e) {
            log.warn("notify.webhook_failed team={} type={} webhook={} error={}", team, type, webhook, e.getMessage());
        }

        @Override
        public void onResponse(Call call, Response response) {
            try (response) {
                if (!response.isSuccessful()) {
                    log.warn("notify.webhook_rejected team={} type={} webhook={} status={}", team, type, webhook, response.code());
                } else {
                    log.debug("notify.webhook_delivered team={} type={} webhook={}", team, type, webhook);
                }
            }
        }
    }
}
