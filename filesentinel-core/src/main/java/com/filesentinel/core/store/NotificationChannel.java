package com.filesentinel.core.store;

import com.filesentinel.core.model.DeliveryStatus;
import com.filesentinel.core.model.NotificationMethod;

import java.util.Map;

/**
 * Outbound notification transport (mail relay, webhook client). FileSentinel
 * only decides who gets told what; delivery belongs to the implementation.
 */
public interface NotificationChannel {

    /**
     * Deliver one message to one recipient.
     *
     * @param recipient E-mail address or webhook URL
     * @param method    Transport to use
     * @param message   Plain text for e-mail, a JSON document for webhooks
     * @return The delivery status; implementations may also throw on failure
     */
    DeliveryStatus send(String recipient, NotificationMethod method, String message);

    /**
     * Deliver one message with transport headers, e.g. the authorization header a
     * webhook endpoint expects. Channels without header support ignore them.
     *
     * @param headers Extra request headers, never null
     */
    default DeliveryStatus send(String recipient, NotificationMethod method, String message,
            Map<String, String> headers) {
        return send(recipient, method, message);
    }
}
