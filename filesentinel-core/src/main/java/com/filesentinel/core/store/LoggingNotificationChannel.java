package com.filesentinel.core.store;

import com.filesentinel.core.model.DeliveryStatus;
import com.filesentinel.core.model.NotificationMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Default channel that only writes notifications to the log. Replace it with a
 * real transport bean in production.
 */
public class LoggingNotificationChannel implements NotificationChannel {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationChannel.class);

    @Override
    public DeliveryStatus send(String recipient, NotificationMethod method, String message) {
        log.info("[FileSentinel] {} notification to '{}': {}", method, recipient, message);
        return DeliveryStatus.SENT;
    }

    @Override
    public DeliveryStatus send(String recipient, NotificationMethod method, String message,
            Map<String, String> headers) {
        // values may be credentials
        if (!headers.isEmpty())
            log.info("[FileSentinel] {} notification to '{}' carries headers {}", method, recipient, headers.keySet());
        return send(recipient, method, message);
    }
}
