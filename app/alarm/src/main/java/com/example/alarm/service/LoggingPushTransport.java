/*
 * Where: Alarm service layer
 * What: Push transport that only logs
 * Why: Runs the full tick and dispatch path locally without a browser push service
 */
package com.example.alarm.service;

import com.example.alarm.config.WebPushProperties;
import com.example.alarm.model.PushSubscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "alarm.push.transport", havingValue = WebPushProperties.TRANSPORT_LOGGING)
public class LoggingPushTransport implements PushTransport {

    private static final Logger logger = LoggerFactory.getLogger(LoggingPushTransport.class);
    static final int CREATED = 201;

    @Override
    public int deliver(PushSubscription subscription, String payloadJson) {
        logger.info("push simulated send userId={} endpoint={} bytes={}",
                subscription.userId(),
                PushDispatcher.abbreviate(subscription.endpoint()),
                payloadJson.length());
        return CREATED;
    }
}
