/*
 * Where: Alarm service layer
 * What: Delivers one serialized push message to one endpoint
 * Why: Separates the Web Push wire protocol from outcome handling and allows test doubles
 */
package com.example.alarm.service;

import com.example.alarm.model.PushSubscription;

public interface PushTransport {

  /**
   * Returns the HTTP status reported by the push service.
   *
   * @throws PushTransportException when no status could be obtained
   */
  int deliver(PushSubscription subscription, String payloadJson);
}
