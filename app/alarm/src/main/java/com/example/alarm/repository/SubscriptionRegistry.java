/*
 * Where: Alarm data access
 * What: Device push endpoints per user
 * Why: Shared by the registration API and the dispatcher, which prunes expired endpoints
 */
package com.example.alarm.repository;

import com.example.alarm.model.PushSubscription;
import java.util.List;

public interface SubscriptionRegistry {

  List<PushSubscription> listByUser(String userId);

  /**
   * Registers a device endpoint. An existing row with the same endpoint gets the new owner and key
   * material and a fresh {@code updated_at}; its {@code created_at} is kept.
   */
  void upsert(String endpoint, String userId, String p256dh, String auth);

  /** Removes the endpoint regardless of owner. Returns 0 when it was already gone. */
  int removeByEndpoint(String endpoint);

  /** Removes the endpoint only if {@code userId} owns it. */
  int removeByUserAndEndpoint(String userId, String endpoint);
}
