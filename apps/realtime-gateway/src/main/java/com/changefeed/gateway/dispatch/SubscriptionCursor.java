package com.changefeed.gateway.dispatch;

import com.changefeed.gateway.registry.Subscription;

/** Per-subscription delivery progress, owned by one partition worker. */
final class SubscriptionCursor {
  private final Subscription subscription;
  private long deliveredThrough;

  SubscriptionCursor(Subscription subscription, long deliveredThrough) {
    this.subscription = subscription;
    this.deliveredThrough = deliveredThrough;
  }

  Subscription subscription() {
    return subscription;
  }

  String connectionId() {
    return subscription.connectionId();
  }

  long deliveredThrough() {
    return deliveredThrough;
  }

  /** True when the entry at {@code offset} has not been considered for this subscription yet. */
  boolean awaits(long offset) {
    return offset > deliveredThrough;
  }

  void advanceTo(long offset) {
    if (offset > deliveredThrough) {
      deliveredThrough = offset;
    }
  }
}
