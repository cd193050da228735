package com.changefeed.gateway.connection;

import com.changefeed.gateway.protocol.ServerMessage;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * FIFO of frames awaiting the sender. Only event frames count against the capacity; control
 * frames (acks, errors, pongs) are always accepted so they can overtake a full queue's limit but
 * never reorder with events.
 */
final class OutboundQueue {
  private final int capacity;
  private final ConcurrentLinkedQueue<ServerMessage> frames = new ConcurrentLinkedQueue<>();
  private final AtomicInteger pendingEvents = new AtomicInteger();

  OutboundQueue(int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be >= 1");
    }
    this.capacity = capacity;
  }

  boolean offerEvent(ServerMessage.Event event) {
    if (pendingEvents.incrementAndGet() > capacity) {
      pendingEvents.decrementAndGet();
      return false;
    }
    frames.add(event);
    return true;
  }

  void offerControl(ServerMessage message) {
    frames.add(message);
  }

  ServerMessage poll() {
    ServerMessage next = frames.poll();
    if (next instanceof ServerMessage.Event) {
      pendingEvents.decrementAndGet();
    }
    return next;
  }

  boolean isEmpty() {
    return frames.isEmpty();
  }

  int pendingEvents() {
    return pendingEvents.get();
  }

  int capacity() {
    return capacity;
  }

  void clear() {
    ServerMessage next;
    while ((next = frames.poll()) != null) {
      if (next instanceof ServerMessage.Event) {
        pendingEvents.decrementAndGet();
      }
    }
  }
}
