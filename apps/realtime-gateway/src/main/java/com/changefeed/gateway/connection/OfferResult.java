package com.changefeed.gateway.connection;

public enum OfferResult {
  ACCEPTED,
  DROPPED,
  REJECTED
}
