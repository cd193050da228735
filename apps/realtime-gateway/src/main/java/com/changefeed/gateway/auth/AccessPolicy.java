package com.changefeed.gateway.auth;

import com.changefeed.domain.changes.ChangeEvent;
import com.changefeed.domain.sessions.AccessClaims;
import java.util.Map;

/** Row visibility check. Implementations must be pure and cheap; they run per event and subscriber. */
public interface AccessPolicy {
  boolean authorize(AccessClaims claims, ChangeEvent event);

  boolean authorizeRow(AccessClaims claims, String channel, Map<String, Object> row);

  AccessPolicy ALLOW_ALL =
      new AccessPolicy() {
        @Override
        public boolean authorize(AccessClaims claims, ChangeEvent event) {
          return true;
        }

        @Override
        public boolean authorizeRow(AccessClaims claims, String channel, Map<String, Object> row) {
          return true;
        }
      };
}
