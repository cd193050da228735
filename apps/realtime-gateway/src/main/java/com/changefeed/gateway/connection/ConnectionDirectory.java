package com.changefeed.gateway.connection;

import java.util.Optional;

public interface ConnectionDirectory {
  Optional<ClientConnection> find(String connectionId);
}
