package com.changefeed.gateway.connection;

/** Callbacks from a {@link ClientConnection} to its owner. Invoked on sender or caller threads. */
public interface ConnectionListener {
  /** Every subscription of the connection has been sent what it matched through {@code sequence}. */
  void onResumable(ClientConnection connection, long sequence);

  void onClosed(ClientConnection connection);

  ConnectionListener NONE =
      new ConnectionListener() {
        @Override
        public void onResumable(ClientConnection connection, long sequence) {}

        @Override
        public void onClosed(ClientConnection connection) {}
      };
}
