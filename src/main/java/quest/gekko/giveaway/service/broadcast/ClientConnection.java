package quest.gekko.giveaway.service.broadcast;

import java.io.IOException;

/** Transport handle for one connected client; delivery is in order per connection. */
public interface ClientConnection {
    String id();

    void send(String frame) throws IOException;

    boolean isOpen();

    default void close() {}
}
