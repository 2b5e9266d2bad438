package quest.gekko.giveaway.event;

import quest.gekko.giveaway.domain.ClientRole;
import quest.gekko.giveaway.service.broadcast.ClientConnection;

/** Published once a client has announced a recognised role and become admitted. */
public record ClientJoinedEvent(ClientConnection client, ClientRole role) {}
