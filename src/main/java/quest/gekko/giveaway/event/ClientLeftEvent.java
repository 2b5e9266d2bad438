package quest.gekko.giveaway.event;

import quest.gekko.giveaway.domain.ClientRole;
import quest.gekko.giveaway.service.broadcast.ClientConnection;

public record ClientLeftEvent(ClientConnection client, ClientRole role) {}
