package quest.gekko.giveaway.dto;

import quest.gekko.giveaway.domain.GiveawayState;

/** Operator-facing status: state name plus the same payload clients receive. */
public record GiveawayStatusDTO(GiveawayState state, Object giveaway) {}
