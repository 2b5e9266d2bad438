package quest.gekko.giveaway.dto;

import java.util.List;

public record ClientConfigDTO(
        String socketPath,
        int bitsLeadersCount,
        int subsLeadersCount,
        List<OverlayPositionDTO> overlays
) {}
