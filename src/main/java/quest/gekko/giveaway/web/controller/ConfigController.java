package quest.gekko.giveaway.web.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import quest.gekko.giveaway.config.OverlayProperties;
import quest.gekko.giveaway.config.WebSocketConfig;
import quest.gekko.giveaway.dto.ClientConfigDTO;
import quest.gekko.giveaway.dto.OverlayPositionDTO;
import quest.gekko.giveaway.service.core.GiveawayStore;

@RestController
@RequiredArgsConstructor
public class ConfigController {

    private final OverlayProperties.Leaderboard leaderboard;
    private final GiveawayStore store;

    @GetMapping("/config")
    public ClientConfigDTO config() {
        return new ClientConfigDTO(
                WebSocketConfig.SOCKET_PATH,
                leaderboard.bitsLeadersCount(),
                leaderboard.subsLeadersCount(),
                store.overlayPositions().stream().map(OverlayPositionDTO::of).toList());
    }
}
