package quest.gekko.giveaway.web.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;
import quest.gekko.giveaway.dto.CommandAck;
import quest.gekko.giveaway.dto.GiveawayStatusDTO;
import quest.gekko.giveaway.service.core.GiveawayService;
import quest.gekko.giveaway.service.core.OwnerSession;
import quest.gekko.giveaway.service.scheduling.EventLoop;

@RestController
@RequestMapping("/giveaway")
@RequiredArgsConstructor
@PreAuthorize("hasRole('ADMIN')")
public class GiveawayController {

    private final GiveawayService giveaways;
    private final OwnerSession ownerSession;
    private final EventLoop loop;

    @GetMapping
    public GiveawayStatusDTO status() {
        return loop.call(() -> new GiveawayStatusDTO(giveaways.state(), giveaways.snapshot()));
    }

    @PostMapping("/start")
    public CommandAck start(@RequestParam long duration, @RequestParam(required = false) String ownerId) {
        String owner = ownerId != null && !ownerId.isBlank()
                ? ownerId
                : ownerSession.currentOwner().orElseThrow(() -> new IllegalArgumentException("No owner is authorized"));
        loop.call(() -> giveaways.start(owner, duration));
        return CommandAck.ok();
    }

    // No-ops still acknowledge success; the state broadcast is what clients act on
    @PostMapping("/pause")
    public CommandAck pause() {
        loop.call(giveaways::pause);
        return CommandAck.ok();
    }

    @PostMapping({ "/resume", "/unpause" })
    public CommandAck resume() {
        loop.call(giveaways::resume);
        return CommandAck.ok();
    }

    @PostMapping("/cancel")
    public CommandAck cancel() {
        loop.call(giveaways::cancel);
        return CommandAck.ok();
    }
}
