package quest.gekko.giveaway.web.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;
import quest.gekko.giveaway.dto.AuthStateDTO;
import quest.gekko.giveaway.dto.CommandAck;
import quest.gekko.giveaway.service.core.OwnerSession;

/** Manual stand-in for the platform login flow. */
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
@PreAuthorize("hasRole('ADMIN')")
public class AuthController {

    private final OwnerSession ownerSession;

    @GetMapping
    public AuthStateDTO state() {
        var owner = ownerSession.currentOwner();
        return new AuthStateDTO(owner.isPresent(), owner.orElse(null));
    }

    @PostMapping("/authorize")
    public CommandAck authorize(@RequestParam String ownerId) {
        ownerSession.authorize(ownerId);
        return CommandAck.ok();
    }

    @PostMapping("/deauthorize")
    public CommandAck deauthorize() {
        ownerSession.deauthorize();
        return CommandAck.ok();
    }
}
