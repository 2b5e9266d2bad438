package quest.gekko.giveaway.web.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;
import quest.gekko.giveaway.dto.CommandAck;
import quest.gekko.giveaway.service.intake.BitsEvent;
import quest.gekko.giveaway.service.intake.ContributionIntake;
import quest.gekko.giveaway.service.intake.SubscriptionEvent;

/**
 * Lets the operator inject fake cheers and gift subs to check the overlay.
 * Always acknowledges; dropped events only show up in the log.
 */
@RestController
@RequestMapping("/test")
@RequiredArgsConstructor
@PreAuthorize("hasRole('ADMIN')")
public class TestEventController {

    private final ContributionIntake intake;

    @PostMapping("/bits")
    public CommandAck bits(@RequestBody BitsEvent event) {
        intake.onBits(event);
        return CommandAck.ok();
    }

    @PostMapping("/subs")
    public CommandAck subs(@RequestBody SubscriptionEvent event) {
        intake.onSubscription(event);
        return CommandAck.ok();
    }
}
