package quest.gekko.giveaway;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import quest.gekko.giveaway.domain.Contribution;
import quest.gekko.giveaway.domain.Giveaway;
import quest.gekko.giveaway.domain.GiveawayState;
import quest.gekko.giveaway.repository.ContributionRepository;
import quest.gekko.giveaway.repository.GiveawayRepository;
import quest.gekko.giveaway.service.core.GiveawayService;
import quest.gekko.giveaway.service.core.OwnerSession;
import quest.gekko.giveaway.service.intake.BitsEvent;
import quest.gekko.giveaway.service.intake.ContributionIntake;
import quest.gekko.giveaway.service.scheduling.EventLoop;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class GiveawayOverlayApplicationTest {

    @Autowired
    private OwnerSession ownerSession;

    @Autowired
    private GiveawayService giveaways;

    @Autowired
    private ContributionIntake intake;

    @Autowired
    private EventLoop loop;

    @Autowired
    private GiveawayRepository giveawayRepository;

    @Autowired
    private ContributionRepository contributionRepository;

    @AfterEach
    void tearDown() {
        loop.run(giveaways::cancel);
        ownerSession.deauthorize();
    }

    @Test
    void giveawaySurvivesLogoutAndIsRecoveredPaused() {
        ownerSession.authorize("streamer-1");
        Giveaway started = loop.call(() -> giveaways.start("streamer-1", 600_000));
        assertThat(intake.onBits(new BitsEvent("u1", "alice", "Alice", 250, false))).isTrue();

        List<Contribution> stored = contributionRepository.findByGiveawayIdOrderByIdAsc(started.getId());
        assertThat(stored).singleElement().extracting(Contribution::getBits).isEqualTo(250L);

        ownerSession.deauthorize();
        assertThat(loop.call(giveaways::state)).isEqualTo(GiveawayState.IDLE);
        assertThat(giveawayRepository.findById(started.getId())).get()
                .satisfies(g -> {
                    assertThat(g.isPaused()).isTrue();
                    assertThat(g.isCancelled()).isFalse();
                });

        ownerSession.authorize("streamer-1");
        assertThat(loop.call(giveaways::state)).isEqualTo(GiveawayState.PAUSED);
        assertThat(intake.onBits(new BitsEvent("u2", "bob", "Bob", 10, false))).isFalse();
    }
}
