package quest.gekko.giveaway.service.intake;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import quest.gekko.giveaway.domain.GiveawayState;
import quest.gekko.giveaway.exception.NotAcceptingException;
import quest.gekko.giveaway.service.core.GiveawayService;
import quest.gekko.giveaway.service.scheduling.ManualEventLoop;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class ContributionIntakeTest {

    @Mock
    private GiveawayService giveaways;

    private ContributionIntake intake;

    @BeforeEach
    void setUp() {
        intake = new ContributionIntake(giveaways, new ManualEventLoop());
    }

    @Test
    void cheerCountsBitsUnderDisplayName() {
        assertThat(intake.onBits(new BitsEvent("u1", "alice", "Alice", 100, false))).isTrue();

        verify(giveaways).recordContribution("u1", "Alice", 100, 0);
    }

    @Test
    void cheerFallsBackToUserName() {
        intake.onBits(new BitsEvent("u1", "alice", null, 5, false));

        verify(giveaways).recordContribution("u1", "alice", 5, 0);
    }

    @Test
    void anonymousCheerIsIgnored() {
        assertThat(intake.onBits(new BitsEvent(null, "ananonymouscheerer", null, 500, true))).isFalse();

        verifyNoInteractions(giveaways);
    }

    @Test
    void giftedSubCountsOneForGifter() {
        assertThat(intake.onSubscription(new SubscriptionEvent("g1", "gifter", "Gifter", true, false))).isTrue();

        verify(giveaways).recordContribution("g1", "Gifter", 0, 1);
    }

    @Test
    void selfSubAndAnonymousGiftAreIgnored() {
        assertThat(intake.onSubscription(new SubscriptionEvent("g1", "gifter", "Gifter", false, false))).isFalse();
        assertThat(intake.onSubscription(new SubscriptionEvent(null, null, null, true, true))).isFalse();

        verifyNoInteractions(giveaways);
    }

    @Test
    void rejectionIsReportedNotThrown() {
        doThrow(new NotAcceptingException(GiveawayState.PAUSED))
                .when(giveaways).recordContribution(anyString(), anyString(), anyLong(), anyLong());

        assertThat(intake.onBits(new BitsEvent("u1", "alice", "Alice", 100, false))).isFalse();
    }

    @Test
    void blankParticipantIdsAreIgnored() {
        assertThat(intake.onBits(new BitsEvent("", "bob", "Bob", 100, false))).isFalse();
        assertThat(intake.onBits(new BitsEvent("  ", "bob", "Bob", 100, false))).isFalse();
        assertThat(intake.onSubscription(new SubscriptionEvent(" ", "gifter", "Gifter", true, false))).isFalse();

        verifyNoInteractions(giveaways);
    }

    @Test
    void invalidContributionIsDroppedNotThrown() {
        doThrow(new IllegalArgumentException("participantId is required"))
                .when(giveaways).recordContribution(anyString(), anyString(), anyLong(), anyLong());

        assertThat(intake.onSubscription(new SubscriptionEvent("g1", "gifter", "Gifter", true, false))).isFalse();
    }
}
