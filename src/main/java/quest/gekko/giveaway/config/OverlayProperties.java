package quest.gekko.giveaway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.context.annotation.Configuration;
import quest.gekko.giveaway.domain.Metric;

import java.time.Duration;

/**
 * Configuration properties for the giveaway runtime and its operator surface
 */
@Configuration
@EnableConfigurationProperties({
        OverlayProperties.Timing.class,
        OverlayProperties.Leaderboard.class,
        OverlayProperties.Owner.class,
        OverlayProperties.Security.class
})
public class OverlayProperties {

    @ConfigurationProperties("giveaway.timing")
    public record Timing(@DefaultValue("1s") Duration tickInterval,
                         @DefaultValue("10s") Duration checkpointInterval,
                         @DefaultValue("1s") Duration debounceWindow) {}

    @ConfigurationProperties("giveaway.leaderboard")
    public record Leaderboard(@DefaultValue("5") int bitsLeadersCount,
                              @DefaultValue("5") int subsLeadersCount) {

        public int leadersCount(Metric metric) {
            return metric == Metric.BITS ? bitsLeadersCount : subsLeadersCount;
        }
    }

    /** Owner presented by the auth collaborator at startup; blank means nobody is authorized yet. */
    @ConfigurationProperties("giveaway.owner")
    public record Owner(String id) {}

    @ConfigurationProperties("security.admin")
    public record Security(@DefaultValue("admin") String username, String password) {}
}
