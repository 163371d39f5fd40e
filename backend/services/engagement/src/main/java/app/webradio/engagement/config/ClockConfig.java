package app.webradio.engagement.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    // Calendar days (streaks, daily points, daily aggregates) are taken in this zone.
    @Bean
    public Clock clock(EngagementProps props) {
        return Clock.system(props.zone());
    }
}
