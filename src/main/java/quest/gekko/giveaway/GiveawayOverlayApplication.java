package quest.gekko.giveaway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GiveawayOverlayApplication {

    public static void main(String[] args) {
        SpringApplication.run(GiveawayOverlayApplication.class, args);
    }

}
