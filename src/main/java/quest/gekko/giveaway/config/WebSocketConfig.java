package quest.gekko.giveaway.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import quest.gekko.giveaway.web.socket.GiveawaySocketHandler;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {
    public static final String SOCKET_PATH = "/ws";

    private final GiveawaySocketHandler handler;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        // overlays are loaded as browser sources from arbitrary local origins
        registry.addHandler(handler, SOCKET_PATH).setAllowedOrigins("*");
    }
}
