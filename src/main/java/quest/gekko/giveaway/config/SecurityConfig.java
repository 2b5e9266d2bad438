package quest.gekko.giveaway.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.provisioning.InMemoryUserDetailsManager;
import org.springframework.security.web.SecurityFilterChain;

/**
 * Operator endpoints sit behind HTTP Basic; display pages and the socket are open.
 */
@Configuration
@EnableWebSecurity
@EnableMethodSecurity
public class SecurityConfig {

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http) throws Exception {
        http
                .csrf(csrf -> csrf.disable())
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers("/config", "/ws", "/ws/**", "/error").permitAll()
                        .requestMatchers("/giveaway/**", "/giveaway", "/auth/**", "/auth", "/test/**").hasRole("ADMIN")
                        .anyRequest().denyAll())
                .httpBasic(Customizer.withDefaults());
        return http.build();
    }

    @Bean
    public UserDetailsService userDetailsService(OverlayProperties.Security admin) {
        if (admin.password() == null || admin.password().isBlank()) {
            throw new IllegalStateException("security.admin.password must be set");
        }
        return new InMemoryUserDetailsManager(User.withUsername(admin.username())
                .password("{noop}" + admin.password())
                .roles("ADMIN")
                .build());
    }
}
