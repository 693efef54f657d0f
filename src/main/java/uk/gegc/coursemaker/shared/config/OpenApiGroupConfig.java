package uk.gegc.coursemaker.shared.config;

import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API documentation groups.
 */
@Configuration
public class OpenApiGroupConfig {

    @Bean
    public GroupedOpenApi generationGroup() {
        return GroupedOpenApi.builder()
                .group("generation")
                .displayName("Content Generation & Jobs")
                .pathsToMatch("/api/v1/generation/**")
                .build();
    }

    @Bean
    public GroupedOpenApi notificationsGroup() {
        return GroupedOpenApi.builder()
                .group("notifications")
                .displayName("Notifications")
                .pathsToMatch("/api/v1/notifications/**")
                .build();
    }

    @Bean
    public GroupedOpenApi adminGroup() {
        return GroupedOpenApi.builder()
                .group("admin")
                .displayName("Operations")
                .pathsToMatch("/api/v1/admin/**")
                .build();
    }
}
