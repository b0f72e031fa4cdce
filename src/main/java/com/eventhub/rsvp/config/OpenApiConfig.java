package com.eventhub.rsvp.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    static final String USER_ID_SCHEME = "userId";

    @Bean
    public OpenAPI eventRsvpOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("Event RSVP API")
                .description("Capacity-limited event reservations. Callers are identified by the "
                    + "X-User-Id header supplied by the authentication gateway.")
                .version("1.0.0"))
            .components(new Components()
                .addSecuritySchemes(USER_ID_SCHEME, new SecurityScheme()
                    .type(SecurityScheme.Type.APIKEY)
                    .in(SecurityScheme.In.HEADER)
                    .name("X-User-Id")
                    .description("Verified user id forwarded by the gateway")))
            .addSecurityItem(new SecurityRequirement().addList(USER_ID_SCHEME));
    }
}
