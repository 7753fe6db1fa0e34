package com.baykanat.ephemeral.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/** OpenAPI / Swagger UI bean tanımı. */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI ephemeralSchedulerOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Ephemeral Message Scheduler API")
                        .description("""
                                Accepts chat gateway events (message created, pins updated, connection \
                                ready/resumed) and deletes unpinned messages in configured channels once \
                                their per-channel TTL expires. Pending deletions can be inspected read-only.\
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Burak Aykanat")
                                .email("burak.aykanat12@gmail.com")))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Local Development")
                ));
    }
}
