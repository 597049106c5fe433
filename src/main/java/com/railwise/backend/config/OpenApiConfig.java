package com.railwise.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ViewControllerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

@Configuration
public class OpenApiConfig implements WebMvcConfigurer {

        @Value("${railwise.api.version:2.0.0}")
        private String apiVersion;

        /**
         * Maps "/docs" to the Swagger UI.
         */
        @Override
        public void addViewControllers(ViewControllerRegistry registry) {
                registry.addRedirectViewController("/docs", "/swagger-ui.html");
                registry.addRedirectViewController("/docs/", "/swagger-ui.html");
        }

        @Bean
        public OpenAPI railwiseOpenAPI() {
                return new OpenAPI()
                                .info(new Info()
                                                .title("Railwise API documentation")
                                                .description(
                                                                "### Railwise Train Tracking API\n\n" +
                                                                                "Schedule-based train tracking for Bangladesh Railway. "
                                                                                +
                                                                                "Positions are inferred from the published timetable and a simulated delay model; "
                                                                                +
                                                                                "there is no live vehicle telemetry.\n\n"
                                                                                +
                                                                                "#### Key Features:\n" +
                                                                                "- **Live Status**: Per-station timeline with completed, current, next and upcoming stops.\n"
                                                                                +
                                                                                "- **Delay Analytics**: Simulated delay history, statistics and delay probability.\n"
                                                                                +
                                                                                "- **Crowd Validation**: Passengers confirm they are on board; confirmations refine the status.\n"
                                                                                +
                                                                                "- **Search**: Trains by number, name or station pair, and stations by location.")
                                                .version("v" + apiVersion)
                                                .contact(new Contact()
                                                                .name("Railwise")
                                                                .email("support@railwise.app"))
                                                .license(new License()
                                                                .name("Apache 2.0")
                                                                .url("http://springdoc.org")))
                                .servers(List.of(
                                                new Server().url("http://localhost:8080/RailwiseBE")
                                                                .description("Local Development (HTTP)")));
        }
}
