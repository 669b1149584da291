package com.ainnovators.viewer.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI viewerOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("AInnovators Experiment Viewer API")
                        .description("Read-only access to pipeline experiment contexts, statistics, designs and test results")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("AInnovators Team"))
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Development Server")));
    }
}
