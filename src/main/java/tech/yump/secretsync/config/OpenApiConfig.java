package tech.yump.secretsync.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI(@Value("${spring.application.name:lite-secret-sync}") String applicationName) {
        // Paths and schemas are picked up from the controllers by springdoc.
        return new OpenAPI()
                .info(new Info()
                        .title(applicationName)
                        .description("Synchronizes secrets between external secret managers and the cluster secret store.")
                        .version("v1"));
    }
}
