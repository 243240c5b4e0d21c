package tech.noetzold.screening_api.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class SwaggerConfig {

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Screening API")
                        .version("1.0.0")
                        .description("Vessel and counterparty sanctions screening across Lloyd's, Kpler and local reference lists")
                        .contact(new Contact()
                                .name("Noetzold Tech")
                                .email("contato@noetzold.tech")
                                .url("https://noetzold.tech")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:8090")
                                .description("Development")))
                .tags(List.of(
                        new Tag().name("Screening").description("Live screening of vessels and parties"),
                        new Tag().name("Entity risk").description("Bulk entity risk resolution")));
    }
}
