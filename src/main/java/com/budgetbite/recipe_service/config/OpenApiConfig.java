package com.budgetbite.recipe_service.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI budgetRecipeOpenAPI() {
        Server localServer = new Server();
        localServer.setUrl("http://localhost:8080");
        localServer.setDescription("로컬 개발 서버");

        Info info = new Info()
                .title("Budget Recipe API")
                .version("1.0.0")
                .description("예산과 인분 수에 맞춰 레시피 재료비를 환산하고 필터링하는 API 입니다.");

        return new OpenAPI()
                .info(info)
                .servers(List.of(localServer));
    }
}
