package com.tripscout.server.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Collections;

/**
 * SpringDoc OpenAPI 文档配置，提供 /v3/api-docs 与 /swagger-ui.html。
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI tripscoutOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("TripScout 后端接口文档")
                        .description("目的地自动调研：异步任务、进度查询、结果对比与推荐")
                        .version("v1"))
                .servers(Collections.singletonList(
                        new Server().url("/").description("默认服务端")
                ));
    }
}
