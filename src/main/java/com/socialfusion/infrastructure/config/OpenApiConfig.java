package com.socialfusion.infrastructure.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.media.StringSchema;
import io.swagger.v3.oas.models.parameters.Parameter;
import org.springdoc.core.customizers.OperationCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("SocialFusion Feed API")
                        .version("1.0")
                        .description("Unified Mastodon and Bluesky timeline with reply filtering"));
    }

    @Bean
    public OperationCustomizer addRequestIdHeader() {
        return (operation, handlerMethod) -> {
            StringSchema schema = new StringSchema();
            schema.setFormat("uuid");
            operation.addParametersItem(new Parameter()
                    .in("header")
                    .name("X-Request-Id")
                    .required(false)
                    .description("Correlation id, echoed back; generated when absent")
                    .schema(schema));
            return operation;
        };
    }
}
