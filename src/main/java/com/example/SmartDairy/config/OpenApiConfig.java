package com.example.SmartDairy.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info = @Info(
                title = "Smart Dairy API",
                version = "v1",
                description = "Dairy farm assistant: routed answers from documents, web search and herd data"
        )
)
public class OpenApiConfig {
}
