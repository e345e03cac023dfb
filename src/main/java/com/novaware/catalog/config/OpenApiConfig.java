package com.novaware.catalog.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springdoc.core.customizers.OpenApiCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
    static final String ADMIN_KEY_SCHEME = "adminKey";

    @Bean
    public OpenAPI customOpenAPI() {
        SecurityScheme adminKeyScheme = new SecurityScheme()
                .type(SecurityScheme.Type.APIKEY)
                .in(SecurityScheme.In.HEADER)
                .name(AdminKeyFilter.HEADER);

        return new OpenAPI()
                .info(new Info()
                        .title("Novaware Catalog Pipeline")
                        .version("0.1.0")
                        .description("Admin endpoints to trigger catalog pipeline stages and follow their runs."))
                .components(new Components().addSecuritySchemes(ADMIN_KEY_SCHEME, adminKeyScheme));
    }

    @Bean
    public OpenApiCustomizer adminSecurityCustomizer() {
        return openAPI -> {
            if (openAPI.getPaths() == null) return;
            SecurityRequirement adminRequirement = new SecurityRequirement().addList(ADMIN_KEY_SCHEME);
            openAPI.getPaths().forEach((path, item) -> {
                if (path.startsWith("/admin")) {
                    addRequirementToAllOperations(item, adminRequirement);
                }
            });
        };
    }

    private static void addRequirementToAllOperations(PathItem item, SecurityRequirement requirement) {
        item.readOperations().forEach(op -> op.addSecurityItem(requirement));
    }
}
