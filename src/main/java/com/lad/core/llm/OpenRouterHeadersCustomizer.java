package com.lad.core.llm;

import com.lad.core.config.LadProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Adds the optional OpenRouter attribution headers ({@code HTTP-Referer}, {@code X-Title})
 * to outbound chat-completion requests made through Spring's {@code RestClient}.
 */
@Configuration
public class OpenRouterHeadersCustomizer {

    private static final Logger log = LoggerFactory.getLogger(OpenRouterHeadersCustomizer.class);

    @Bean
    RestClientCustomizer openRouterAttributionHeaders(LadProperties properties) {
        String referer = properties.getOpenrouter().getHttpReferer();
        String title = properties.getOpenrouter().getXTitle();
        boolean hasReferer = referer != null && !referer.isBlank();
        boolean hasTitle = title != null && !title.isBlank();
        if (hasReferer || hasTitle) {
            log.info("Registering OpenRouter attribution headers (referer={}, title={})", hasReferer, hasTitle);
        }
        return builder -> builder.requestInterceptor((request, body, execution) -> {
            if (hasReferer && !request.getHeaders().containsKey("HTTP-Referer")) {
                request.getHeaders().add("HTTP-Referer", referer);
            }
            if (hasTitle && !request.getHeaders().containsKey("X-Title")) {
                request.getHeaders().add("X-Title", title);
            }
            return execution.execute(request, body);
        });
    }
}
