package com.linlay.calendarassistant.config;

import com.linlay.calendarassistant.service.LlmLogSanitizer;
import io.netty.channel.ChannelOption;
import io.netty.handler.logging.LogLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import reactor.netty.transport.logging.AdvancedByteBufFormat;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * Shared outbound HTTP plumbing for the model endpoint and the calendar provider. Per-call
 * timeouts live with each client; only the connect timeout is set here.
 * Consumers must {@code clone()} the builder before customizing it.
 */
@Configuration
public class WebClientConfiguration {

    private static final Logger log = LoggerFactory.getLogger(WebClientConfiguration.class);
    private static final String OUTBOUND_WIRETAP_LOGGER = "com.linlay.calendarassistant.http.wiretap";
    private static final int CONNECT_TIMEOUT_MS = 10_000;

    @Bean
    public ConnectionProvider outboundConnectionProvider() {
        return ConnectionProvider.builder("calendar-assistant-outbound")
                .maxIdleTime(Duration.ofSeconds(30))
                .maxLifeTime(Duration.ofMinutes(5))
                .evictInBackground(Duration.ofSeconds(30))
                .build();
    }

    @Bean
    public WebClient.Builder loggingWebClientBuilder(
            LlmInteractionLogProperties logProperties,
            ConnectionProvider outboundConnectionProvider) {
        HttpClient httpClient = HttpClient.create(outboundConnectionProvider)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MS);
        if (logProperties.isEnabled() && !logProperties.isMaskSensitive()) {
            httpClient = httpClient.wiretap(OUTBOUND_WIRETAP_LOGGER, LogLevel.DEBUG, AdvancedByteBufFormat.TEXTUAL);
        }

        WebClient.Builder builder = WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
                        .build());
        if (!logProperties.isEnabled()) {
            return builder;
        }

        boolean maskSensitive = logProperties.isMaskSensitive();
        return builder.filter((request, next) -> {
            log.info("[outbound][request] {} {}", request.method(), request.url());
            log.debug("[outbound][request-headers] {}", LlmLogSanitizer.maskHeaders(request.headers(), maskSensitive));
            return next.exchange(request)
                    .doOnNext(logResponse(maskSensitive, request));
        });
    }

    private Consumer<ClientResponse> logResponse(boolean maskSensitive, ClientRequest request) {
        return response -> {
            log.info(
                    "[outbound][response] {} {} status={}",
                    request.method(),
                    request.url(),
                    response.statusCode().value()
            );
            log.debug("[outbound][response-headers] {}", LlmLogSanitizer.maskHeaders(response.headers().asHttpHeaders(), maskSensitive));
        };
    }
}
