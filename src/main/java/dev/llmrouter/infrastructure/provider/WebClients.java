package dev.llmrouter.infrastructure.provider;

import io.netty.channel.ChannelOption;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * Blocking-use WebClients on Reactor Netty with explicit response and connect timeouts.
 * Each client is cloned from the application's {@link WebClient.Builder} so Boot's codec
 * and observation customizations carry over.
 */
public final class WebClients {

    private WebClients() {
    }

    public static WebClient withTimeouts(WebClient.Builder builder, Duration responseTimeout, Duration connectTimeout) {
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(responseTimeout)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis());
        return builder.clone()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }
}
