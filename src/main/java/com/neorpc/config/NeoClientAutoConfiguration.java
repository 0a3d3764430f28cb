package com.neorpc.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.neorpc.client.NeoClient;
import com.neorpc.rpc.NeoRpcClient;
import com.neorpc.rpc.WebClientNeoRpcClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.netty.channel.ChannelOption;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * Wires the NEO RPC transport, a local rate limiter and a {@link NeoClient} from {@code neo.client.*}.
 */
@AutoConfiguration
@EnableConfigurationProperties(NeoClientProperties.class)
public class NeoClientAutoConfiguration {

    public static final String RATE_LIMITER = "neoRpcRateLimiter";

    @Bean
    @ConditionalOnMissingBean
    public NeoRpcClient neoRpcClient(NeoClientProperties properties,
                                     ObjectProvider<WebClient.Builder> webClientBuilder) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, Math.max(1L, properties.getConnectTimeoutMs())))
                .responseTimeout(Duration.ofMillis(Math.max(1L, properties.getReadTimeoutMs())));
        WebClient.Builder builder = webClientBuilder.getIfAvailable(WebClient::builder)
                .clientConnector(new ReactorClientHttpConnector(httpClient));
        return new WebClientNeoRpcClient(builder);
    }

    @Bean(name = RATE_LIMITER)
    @ConditionalOnMissingBean(name = RATE_LIMITER)
    public RateLimiter neoRpcRateLimiter(NeoClientProperties properties) {
        int rps = Math.max(1, properties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("neo-rpc", config);
    }

    @Bean
    @ConditionalOnMissingBean
    @Conditional(NodesConfiguredCondition.class)
    public NeoClient neoClient(NeoRpcClient neoRpcClient,
                               ObjectProvider<ObjectMapper> objectMapper,
                               @Qualifier(RATE_LIMITER) RateLimiter rateLimiter,
                               NeoClientProperties properties) {
        return NeoClient.connect(
                neoRpcClient,
                objectMapper.getIfAvailable(ObjectMapper::new),
                rateLimiter,
                properties.getNodes(),
                Duration.ofMillis(Math.max(1L, properties.getConnectTimeoutMs())));
    }
}
