package com.neorpc.rpc;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * NEO JSON-RPC client using WebClient. One POST per call; no retries.
 */
@Slf4j
public class WebClientNeoRpcClient implements NeoRpcClient {

    private final WebClient webClient;

    public WebClientNeoRpcClient(WebClient.Builder builder) {
        this.webClient = builder.build();
    }

    @Override
    public Mono<String> call(String nodeUri, String method, List<?> params) {
        JsonRpcRequest body = JsonRpcRequest.of(method, params);
        log.debug("POST {} to {}", method, nodeUri);
        return webClient.post()
                .uri(nodeUri)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .onStatus(status -> status.value() != HttpStatus.OK.value(),
                        response -> response.releaseBody()
                                .then(Mono.error(new RpcStatusException(response.statusCode().value()))))
                .bodyToMono(String.class)
                .onErrorMap(e -> !(e instanceof RpcException),
                        e -> new RpcException(method + " request to " + nodeUri + " failed: " + e.getMessage(), e));
    }
}
