package com.neorpc.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.neorpc.rpc.NeoRpcClient;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class NeoClientPingTest {

    @Mock
    private NeoRpcClient rpcClient;

    private NeoClient clientFor(String nodeUri) {
        return new NeoClient(rpcClient, new ObjectMapper(), null, new NodeEndpoints(List.of(nodeUri)), Duration.ofMillis(500));
    }

    @Test
    void ping_listeningNode_returnsTrue() throws IOException {
        try (ServerSocket server = new ServerSocket(0)) {
            NeoClient client = clientFor("http://127.0.0.1:" + server.getLocalPort());

            assertThat(client.ping()).isTrue();
        }
        verifyNoInteractions(rpcClient);
    }

    @Test
    void ping_timeoutBeyondIntRange_isClamped() throws IOException {
        try (ServerSocket server = new ServerSocket(0)) {
            NeoClient client = new NeoClient(rpcClient, new ObjectMapper(), null,
                    new NodeEndpoints(List.of("http://127.0.0.1:" + server.getLocalPort())), Duration.ofDays(60));

            assertThat(client.ping()).isTrue();
        }
    }

    @Test
    void ping_closedPort_returnsFalse() throws IOException {
        int port;
        try (ServerSocket server = new ServerSocket(0)) {
            port = server.getLocalPort();
        }

        assertThat(clientFor("http://127.0.0.1:" + port).ping()).isFalse();
    }

    @Test
    void ping_malformedUri_returnsFalse() {
        assertThat(clientFor("http://bad host:10332").ping()).isFalse();
        assertThat(clientFor("seed1.neo.org").ping()).isFalse();
    }

    @Test
    void ping_noSelectedNode_returnsFalse() {
        NeoClient client = new NeoClient(rpcClient, new ObjectMapper(), null,
                new NodeEndpoints(List.of("http://a:10332", "http://b:10332")), null);

        assertThat(client.ping()).isFalse();
    }

    @Test
    void socketAddress_defaultsPortFromScheme() {
        InetSocketAddress https = NeoClient.socketAddress(URI.create("https://seed1.neo.org/rpc"));
        InetSocketAddress http = NeoClient.socketAddress(URI.create("http://seed1.neo.org"));
        InetSocketAddress explicit = NeoClient.socketAddress(URI.create("http://seed1.neo.org:10332"));

        assertThat(https.getPort()).isEqualTo(443);
        assertThat(http.getPort()).isEqualTo(80);
        assertThat(explicit.getPort()).isEqualTo(10332);
        assertThat(explicit.getHostString()).isEqualTo("seed1.neo.org");
        assertThat(NeoClient.socketAddress(URI.create("tcp://seed1.neo.org"))).isNull();
    }
}
