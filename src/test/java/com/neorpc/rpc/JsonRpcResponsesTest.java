package com.neorpc.rpc;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonRpcResponsesTest {

    private final JsonRpcResponses responses = new JsonRpcResponses(new ObjectMapper());

    @Test
    @DisplayName("populated error envelope raises code and message")
    void read_errorEnvelope_throwsWithCodeAndMessage() {
        String body = "{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-100,\"message\":\"Unknown block\"}}";

        assertThatThrownBy(() -> responses.read("getblock", body, String.class))
                .isInstanceOfSatisfying(JsonRpcErrorException.class, e -> {
                    assertThat(e.getCode()).isEqualTo(-100L);
                    assertThat(e.getErrorMessage()).isEqualTo("Unknown block");
                })
                .hasMessage("error code: -100, error message: Unknown block");
    }

    @Test
    @DisplayName("error object with empty message counts as success")
    void read_errorWithEmptyMessage_returnsResult() {
        String body = "{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":0,\"message\":\"\"},\"result\":42}";

        assertThat(responses.read("getblockcount", body, Long.class)).isEqualTo(42L);
    }

    @Test
    void read_nullError_returnsResult() {
        String body = "{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":null,\"result\":\"0xbeef\"}";

        assertThat(responses.read("getbestblockhash", body, String.class)).isEqualTo("0xbeef");
    }

    @Test
    void read_typeReference_mapsArray() {
        String body = "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":[\"0x01\",\"0x02\"]}";

        List<String> result = responses.read("getrawmempool", body, new TypeReference<List<String>>() {
        });

        assertThat(result).containsExactly("0x01", "0x02");
    }

    @Test
    void read_missingResult_throws() {
        String body = "{\"jsonrpc\":\"2.0\",\"id\":1}";

        assertThatThrownBy(() -> responses.read("getblockcount", body, Long.class))
                .isInstanceOf(RpcException.class)
                .hasMessage("getblockcount returned no result");
    }

    @Test
    void read_nullResultWhereValueRequired_throws() {
        String body = "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":null}";

        assertThatThrownBy(() -> responses.read("getbestblockhash", body, String.class))
                .isInstanceOf(RpcException.class)
                .hasMessageContaining("no result");
    }

    @Test
    @DisplayName("null result is an ordinary answer for optional reads")
    void readOptional_nullResult_isEmpty() {
        String body = "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":null}";

        assertThat(responses.readOptional("gettxout", body, String.class)).isEmpty();
        assertThat(responses.readOptional("getstorage", "{\"jsonrpc\":\"2.0\",\"id\":1}", String.class)).isEmpty();
    }

    @Test
    void readOptional_value_isPresent() {
        String body = "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"00ff\"}";

        assertThat(responses.readOptional("getstorage", body, String.class)).contains("00ff");
    }

    @Test
    void readOptional_errorEnvelope_stillThrows() {
        String body = "{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-100,\"message\":\"Unknown transaction\"},\"result\":null}";

        assertThatThrownBy(() -> responses.readOptional("gettxout", body, String.class))
                .isInstanceOf(JsonRpcErrorException.class);
    }

    @Test
    void result_invalidJson_throwsWithCause() {
        assertThatThrownBy(() -> responses.result("getblockcount", "<html>bad gateway</html>"))
                .isInstanceOf(RpcException.class)
                .hasMessageContaining("Failed to parse getblockcount")
                .hasCauseInstanceOf(com.fasterxml.jackson.core.JsonProcessingException.class);
    }

    @Test
    void result_emptyBody_throws() {
        assertThatThrownBy(() -> responses.result("getblockcount", null))
                .isInstanceOf(RpcException.class)
                .hasMessageContaining("empty body");
        assertThatThrownBy(() -> responses.result("getblockcount", "  "))
                .isInstanceOf(RpcException.class);
    }

    @Test
    void read_resultOfWrongShape_throws() {
        String body = "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{\"not\":\"a number\"}}";

        assertThatThrownBy(() -> responses.read("getblockcount", body, Long.class))
                .isInstanceOf(RpcException.class)
                .hasMessageContaining("Failed to map getblockcount");
    }
}
