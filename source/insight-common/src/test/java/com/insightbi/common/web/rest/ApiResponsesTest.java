package com.insightbi.common.web.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ApiResponsesTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void okShouldOmitCode() throws Exception {
        String json = mapper.writeValueAsString(ApiResponses.ok(Map.of("id", 1)));

        assertThat(json).isEqualTo("{\"status\":200,\"message\":\"OK\",\"data\":{\"id\":1}}");
    }

    @Test
    void failureShouldCarryStatusAndCode() throws Exception {
        ApiResponse<Void> response = ApiResponses.failure(ResultStatus.DENIED, "insight-rls-0007", " ");

        assertThat(response.isSuccess()).isFalse();
        assertThat(response.getStatus()).isEqualTo(403);
        assertThat(response.getMessage()).isEqualTo("Access denied");
        assertThat(mapper.writeValueAsString(response)).isEqualTo("{\"status\":403,\"message\":\"Access denied\",\"code\":\"insight-rls-0007\"}");
    }

    @Test
    void failureRejectsSuccessStatus() {
        assertThatThrownBy(() -> ApiResponses.failure(ResultStatus.SUCCESS, "x", "y")).isInstanceOf(IllegalArgumentException.class);
    }
}
