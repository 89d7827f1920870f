package lab.relay.common;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "relay.rate-limit.api.max-requests=1000")
@Import(GlobalExceptionHandlerTest.TestConfig.class)
@AutoConfigureMockMvc
class GlobalExceptionHandlerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void runtimeExceptionMessageIsSanitized() throws Exception {
        mockMvc.perform(get("/test-error").accept(MediaType.APPLICATION_JSON))
                .andExpect(status().isInternalServerError())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.status").value(500))
                .andExpect(jsonPath("$.path").value("/test-error"))
                .andExpect(jsonPath("$.message").value("Failed with secret 0x[REDACTED]"));
    }

    @Test
    void malformedPathVariableIsBadRequest() throws Exception {
        mockMvc.perform(get("/transfers/{id}", "not-a-uuid"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid value 'not-a-uuid' for 'id'"))
                .andExpect(jsonPath("$.allowedDestinationChains", hasItem("polygon")));
    }

    @Test
    void unknownEnumValueListsAllowedValues() throws Exception {
        mockMvc.perform(post("/sim/transfers/{id}/next-outcome/{outcome}", UUID.randomUUID(), "EXPLODE"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message", containsString("SUCCESS, TRANSIENT_FAILURE, PERMANENT_FAILURE")));
    }

    @Test
    void unreadableBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/transfers").contentType(MediaType.APPLICATION_JSON).content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message", containsString("Invalid JSON body.")));
    }

    @Test
    void sanitizerLeavesShortHexAlone() {
        assertThat(GlobalExceptionHandler.sanitizeMessage("tx 0xabc failed")).isEqualTo("tx 0xabc failed");
        assertThat(GlobalExceptionHandler.sanitizeMessage(null)).isEqualTo("Unexpected server error");
    }

    @TestConfiguration
    static class TestConfig {
        @Bean
        TestErrorController testErrorController() {
            return new TestErrorController();
        }
    }

    @RestController
    static class TestErrorController {
        @GetMapping("/test-error")
        String error() {
            throw new IllegalStateException("Failed with secret 0x0123456789abcdef0123456789abcdef0123456789abcdef0123456789abcdef");
        }
    }
}
