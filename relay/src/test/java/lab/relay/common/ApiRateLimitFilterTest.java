package lab.relay.common;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "relay.rate-limit.api.max-requests=2",
        "relay.rate-limit.api.window=15m"
})
@AutoConfigureMockMvc
class ApiRateLimitFilterTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void clientOverBudgetGetsTooManyRequests() throws Exception {
        mockMvc.perform(get("/transfers/{id}", UUID.randomUUID()).with(r -> {
            r.setRemoteAddr("10.0.0.7");
            return r;
        })).andExpect(status().isNotFound());
        mockMvc.perform(get("/transfers/{id}", UUID.randomUUID()).with(r -> {
            r.setRemoteAddr("10.0.0.7");
            return r;
        })).andExpect(status().isNotFound());

        mockMvc.perform(get("/transfers/{id}", UUID.randomUUID()).with(r -> {
                    r.setRemoteAddr("10.0.0.7");
                    return r;
                }))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "900"))
                .andExpect(jsonPath("$.status").value(429));

        mockMvc.perform(get("/transfers/{id}", UUID.randomUUID()).with(r -> {
            r.setRemoteAddr("10.0.0.8");
            return r;
        })).andExpect(status().isNotFound());
    }
}
