package org.twinsql.server;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;
import org.twinsql.db.DatabaseClient;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "twinsql.engine=sqlite",
        "twinsql.sqlite.path=target/test-data/server-app.db",
        "twinsql.sqlite.pool-max=2"
})
@AutoConfigureMockMvc
class TwinSqlServerApplicationTest {

    @Autowired
    MockMvc mockMvc;

    @Autowired
    DatabaseClient client;

    @Test
    void healthIsUpAgainstTheEmbeddedEngine() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.database.status").value("UP"))
                .andExpect(jsonPath("$.database.engine").value("sqlite"))
                .andExpect(jsonPath("$.database.identity").value(client.identity().key()));

        mockMvc.perform(get("/api/db/info"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.engine").value("sqlite"))
                .andExpect(jsonPath("$.poolCount").value(1));
    }

    @Test
    void defaultClientRunsQueries() {
        List<Map<String, Object>> rows = client.executeQuery("SELECT %s AS greeting", List.of("hello"));

        assertEquals("hello", rows.get(0).get("greeting"));
    }
}
