package org.theridian;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@DisplayName("Security flow Tests")
class SecurityFlowIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    @DisplayName("Protected endpoints should reject anonymous requests")
    void testAnonymousRejected() throws Exception {
        mockMvc.perform(get("/api/v1/data-sources"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("A registered user should reach the API with a bearer token and with an API key")
    void testRegisterLoginAndCallApi() throws Exception {
        mockMvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Ada\", \"email\": \"ada@example.com\", \"password\": \"s3cret-pass\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value("ada@example.com"));

        String loginBody = mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\": \"ada@example.com\", \"password\": \"s3cret-pass\"}"))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        String token = objectMapper.readTree(loginBody).get("token").asText();
        assertFalse(token.isBlank());

        mockMvc.perform(get("/api/v1/data-sources").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(0));

        String keyBody = mockMvc.perform(post("/api/v1/keys")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"ci pipeline\"}"))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        JsonNode key = objectMapper.readTree(keyBody);
        assertEquals("ada@example.com", key.get("user").get("email").asText());

        mockMvc.perform(get("/api/v1/keys").header("X-API-Key", key.get("key").asText()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("ci pipeline"));

        mockMvc.perform(get("/api/v1/keys").header("X-API-Key", "not-a-real-key"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("Wrong passwords should be rejected at login")
    void testLoginWrongPassword() throws Exception {
        mockMvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Bob\", \"email\": \"bob@example.com\", \"password\": \"right-pass\"}"))
                .andExpect(status().isOk());

        mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\": \"bob@example.com\", \"password\": \"wrong-pass\"}"))
                .andExpect(status().isUnauthorized());
    }
}
