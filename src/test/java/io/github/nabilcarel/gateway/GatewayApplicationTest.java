package io.github.nabilcarel.gateway;

import io.github.nabilcarel.gateway.model.backend.BackendRequest;
import io.github.nabilcarel.gateway.model.backend.BackendResponse;
import io.github.nabilcarel.gateway.service.BackendInvoker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest(properties = {
        "gateway.endpoints-directory=src/test/resources/endpoints",
        "gateway.public-base-url=https://gw.example.com",
        "gateway.environments.allowed=prod,test",
        "gateway.security.allowed-hosts=backend.test"
})
@AutoConfigureMockMvc
class GatewayApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private BackendInvoker backendInvoker;

    @BeforeEach
    void setUp() {
        when(backendInvoker.invoke(any(BackendRequest.class))).thenAnswer(invocation -> {
            BackendRequest request = invocation.getArgument(0);
            byte[] body = request.hasBody()
                    ? request.getBody()
                    : ("{\"@odata.id\":\"" + request.getUrl() + "\"}").getBytes(StandardCharsets.UTF_8);
            return Mono.just(BackendResponse.builder()
                    .statusCode(200)
                    .contentType("application/json")
                    .body(body)
                    .build());
        });
    }

    @Test
    void testEndpointListing_excludesPrivateEndpoints() throws Exception {
        mockMvc.perform(get("/gateway/endpoints"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(3))
                .andExpect(jsonPath("$[0].name").value("CreateOrder"))
                .andExpect(jsonPath("$[0].type").value("COMPOSITE"))
                .andExpect(jsonPath("$[1].name").value("Customers"))
                .andExpect(jsonPath("$[2].name").value("Orders"));
    }

    @Test
    void testProxy_secondGetServedFromCache() throws Exception {
        MvcResult first = mockMvc.perform(get("/api/prod/Customers/C1")).andReturn();
        mockMvc.perform(asyncDispatch(first))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Cache", "MISS"))
                .andExpect(header().exists("X-Request-Id"))
                .andExpect(jsonPath("$['@odata.id']").value("https://gw.example.com/api/prod/Customers/C1"));

        MvcResult second = mockMvc.perform(get("/api/prod/Customers/C1")).andReturn();
        mockMvc.perform(asyncDispatch(second))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Cache", "HIT"));

        verify(backendInvoker, times(1)).invoke(any(BackendRequest.class));
    }

    @Test
    void testComposite_runsStepsInOrder() throws Exception {
        MvcResult result = mockMvc.perform(post("/api/test/composite/CreateOrder")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"Header\":{\"Customer\":\"C1\"},\"Lines\":[{\"Item\":\"A\"},{\"Item\":\"B\"}]}"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.stepResults.CreateLines.length()").value(2))
                .andExpect(jsonPath("$.stepResults.CreateHeader.Customer").value("C1"))
                .andExpect(jsonPath("$.stepResults.CreateHeader.FirstLine").isNotEmpty());

        verify(backendInvoker, times(3)).invoke(any(BackendRequest.class));
    }

    @Test
    void testPrivateEndpoint_notReachableDirectly() throws Exception {
        mockMvc.perform(post("/api/prod/OrderLines").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void testPrivateEndpoint_notReachableThroughDotSegments() throws Exception {
        mockMvc.perform(get("/api/prod/Customers/../OrderLines/1"))
                .andExpect(status().isBadRequest());

        verify(backendInvoker, never()).invoke(any(BackendRequest.class));
    }

    @Test
    void testProxy_securityHeadersReplaceBackendIdentification() throws Exception {
        doReturn(Mono.just(BackendResponse.builder()
                .statusCode(200)
                .contentType("application/json")
                .headers(new LinkedHashMap<>(Map.of("Server", "Kestrel", "X-Powered-By", "ASP.NET",
                        "X-Frame-Options", "SAMEORIGIN")))
                .body("{}".getBytes(StandardCharsets.UTF_8))
                .build()))
                .when(backendInvoker).invoke(any(BackendRequest.class));

        MvcResult result = mockMvc.perform(get("/api/prod/Customers/C2")).andReturn();
        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isOk())
                .andExpect(header().doesNotExist("Server"))
                .andExpect(header().doesNotExist("X-Powered-By"))
                .andExpect(header().stringValues("X-Frame-Options", "DENY"))
                .andExpect(header().string("X-Content-Type-Options", "nosniff"));
    }

    @Test
    void testUnknownEnvironment_forbidden() throws Exception {
        mockMvc.perform(get("/api/staging/Customers"))
                .andExpect(status().isForbidden());
    }

    @Test
    void testHealth_reportsGatewayDetails() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.components.gateway.details.availableEndpoints").value(3))
                .andExpect(jsonPath("$.components.gateway.details.cacheProvider").value("memory"));
    }
}
