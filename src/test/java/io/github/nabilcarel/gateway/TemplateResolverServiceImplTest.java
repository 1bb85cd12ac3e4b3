package io.github.nabilcarel.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.nabilcarel.gateway.config.GatewayProperties;
import io.github.nabilcarel.gateway.exception.TemplateReferenceUnresolvedException;
import io.github.nabilcarel.gateway.model.composite.CompositeStep;
import io.github.nabilcarel.gateway.model.context.ExecutionContext;
import io.github.nabilcarel.gateway.model.context.SharedValueScope;
import io.github.nabilcarel.gateway.service.TemplateResolverServiceImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class TemplateResolverServiceImplTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private GatewayProperties properties;
    private TemplateResolverServiceImpl resolver;
    private ExecutionContext context;

    @BeforeEach
    void setUp() throws Exception {
        properties = new GatewayProperties();
        resolver = new TemplateResolverServiceImpl(properties);
        context = new ExecutionContext("req-1", "prod", mapper.readTree("{\"Lines\":[]}"),
                Map.of("environment", "prod", "tenant", "acme"));
    }

    @Test
    void testResolve_guid_isSharedWithinRequest() {
        JsonNode first = resolver.resolve("$guid", "CreateLines", context);
        JsonNode second = resolver.resolve("$guid", "CreateHeader", context);

        assertThat(first.asText()).matches("[0-9a-f\\-]{36}");
        assertThat(second).isEqualTo(first);
    }

    @Test
    void testResolve_guid_differsBetweenRequests() {
        ExecutionContext other = new ExecutionContext("req-2", "prod", mapper.createObjectNode(), Map.of());

        assertThat(resolver.resolve("$guid", "A", context))
                .isNotEqualTo(resolver.resolve("$guid", "A", other));
    }

    @Test
    void testResolve_guid_stepScope_differsBetweenSteps() {
        properties.getComposite().setSharedValueScope(SharedValueScope.STEP);

        JsonNode first = resolver.resolve("$guid", "A", context);
        JsonNode again = resolver.resolve("$guid", "A", context);
        JsonNode other = resolver.resolve("$guid", "B", context);

        assertThat(again).isEqualTo(first);
        assertThat(other).isNotEqualTo(first);
    }

    @Test
    void testResolve_previous_dottedAndBracketedIndexes() throws Exception {
        context.putStepResult("StepA", mapper.readTree("{\"items\":[{\"id\":\"x\"},{\"id\":\"y\"}]}"));

        assertThat(resolver.resolve("$prev.StepA.items.1.id", "StepB", context).asText()).isEqualTo("y");
        assertThat(resolver.resolve("$prev.StepA.items[0].id", "StepB", context).asText()).isEqualTo("x");
        assertThat(resolver.resolve("$prev.StepA", "StepB", context).get("items").size()).isEqualTo(2);
    }

    @Test
    void testResolve_previous_arrayResult() throws Exception {
        context.putStepResult("CreateLines", mapper.readTree("[{\"TransactionKey\":\"k1\"},{\"TransactionKey\":\"k2\"}]"));

        assertThat(resolver.resolve("$prev.CreateLines.0.TransactionKey", "CreateHeader", context).asText())
                .isEqualTo("k1");
        assertThat(resolver.resolve("$prev.CreateLines[1].TransactionKey", "CreateHeader", context).asText())
                .isEqualTo("k2");
    }

    @Test
    void testResolve_previous_preservesNonTextValues() throws Exception {
        context.putStepResult("StepA", mapper.readTree("{\"count\":3,\"flag\":true}"));

        assertThat(resolver.resolve("$prev.StepA.count", "StepB", context).isInt()).isTrue();
        assertThat(resolver.resolve("$prev.StepA.flag", "StepB", context).asBoolean()).isTrue();
    }

    @Test
    void testResolve_previous_outOfRangeIndex_throws() throws Exception {
        context.putStepResult("StepA", mapper.readTree("{\"items\":[{\"id\":\"x\"}]}"));

        assertThatThrownBy(() -> resolver.resolve("$prev.StepA.items.5.id", "StepB", context))
                .isInstanceOf(TemplateReferenceUnresolvedException.class)
                .satisfies(ex -> {
                    TemplateReferenceUnresolvedException unresolved = (TemplateReferenceUnresolvedException) ex;
                    assertThat(unresolved.getStepName()).isEqualTo("StepB");
                    assertThat(unresolved.getReference()).isEqualTo("$prev.StepA.items.5.id");
                });
    }

    @Test
    void testResolve_previous_unknownStep_throws() {
        assertThatThrownBy(() -> resolver.resolve("$prev.Missing.id", "StepB", context))
                .isInstanceOf(TemplateReferenceUnresolvedException.class)
                .hasMessageContaining("Missing");
    }

    @Test
    void testResolve_previous_missingProperty_throws() throws Exception {
        context.putStepResult("StepA", mapper.readTree("{\"id\":\"x\"}"));

        assertThatThrownBy(() -> resolver.resolve("$prev.StepA.name", "StepB", context))
                .isInstanceOf(TemplateReferenceUnresolvedException.class);
    }

    @Test
    void testResolve_contextVariable() {
        assertThat(resolver.resolve("$context.tenant", "A", context).asText()).isEqualTo("acme");
    }

    @Test
    void testResolve_unknownContextVariable_throws() {
        assertThatThrownBy(() -> resolver.resolve("$context.unknown", "A", context))
                .isInstanceOf(TemplateReferenceUnresolvedException.class)
                .hasMessageContaining("unknown");
    }

    @Test
    void testResolve_literal_copiedVerbatim() {
        assertThat(resolver.resolve("Pending", "A", context).asText()).isEqualTo("Pending");
        assertThat(resolver.resolve("$unknownFunction", "A", context).asText()).isEqualTo("$unknownFunction");
    }

    @Test
    void testApplyTransformations_writesEveryField() throws Exception {
        context.putStepResult("StepA", mapper.readTree("{\"id\":42}"));
        Map<String, String> transformations = new LinkedHashMap<>();
        transformations.put("Key", "$guid");
        transformations.put("ParentId", "$prev.StepA.id");
        transformations.put("Status", "New");
        CompositeStep step = CompositeStep.builder().name("StepB").endpoint("X").dependsOn("StepA")
                .templateTransformations(transformations).build();
        ObjectNode target = (ObjectNode) mapper.readTree("{\"Name\":\"line\",\"Status\":\"Old\"}");

        resolver.applyTransformations(target, step, context);

        assertThat(target.get("Name").asText()).isEqualTo("line");
        assertThat(target.get("ParentId").asInt()).isEqualTo(42);
        assertThat(target.get("Status").asText()).isEqualTo("New");
        assertThat(target.get("Key").asText()).isEqualTo(context.getSharedValues().get("$guid").asText());
    }
}
