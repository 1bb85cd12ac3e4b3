package io.github.nabilcarel.gateway.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.nabilcarel.gateway.config.EndpointDirectory;
import io.github.nabilcarel.gateway.config.GatewayProperties;
import io.github.nabilcarel.gateway.exception.BackendCallFailedException;
import io.github.nabilcarel.gateway.exception.BackendTransportException;
import io.github.nabilcarel.gateway.exception.MalformedInputDocumentException;
import io.github.nabilcarel.gateway.exception.StepExecutionException;
import io.github.nabilcarel.gateway.exception.StepNotFoundException;
import io.github.nabilcarel.gateway.exception.TemplateReferenceUnresolvedException;
import io.github.nabilcarel.gateway.model.EndpointDefinition;
import io.github.nabilcarel.gateway.model.StepCoordinator;
import io.github.nabilcarel.gateway.model.StepCoordinatorImpl;
import io.github.nabilcarel.gateway.model.backend.BackendRequest;
import io.github.nabilcarel.gateway.model.backend.BackendResponse;
import io.github.nabilcarel.gateway.model.composite.CompositeDefinition;
import io.github.nabilcarel.gateway.model.composite.CompositeStep;
import io.github.nabilcarel.gateway.model.context.ExecutionContext;
import io.github.nabilcarel.gateway.model.context.RequestMetadata;
import io.github.nabilcarel.gateway.model.response.CompositeErrorType;
import io.github.nabilcarel.gateway.model.response.CompositeResult;
import io.github.nabilcarel.gateway.util.JsonPaths;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

@Service
@RequiredArgsConstructor
@Slf4j
public class CompositeOrchestratorImpl implements CompositeOrchestrator {

    private final EndpointDirectory endpointDirectory;
    private final BackendInvoker backendInvoker;
    private final TemplateResolverService templateResolver;
    private final CompositeDefinitionValidator validator;
    private final AuthenticationForwardingService authenticationForwardingService;
    private final EnvironmentSettingsService environmentSettings;
    private final ResponseUrlRewriteService urlRewriteService;
    private final ErrorDetailExtractor errorDetailExtractor;
    private final GatewayProperties properties;
    @Qualifier("gatewayObjectMapper")
    private final ObjectMapper mapper;

    private final AtomicInteger activeExecutions = new AtomicInteger();

    @Override
    public int getActiveExecutions() {
        return activeExecutions.get();
    }

    @Override
    public Mono<CompositeResult> execute(CompositeDefinition definition, JsonNode requestBody, String environment,
                                         RequestMetadata metadata) {
        return Mono.defer(() -> {
            List<String> errors = validator.validate(definition);
            if (!errors.isEmpty()) {
                log.error("Composite {} is invalid: {}", definition == null ? null : definition.getName(), errors);
                return Mono.just(CompositeResult.builder()
                        .success(false)
                        .errorType(CompositeErrorType.INVALID_DEFINITION)
                        .errorMessage("Composite definition is invalid")
                        .errorDetail(String.join("; ", errors))
                        .build());
            }
            if (requestBody == null || requestBody.isMissingNode() || requestBody.isNull()) {
                return Mono.just(CompositeResult.failed(CompositeErrorType.MALFORMED_INPUT_DOCUMENT,
                        "Request body is required"));
            }

            ExecutionContext context = new ExecutionContext(metadata.getRequestId(), environment, requestBody,
                    contextVariables(definition, environment, metadata));
            StepCoordinator coordinator = new StepCoordinatorImpl(definition.getSteps());

            log.info("Executing composite {} with {} steps in environment {}",
                    definition.getName(), definition.getSteps().size(), environment);

            return runReadySteps(coordinator, context, metadata)
                    .then(Mono.fromCallable(() -> CompositeResult.succeeded(context.getStepResults())))
                    .onErrorResume(StepExecutionException.class, ex -> Mono.just(toFailure(ex, context)))
                    .timeout(properties.getComposite().getRequestTimeout())
                    .onErrorResume(TimeoutException.class, ex -> Mono.just(timedOut(definition, context)))
                    .map(result -> rewriteUrls(result, environment, metadata))
                    .doOnNext(result -> log.info("Composite {} finished: success={} steps={}",
                            definition.getName(), result.isSuccess(), result.getStepResults().keySet()))
                    .doOnSubscribe(subscription -> activeExecutions.incrementAndGet())
                    .doFinally(signal -> activeExecutions.decrementAndGet());
        });
    }

    private Mono<Void> runReadySteps(StepCoordinator coordinator, ExecutionContext context, RequestMetadata metadata) {
        return Mono.defer(() -> coordinator.nextReady()
                .map(step -> executeStep(step, coordinator, context, metadata)
                        .then(runReadySteps(coordinator, context, metadata)))
                .orElseGet(Mono::empty));
    }

    private Mono<Void> executeStep(CompositeStep step, StepCoordinator coordinator, ExecutionContext context,
                                   RequestMetadata metadata) {
        return Mono.defer(() -> {
            coordinator.markInProgress(step.getName());
            EndpointDefinition target = endpointDirectory.lookup(step.getEndpoint())
                    .orElseThrow(() -> new StepNotFoundException(step.getName(), step.getEndpoint()));

            JsonNode input = selectInput(step, context);
            Mono<JsonNode> result;
            if (step.isArray()) {
                List<JsonNode> elements = arrayElements(step, input);
                log.debug("Step {} processes {} elements", step.getName(), elements.size());
                result = Flux.fromIterable(elements)
                        .concatMap(element -> invoke(step, target, element, context, metadata))
                        .collectList()
                        .map(items -> {
                            ArrayNode array = mapper.createArrayNode();
                            array.addAll(items);
                            return (JsonNode) array;
                        });
            } else {
                result = invoke(step, target, input, context, metadata);
            }

            return result.doOnNext(value -> {
                context.putStepResult(step.getName(), value);
                coordinator.markResolved(step.getName());
                log.debug("Step {} completed", step.getName());
            }).then();
        });
    }

    private Mono<JsonNode> invoke(CompositeStep step, EndpointDefinition target, JsonNode element,
                                  ExecutionContext context, RequestMetadata metadata) {
        return Mono.defer(() -> {
            JsonNode document = transform(step, element, context);
            BackendRequest request = BackendRequest.builder()
                    .url(target.getUrl())
                    .method(HttpMethod.valueOf(step.getMethod().toUpperCase()))
                    .headers(stepHeaders(context.getEnvironment(), metadata))
                    .body(serialize(step, document))
                    .build();

            return backendInvoker.invoke(request)
                    .onErrorMap(BackendTransportException.class,
                            ex -> new BackendCallFailedException(step.getName(), ex))
                    .map(response -> {
                        if (!response.isSuccessful()) {
                            log.warn("Step {} failed with HTTP {} from {}", step.getName(),
                                    response.getStatusCode(), target.getUrl());
                            throw new BackendCallFailedException(step.getName(), response.getStatusCode(),
                                    response.getBodyAsString());
                        }
                        return parseResult(response, document);
                    });
        });
    }

    private JsonNode selectInput(CompositeStep step, ExecutionContext context) {
        String sourceProperty = step.getSourceProperty();
        if (!StringUtils.hasText(sourceProperty)) {
            return context.getRoot();
        }
        return JsonPaths.navigate(context.getRoot(), sourceProperty)
                .or(() -> (step.getDependsOn() != null
                        ? context.getStepResult(step.getDependsOn())
                        : context.getLastStepResult())
                        .flatMap(previous -> JsonPaths.navigate(previous, sourceProperty)))
                .orElseThrow(() -> new MalformedInputDocumentException(step.getName(),
                        "Source property '" + sourceProperty + "' not found in request body or previous step result"));
    }

    private List<JsonNode> arrayElements(CompositeStep step, JsonNode input) {
        String arrayProperty = step.getArrayProperty();
        JsonNode array = StringUtils.hasText(arrayProperty)
                ? JsonPaths.navigate(input, arrayProperty).orElse(null)
                : input;
        if (array == null || !array.isArray()) {
            throw new MalformedInputDocumentException(step.getName(), StringUtils.hasText(arrayProperty)
                    ? "Array property '" + arrayProperty + "' not found or not an array"
                    : "Input of array step '" + step.getName() + "' is not an array");
        }
        List<JsonNode> elements = new ArrayList<>(array.size());
        array.forEach(elements::add);
        return elements;
    }

    private JsonNode transform(CompositeStep step, JsonNode element, ExecutionContext context) {
        if (step.getTemplateTransformations().isEmpty()) {
            return element.deepCopy();
        }
        if (!element.isObject()) {
            throw new MalformedInputDocumentException(step.getName(),
                    "Step '" + step.getName() + "' has template transformations but its input is not a JSON object");
        }
        ObjectNode document = ((ObjectNode) element).deepCopy();
        templateResolver.applyTransformations(document, step, context);
        return document;
    }

    private byte[] serialize(CompositeStep step, JsonNode document) {
        try {
            return mapper.writeValueAsBytes(document);
        } catch (JsonProcessingException e) {
            throw new MalformedInputDocumentException(step.getName(), "Cannot serialize step input: "
                    + e.getOriginalMessage(), e);
        }
    }

    private JsonNode parseResult(BackendResponse response, JsonNode sentDocument) {
        byte[] body = response.getBody();
        if (body == null || body.length == 0) {
            return sentDocument == null ? NullNode.getInstance() : sentDocument;
        }
        try {
            return mapper.readTree(body);
        } catch (IOException e) {
            log.debug("Step response is not JSON, keeping it as text: {}", e.getMessage());
            return TextNode.valueOf(response.getBodyAsString());
        }
    }

    private HttpHeaders stepHeaders(String environment, RequestMetadata metadata) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        authenticationForwardingService.forwardAuthentication(metadata.getHeaders(), headers);
        environmentSettings.applyHeaders(environment, headers);
        if (metadata.getRequestId() != null) {
            headers.set("X-Request-Id", metadata.getRequestId());
        }
        return headers;
    }

    private Map<String, String> contextVariables(CompositeDefinition definition, String environment,
                                                 RequestMetadata metadata) {
        Map<String, String> variables = new LinkedHashMap<>(metadata.getQueryParameters());
        variables.putAll(metadata.getContextVariables());
        variables.put("environment", environment);
        variables.put("composite", definition.getName());
        if (metadata.getRequestId() != null) {
            variables.put("requestId", metadata.getRequestId());
        }
        return variables;
    }

    private CompositeResult toFailure(StepExecutionException ex, ExecutionContext context) {
        log.warn("Composite step {} failed ({}): {}", ex.getStepName(), ex.getErrorType(), ex.getMessage());
        CompositeResult.CompositeResultBuilder builder = CompositeResult.builder()
                .success(false)
                .stepResults(new LinkedHashMap<>(context.getStepResults()))
                .failedStep(ex.getStepName())
                .errorType(ex.getErrorType())
                .errorMessage(ex.getMessage());

        if (ex instanceof BackendCallFailedException) {
            BackendCallFailedException failure = (BackendCallFailedException) ex;
            builder.httpStatusCode(failure.getStatusCode())
                    .responseBody(failure.getResponseBody())
                    .timedOut(failure.isTimedOut());
            if (failure.getStatusCode() != null) {
                ErrorDetailExtractor.ErrorDetail detail = errorDetailExtractor.extract(failure.getResponseBody());
                builder.errorDetail(detail.getDetail()).structuredError(detail.getStructuredError());
            } else {
                builder.errorDetail(failure.getCause() != null ? failure.getCause().getMessage() : null);
            }
        } else if (ex instanceof TemplateReferenceUnresolvedException) {
            String available = ((TemplateReferenceUnresolvedException) ex).getAvailableReferences();
            if (available != null) {
                builder.errorDetail("Available references: " + available);
            }
        }
        return builder.build();
    }

    private CompositeResult timedOut(CompositeDefinition definition, ExecutionContext context) {
        log.warn("Composite {} exceeded {}", definition.getName(), properties.getComposite().getRequestTimeout());
        return CompositeResult.builder()
                .success(false)
                .stepResults(new LinkedHashMap<>(context.getStepResults()))
                .errorType(CompositeErrorType.BACKEND_CALL_FAILED)
                .errorMessage("Composite '" + definition.getName() + "' did not complete within "
                        + properties.getComposite().getRequestTimeout().toMillis() + "ms")
                .timedOut(true)
                .build();
    }

    private CompositeResult rewriteUrls(CompositeResult result, String environment, RequestMetadata metadata) {
        if (result.getStepResults().isEmpty() || metadata.getPublicBaseUrl() == null) {
            return result;
        }
        return result.toBuilder()
                .stepResults(urlRewriteService.rewriteStepResults(result.getStepResults(), environment,
                        metadata.getPublicBaseUrl()))
                .build();
    }
}
