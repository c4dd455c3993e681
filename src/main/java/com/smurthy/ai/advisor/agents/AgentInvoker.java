package com.smurthy.ai.advisor.agents;

import com.smurthy.ai.advisor.config.DeadlineAwareBackOffPolicy;
import com.smurthy.ai.advisor.config.InvokerConfig;
import com.smurthy.ai.advisor.config.RetryConfig;
import com.smurthy.ai.advisor.exceptions.AgentAuthException;
import com.smurthy.ai.advisor.exceptions.AgentUnreachableException;
import com.smurthy.ai.advisor.exceptions.TransportException;
import com.smurthy.ai.advisor.model.AgentDescriptor;
import com.smurthy.ai.advisor.orchestration.RequestDeadline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Calls a downstream agent over HTTP.
 *
 * Only transport failures (timeouts, refused or reset connections) are retried, with the
 * exponential backoff of {@link RetryConfig#agentRetryTemplate}, each pause bounded by the request
 * deadline. Any HTTP status is an answer from the
 * agent and ends the call: 401/403 raise {@link AgentAuthException}, every other status is
 * returned to the caller as is.
 */
@Service
public class AgentInvoker {

    private static final Logger log = LoggerFactory.getLogger(AgentInvoker.class);

    private final RestClient restClient;
    private final RetryTemplate retryTemplate;
    private final RequestSigner requestSigner;

    @Autowired
    public AgentInvoker(@Qualifier("agentRestClient") RestClient restClient,
                        InvokerConfig invokerConfig,
                        RequestSigner requestSigner) {
        this(restClient, RetryConfig.agentRetryTemplate(invokerConfig), requestSigner);
    }

    AgentInvoker(RestClient restClient, RetryTemplate retryTemplate, RequestSigner requestSigner) {
        this.restClient = restClient;
        this.retryTemplate = retryTemplate;
        this.requestSigner = requestSigner;
    }

    /**
     * The JSON body an agent expects: the question under its request-format field, plus the
     * caller's context when the agent asks for it.
     */
    public static Map<String, Object> buildPayload(AgentDescriptor agent, String question, Map<String, Object> context) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(agent.requestFormat().fieldName(), question);
        if (agent.needsExtraContext() && context != null && !context.isEmpty()) {
            payload.put("context", context);
        }
        return payload;
    }

    /**
     * POST {@code payload} to the agent's endpoint.
     *
     * @throws AgentAuthException        agent answered 401/403, or no credential is available
     * @throws AgentUnreachableException every attempt failed at transport level
     * @throws com.smurthy.ai.advisor.exceptions.RequestTimeoutException the request deadline
     *         ran out before an attempt could start
     */
    public AgentHttpResponse invoke(AgentDescriptor agent, Map<String, Object> payload, RequestDeadline deadline) {
        HttpHeaders headers = new HttpHeaders();
        if (agent.requiresAuth()) {
            requestSigner.sign(headers, agent);
        }

        AtomicInteger attempts = new AtomicInteger();
        AgentHttpResponse response;
        try {
            response = retryTemplate.execute(context -> {
                context.setAttribute(DeadlineAwareBackOffPolicy.DEADLINE_ATTRIBUTE, deadline);
                deadline.check();
                int attempt = attempts.incrementAndGet();
                log.info("Calling agent '{}' at {} (attempt {})", agent.id(), agent.endpointUrl(), attempt);
                return send(agent, payload, headers);
            });
        } catch (TransportException e) {
            log.error("Agent '{}' unreachable after {} attempt(s): {}", agent.id(), attempts.get(), e.getMessage());
            throw new AgentUnreachableException(agent.id(), attempts.get(), e.getCause());
        }

        if (response.statusCode() == 401 || response.statusCode() == 403) {
            log.error("Agent '{}' refused the call with HTTP {}", agent.id(), response.statusCode());
            throw new AgentAuthException(agent.id(), response.statusCode(),
                    "Agent '" + agent.id() + "' refused the call (HTTP " + response.statusCode() + ")");
        }

        log.info("Agent '{}' answered HTTP {} after {} attempt(s)", agent.id(), response.statusCode(), attempts.get());
        return response;
    }

    private AgentHttpResponse send(AgentDescriptor agent, Map<String, Object> payload, HttpHeaders headers) {
        try {
            return restClient.post()
                    .uri(agent.endpointUrl())
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .headers(h -> h.addAll(headers))
                    .body(payload)
                    .exchange((request, response) -> new AgentHttpResponse(
                            response.getStatusCode().value(),
                            StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8)));
        } catch (ResourceAccessException e) {
            log.warn("Transport failure calling agent '{}': {}", agent.id(), e.getMessage());
            throw new TransportException("Transport failure calling agent '" + agent.id() + "'", e);
        }
    }
}
