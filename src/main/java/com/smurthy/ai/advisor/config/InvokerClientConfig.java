package com.smurthy.ai.advisor.config;

import com.smurthy.ai.advisor.agents.RequestSigner;
import com.smurthy.ai.advisor.agents.StaticTokenRequestSigner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * HTTP client used for outbound agent calls, with per-attempt connect and read timeouts.
 */
@Configuration
public class InvokerClientConfig {

    @Bean
    public RestClient agentRestClient(RestClient.Builder builder, InvokerConfig invokerConfig) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(invokerConfig.connectTimeout());
        requestFactory.setReadTimeout(invokerConfig.readTimeout());
        return builder.clone()
                .requestFactory(requestFactory)
                .build();
    }

    @Bean
    public RequestSigner requestSigner(InvokerConfig invokerConfig) {
        return new StaticTokenRequestSigner(invokerConfig.authToken());
    }
}
