package com.segym.core.llm;

/**
 * Transport to a language model. Returns the raw response text; schema validation is the
 * caller's job so that it can be retried independently of the transport.
 */
public interface ModelClient {

    /**
     * @throws RateLimitException      when the provider throttles the call
     * @throws ModelTransportException when the endpoint fails
     * @throws EmptyResponseException  when the model answers with blank content
     */
    String complete(ModelRequest<?> request);
}
