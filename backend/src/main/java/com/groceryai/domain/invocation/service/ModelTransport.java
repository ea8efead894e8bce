package com.groceryai.domain.invocation.service;

import com.groceryai.domain.invocation.model.InvocationRequest;
import com.groceryai.domain.invocation.model.ModelResponse;

/**
 * Sends one request to a hosted text model. Implementations perform exactly one attempt;
 * retries are the caller's job.
 */
public interface ModelTransport {

    /**
     * @param request the built request
     * @return the normalized provider response
     * @throws ModelTransportException when the provider rejects the call or cannot be reached
     */
    ModelResponse invoke(InvocationRequest request);

    /**
     * Short provider name for logs.
     */
    String providerName();
}
