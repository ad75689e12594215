package com.give.payout.infrastructure.registry;

import com.give.payout.domain.exception.PayoutErrorCode;
import com.give.payout.domain.exception.PayoutException;
import com.give.payout.domain.registry.BeneficiaryRegistry;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigInteger;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Beneficiary registry reached over REST.
 *
 * Calls go through a retry and a circuit breaker. Anything other than a
 * definite answer from the registry raises REGISTRY_UNAVAILABLE; a 404 on a
 * beneficiary means "not approved".
 *
 * Configuration:
 * - app.registry.type: "rest" (default)
 * - app.registry.url: base URL, e.g. http://registry:8082
 */
@Component
@ConditionalOnProperty(name = "app.registry.type", havingValue = "rest", matchIfMissing = true)
public class RestBeneficiaryRegistry implements BeneficiaryRegistry {

    private static final Logger log = LoggerFactory.getLogger(RestBeneficiaryRegistry.class);

    private final RestTemplate restTemplate;
    private final String registryUrl;
    private final CircuitBreaker circuitBreaker;
    private final Retry retry;

    public RestBeneficiaryRegistry(@Qualifier("registryRestTemplate") RestTemplate restTemplate,
                                   @Value("${app.registry.url:http://localhost:8082}") String registryUrl,
                                   @Qualifier("registryCircuitBreaker") CircuitBreaker circuitBreaker,
                                   @Qualifier("registryRetry") Retry retry) {
        this.restTemplate = restTemplate;
        this.registryUrl = registryUrl;
        this.circuitBreaker = circuitBreaker;
        this.retry = retry;
    }

    @Override
    public boolean isApproved(String beneficiary) {
        return call("isApproved " + beneficiary, () -> {
            try {
                Map<?, ?> response = restTemplate.getForObject(
                        registryUrl + "/api/v1/beneficiaries/{id}", Map.class, beneficiary);
                boolean approved = response != null && Boolean.TRUE.equals(response.get("approved"));
                log.debug("Registry approval for {}: {}", beneficiary, approved);
                return approved;
            } catch (HttpClientErrorException.NotFound e) {
                return false;
            }
        });
    }

    @Override
    public Optional<String> currentBeneficiary() {
        return call("currentBeneficiary", () -> {
            try {
                Map<?, ?> response = restTemplate.getForObject(registryUrl + "/api/v1/beneficiaries/default", Map.class);
                Object beneficiary = response != null ? response.get("beneficiary") : null;
                return Optional.ofNullable(beneficiary).map(Object::toString).filter(b -> !b.isBlank());
            } catch (HttpClientErrorException.NotFound e) {
                return Optional.empty();
            }
        });
    }

    @Override
    public void recordReceipt(String beneficiary, BigInteger amount) {
        call("recordReceipt " + beneficiary, () -> {
            restTemplate.postForObject(registryUrl + "/api/v1/beneficiaries/{id}/receipts",
                    Map.of("amount", amount.toString()), Void.class, beneficiary);
            log.debug("Recorded receipt of {} for {}", amount, beneficiary);
            return null;
        });
    }

    private <T> T call(String description, Supplier<T> request) {
        Supplier<T> decorated = Retry.decorateSupplier(retry, CircuitBreaker.decorateSupplier(circuitBreaker, request));
        try {
            return decorated.get();
        } catch (CallNotPermittedException e) {
            log.warn("Registry circuit open, {} rejected", description);
            throw new PayoutException(PayoutErrorCode.REGISTRY_UNAVAILABLE, "Beneficiary registry circuit is open", e);
        } catch (RestClientException e) {
            log.error("Registry call {} failed: {}", description, e.getMessage());
            throw new PayoutException(PayoutErrorCode.REGISTRY_UNAVAILABLE, "Beneficiary registry unavailable: " + e.getMessage(), e);
        }
    }
}
