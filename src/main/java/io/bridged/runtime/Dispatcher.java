package io.bridged.runtime;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.bridged.capability.CapabilityRegistry;
import io.bridged.capability.InvocationContext;
import io.bridged.capability.Params;
import io.bridged.model.BridgeException;
import io.bridged.model.BridgeRequest;
import io.bridged.model.BridgeResponse;
import io.bridged.model.ErrorCategory;
import io.bridged.observability.MetricsCollector;
import io.bridged.observability.SecurityAuditLog;
import io.bridged.pool.HandlePool;
import io.bridged.security.InputValidator;
import io.bridged.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one decoded request through authorize, validate and execute, and always produces a
 * response. Every dispatch, denied ones included, is recorded in the metrics.
 */
public final class Dispatcher {
    private static final Logger LOG = LoggerFactory.getLogger(Dispatcher.class);

    enum Stage {
        RECEIVED,
        AUTHORIZED,
        VALIDATED,
        EXECUTING,
        COMPLETED
    }

    private final CapabilityRegistry registry;
    private final InputValidator validator;
    private final HandlePool pool;
    private final MetricsCollector metrics;
    private final SecurityAuditLog auditLog;

    public Dispatcher(
            CapabilityRegistry registry,
            InputValidator validator,
            HandlePool pool,
            MetricsCollector metrics,
            SecurityAuditLog auditLog
    ) {
        this.registry = registry;
        this.validator = validator;
        this.pool = pool;
        this.metrics = metrics;
        this.auditLog = auditLog;
    }

    public BridgeResponse dispatch(BridgeRequest request, String exchangeId) {
        long startedNanos = System.nanoTime();
        Stage stage = Stage.RECEIVED;
        boolean success = false;
        try {
            CapabilityRegistry.Capability capability = registry.authorize(request.module(), request.function());
            stage = Stage.AUTHORIZED;
            validator.validate(request.params());
            stage = Stage.VALIDATED;

            stage = Stage.EXECUTING;
            ObjectNode result = capability.operation().invoke(
                    new Params(request.params()),
                    new InvocationContext(exchangeId, pool)
            );
            stage = Stage.COMPLETED;
            success = true;
            return BridgeResponse.ok(result == null ? Jsons.object() : result);
        } catch (BridgeException e) {
            onFailure(request, exchangeId, stage, e);
            return BridgeResponse.failure(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("[{}] {} interrupted while {}", exchangeId, request.capability(), stage);
            return BridgeResponse.failure(BridgeException.timeout("Operation interrupted: " + request.capability()));
        } catch (Exception e) {
            BridgeException wrapped = BridgeException.execution(downstreamMessage(e), e);
            onFailure(request, exchangeId, stage, wrapped);
            return BridgeResponse.failure(wrapped);
        } finally {
            metrics.record(request.module(), request.function(), System.nanoTime() - startedNanos, success);
        }
    }

    private void onFailure(BridgeRequest request, String exchangeId, Stage stage, BridgeException error) {
        ErrorCategory category = error.category();
        if (category.securityRelevant() && stage.compareTo(Stage.VALIDATED) < 0) {
            String eventType;
            if (category == ErrorCategory.AUTHORIZATION) {
                eventType = "unauthorized_capability";
                metrics.recordRejection(eventType);
                LOG.warn("[{}] Denied {}: {}", exchangeId, request.capability(), error.getMessage());
            } else {
                eventType = "input_validation";
                metrics.recordValidationFailure(eventType);
                LOG.warn("[{}] Rejected {}: {}", exchangeId, request.capability(), error.getMessage());
            }
            audit(eventType, request, exchangeId, error);
        } else if (category == ErrorCategory.EXECUTION) {
            LOG.info("[{}] {} failed while {}: {}", exchangeId, request.capability(), stage, error.getMessage());
            if (error.getCause() != null) {
                LOG.debug("[{}] Downstream failure detail", exchangeId, error.getCause());
            }
        } else {
            LOG.debug("[{}] {} failed while {}: {}", exchangeId, request.capability(), stage, error.getMessage());
        }
    }

    private void audit(String eventType, BridgeRequest request, String exchangeId, BridgeException error) {
        if (auditLog == null) {
            return;
        }
        try {
            auditLog.log(new SecurityAuditLog.SecurityEvent(
                    eventType,
                    request.module(),
                    request.function(),
                    exchangeId,
                    error.category().wireName(),
                    error.getMessage(),
                    request.params()
            ));
        } catch (RuntimeException e) {
            LOG.error("[{}] Failed to write security audit row for {}", exchangeId, request.capability(), e);
        }
    }

    static String downstreamMessage(Throwable e) {
        String message = e.getMessage();
        if (message == null || message.isBlank()) {
            return e.getClass().getSimpleName();
        }
        return message;
    }
}
