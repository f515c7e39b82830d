package throttle.grpc;

import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import throttle.core.clock.Clock;
import throttle.core.model.CallContext;
import throttle.engine.ThrottleEngine;
import throttle.engine.ThrottleModule;
import throttle.engine.ThrottleUnavailableException;
import throttle.proto.HealthCheckRequest;
import throttle.proto.HealthCheckResponse;
import throttle.proto.IsDeniedRequest;
import throttle.proto.IsDeniedResponse;
import throttle.proto.ThrottleServiceGrpc;

import java.time.Duration;

/**
 * gRPC service implementation for admission checks.
 *
 * <p>This is a thin wrapper over the module's ThrottleEngine with:
 * <ul>
 *   <li>UNAVAILABLE while the module is not loaded</li>
 *   <li>Absent key answered as denied before any validation</li>
 *   <li>Request validation (fail-fast with INVALID_ARGUMENT)</li>
 *   <li>Error handling (INTERNAL for unexpected errors)</li>
 *   <li>A CallContext per RPC, read from the injected clock</li>
 * </ul>
 *
 * <p>Thread-safety: the engine handles concurrency internally.
 * This service is stateless and can handle concurrent RPCs.
 */
public final class ThrottleServiceImpl extends ThrottleServiceGrpc.ThrottleServiceImplBase {

    private static final Logger log = LoggerFactory.getLogger(ThrottleServiceImpl.class);

    private final ThrottleModule module;
    private final CallContext context;

    /**
     * Creates a new gRPC service backed by the given module.
     *
     * @param module Loaded (or soon to be loaded) throttle module
     * @param clock Time source for every call
     * @throws IllegalArgumentException if module or clock is null
     */
    public ThrottleServiceImpl(ThrottleModule module, Clock clock) {
        if (module == null) {
            throw new IllegalArgumentException("module cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.module = module;
        this.context = clock::nowNanos;
    }

    @Override
    public void isDenied(
        IsDeniedRequest request,
        StreamObserver<IsDeniedResponse> responseObserver
    ) {
        try {
            ThrottleEngine engine = module.engine();

            if (!request.hasKey()) {
                responseObserver.onNext(IsDeniedResponse.newBuilder().setDenied(true).build());
                responseObserver.onCompleted();
                return;
            }
            if (request.getLimit() <= 0) {
                responseObserver.onError(
                    Status.INVALID_ARGUMENT
                        .withDescription("limit must be > 0, got: " + request.getLimit())
                        .asRuntimeException()
                );
                return;
            }
            if (request.getPeriodMillis() <= 0) {
                responseObserver.onError(
                    Status.INVALID_ARGUMENT
                        .withDescription("period_millis must be > 0, got: " + request.getPeriodMillis())
                        .asRuntimeException()
                );
                return;
            }

            boolean denied = engine.isDenied(
                context,
                request.getKey().toByteArray(),
                request.getLimit(),
                Duration.ofMillis(request.getPeriodMillis())
            );

            responseObserver.onNext(IsDeniedResponse.newBuilder().setDenied(denied).build());
            responseObserver.onCompleted();

        } catch (ThrottleUnavailableException e) {
            // Not loaded, or unloaded while this call was in flight
            responseObserver.onError(
                Status.UNAVAILABLE
                    .withDescription(e.getMessage())
                    .asRuntimeException()
            );
        } catch (IllegalArgumentException e) {
            responseObserver.onError(
                Status.INVALID_ARGUMENT
                    .withDescription(e.getMessage())
                    .withCause(e)
                    .asRuntimeException()
            );
        } catch (Exception e) {
            log.error("IsDenied failed", e);
            responseObserver.onError(
                Status.INTERNAL
                    .withDescription("Internal error: " + e.getMessage())
                    .withCause(e)
                    .asRuntimeException()
            );
        }
    }

    @Override
    public void healthCheck(
        HealthCheckRequest request,
        StreamObserver<HealthCheckResponse> responseObserver
    ) {
        HealthCheckResponse response = HealthCheckResponse.newBuilder()
            .setStatus(module.isLoaded()
                ? HealthCheckResponse.Status.SERVING
                : HealthCheckResponse.Status.NOT_SERVING)
            .build();

        responseObserver.onNext(response);
        responseObserver.onCompleted();
    }
}
