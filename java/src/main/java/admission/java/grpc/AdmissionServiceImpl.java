package admission.java.grpc;

import admission.core.model.AdmissionGate;
import admission.core.model.AdmissionResult;
import admission.proto.AdmissionServiceGrpc;
import admission.proto.CheckAdmissionRequest;
import admission.proto.CheckAdmissionResponse;
import admission.proto.GenerateRequest;
import admission.proto.GenerateResponse;
import admission.proto.HealthCheckRequest;
import admission.proto.HealthCheckResponse;
import io.grpc.Metadata;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * gRPC service in front of the admission controller and the model.
 *
 * <p>This is a thin wrapper with:
 * <ul>
 *   <li>Session resolution from the call Context (see {@link SessionInterceptor})</li>
 *   <li>Request validation (fail-fast with INVALID_ARGUMENT)</li>
 *   <li>Rejections mapped to RESOURCE_EXHAUSTED, gRPC's "429", with a retry hint trailer</li>
 *   <li>Error handling (INTERNAL for unexpected errors)</li>
 * </ul>
 *
 * <p>Thread-safety: the gate handles concurrency internally.
 * This service is stateless and can handle concurrent RPCs.
 */
public final class AdmissionServiceImpl extends AdmissionServiceGrpc.AdmissionServiceImplBase {

    private static final Logger logger = LoggerFactory.getLogger(AdmissionServiceImpl.class);

    public static final Metadata.Key<String> RETRY_AFTER_MILLIS =
        Metadata.Key.of("retry-after-ms", Metadata.ASCII_STRING_MARSHALLER);

    private final AdmissionGate gate;
    private final ModelClient model;

    /**
     * @param gate Admission gate (must be thread-safe)
     * @param model Downstream model, called only for admitted requests
     * @throws IllegalArgumentException if either is null
     */
    public AdmissionServiceImpl(AdmissionGate gate, ModelClient model) {
        if (gate == null) {
            throw new IllegalArgumentException("gate cannot be null");
        }
        if (model == null) {
            throw new IllegalArgumentException("model cannot be null");
        }
        this.gate = gate;
        this.model = model;
    }

    @Override
    public void checkAdmission(
        CheckAdmissionRequest request,
        StreamObserver<CheckAdmissionResponse> responseObserver
    ) {
        try {
            String sessionId = requireSession();
            requireTokens(request.getTokensRequested());

            AdmissionResult result = gate.check(sessionId, request.getTokensRequested());

            responseObserver.onNext(toResponse(result));
            responseObserver.onCompleted();

        } catch (StatusRuntimeException e) {
            responseObserver.onError(e);
        } catch (IllegalArgumentException e) {
            responseObserver.onError(invalidArgument(e));
        } catch (Exception e) {
            responseObserver.onError(internal(e));
        }
    }

    @Override
    public void generate(
        GenerateRequest request,
        StreamObserver<GenerateResponse> responseObserver
    ) {
        try {
            String sessionId = requireSession();
            long tokens = request.getTokensRequested();
            requireTokens(tokens);

            AdmissionResult result = gate.check(sessionId, tokens);
            if (!result.admitted()) {
                responseObserver.onError(rateLimited(result));
                return;
            }

            // The model is charged exactly what was admitted.
            String text = model.generate(request.getPrompt(), tokens);

            responseObserver.onNext(GenerateResponse.newBuilder()
                .setText(text)
                .setTokensUsed(tokens)
                .build());
            responseObserver.onCompleted();

        } catch (StatusRuntimeException e) {
            responseObserver.onError(e);
        } catch (IllegalArgumentException e) {
            responseObserver.onError(invalidArgument(e));
        } catch (Exception e) {
            responseObserver.onError(internal(e));
        }
    }

    @Override
    public void healthCheck(
        HealthCheckRequest request,
        StreamObserver<HealthCheckResponse> responseObserver
    ) {
        // If we can respond, we're serving
        responseObserver.onNext(HealthCheckResponse.newBuilder()
            .setStatus(HealthCheckResponse.Status.SERVING)
            .build());
        responseObserver.onCompleted();
    }

    private static String requireSession() {
        String sessionId = SessionContext.current();
        if (sessionId == null) {
            throw Status.INVALID_ARGUMENT
                .withDescription("missing " + SessionContext.SESSION_ID_HEADER.name() + " header")
                .asRuntimeException();
        }
        return sessionId;
    }

    private static void requireTokens(long tokens) {
        if (tokens < 0) {
            throw Status.INVALID_ARGUMENT
                .withDescription("tokens_requested must be >= 0, got: " + tokens)
                .asRuntimeException();
        }
    }

    private static CheckAdmissionResponse toResponse(AdmissionResult result) {
        CheckAdmissionResponse.Builder builder = CheckAdmissionResponse.newBuilder()
            .setAdmitted(result.admitted())
            .setRetryAfterNanos(result.retryAfterNanos());
        if (result.reason() != null) {
            builder.setReason(CheckAdmissionResponse.Reason.valueOf(result.reason().name()));
        }
        return builder.build();
    }

    static StatusRuntimeException rateLimited(AdmissionResult result) {
        long retryMillis = TimeUnit.NANOSECONDS.toMillis(result.retryAfterNanos());
        String message = switch (result.reason()) {
            case REQUEST_LIMIT -> "Rate limit exceeded: too many requests in the current window. "
                + "Please try again in " + toSeconds(result.retryAfterNanos()) + " seconds.";
            case TOKEN_LIMIT -> "Rate limit exceeded: too many tokens in the current window. "
                + "Please try again in " + toSeconds(result.retryAfterNanos()) + " seconds.";
            case REQUEST_TOO_LARGE -> "Rate limit exceeded: request asks for more tokens than the window allows.";
        };

        Metadata trailers = new Metadata();
        trailers.put(RETRY_AFTER_MILLIS, Long.toString(retryMillis));
        return Status.RESOURCE_EXHAUSTED.withDescription(message).asRuntimeException(trailers);
    }

    private static long toSeconds(long nanos) {
        return (nanos + 999_999_999L) / 1_000_000_000L;
    }

    private static StatusRuntimeException invalidArgument(IllegalArgumentException e) {
        return Status.INVALID_ARGUMENT
            .withDescription(e.getMessage())
            .withCause(e)
            .asRuntimeException();
    }

    private static StatusRuntimeException internal(Exception e) {
        logger.warn("Unexpected error while handling request", e);
        return Status.INTERNAL
            .withDescription("Internal error: " + e.getMessage())
            .withCause(e)
            .asRuntimeException();
    }
}
