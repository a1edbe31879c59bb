package admission.java.grpc;

import io.grpc.Context;
import io.grpc.Contexts;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;

/**
 * Binds the {@code x-session-id} header to the call's Context.
 *
 * <p>Calls without the header pass through unchanged; handlers that need a
 * session reject them themselves, so the health check stays open.
 */
public final class SessionInterceptor implements ServerInterceptor {

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
        ServerCall<ReqT, RespT> call,
        Metadata headers,
        ServerCallHandler<ReqT, RespT> next
    ) {
        String sessionId = headers.get(SessionContext.SESSION_ID_HEADER);
        if (sessionId == null || sessionId.isBlank()) {
            return next.startCall(call, headers);
        }

        Context context = Context.current().withValue(SessionContext.SESSION_ID, sessionId.trim());
        return Contexts.interceptCall(context, call, headers, next);
    }
}
