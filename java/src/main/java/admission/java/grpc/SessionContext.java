package admission.java.grpc;

import io.grpc.Context;
import io.grpc.Metadata;

/**
 * Where the current call's session id lives.
 *
 * <p>Clients send it in the {@code x-session-id} header; {@link SessionInterceptor}
 * copies it into the gRPC {@link Context} for the lifetime of the call, so
 * handlers read it with {@link #current()}.
 */
public final class SessionContext {

    public static final Metadata.Key<String> SESSION_ID_HEADER =
        Metadata.Key.of("x-session-id", Metadata.ASCII_STRING_MARSHALLER);

    static final Context.Key<String> SESSION_ID = Context.key("admission-session-id");

    private SessionContext() {
        // Utility class, no instantiation
    }

    /**
     * @return the session id of the call being handled, or null if the caller sent none
     */
    public static String current() {
        return SESSION_ID.get();
    }
}
