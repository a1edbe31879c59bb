package admission.java.grpc;

/**
 * The downstream model endpoint that admitted calls are forwarded to.
 */
public interface ModelClient {

    /**
     * @param prompt the caller's prompt
     * @param tokens the token cost already charged to the session
     * @return the model's reply
     */
    String generate(String prompt, long tokens);
}
