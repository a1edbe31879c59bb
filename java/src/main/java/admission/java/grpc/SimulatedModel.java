package admission.java.grpc;

/**
 * Deterministic stand-in for a real model: echoes the prompt back,
 * cut to a length proportional to the admitted token budget.
 */
public final class SimulatedModel implements ModelClient {

    // rough characters per token
    private static final int CHARS_PER_TOKEN = 4;

    @Override
    public String generate(String prompt, long tokens) {
        String body = "Simulated response to: " + prompt;
        long budget = Math.min(Math.max(0L, tokens), Integer.MAX_VALUE / CHARS_PER_TOKEN);
        long maxChars = budget * CHARS_PER_TOKEN;
        if (body.length() > maxChars) {
            return body.substring(0, (int) maxChars);
        }
        return body;
    }
}
