package io.modelgate.core.gateway;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Every attempt of one {@code chat} call failed. The attempts are kept in the order they ran.
 */
public class FailoverExhaustedException extends RuntimeException {
    private final List<FailoverAttempt> attempts;
    private final boolean budgetExceeded;

    public FailoverExhaustedException(List<FailoverAttempt> attempts, boolean budgetExceeded) {
        super(render(attempts, budgetExceeded));
        this.attempts = List.copyOf(attempts);
        this.budgetExceeded = budgetExceeded;
    }

    public List<FailoverAttempt> attempts() {
        return attempts;
    }

    public boolean budgetExceeded() {
        return budgetExceeded;
    }

    private static String render(List<FailoverAttempt> attempts, boolean budgetExceeded) {
        String header = budgetExceeded
            ? "Failover budget exhausted after " + attempts.size() + " attempt(s):"
            : "All backends failed after " + attempts.size() + " attempt(s):";
        return header + attempts.stream()
            .map(FailoverAttempt::toString)
            .collect(Collectors.joining("\n", "\n", ""));
    }
}
