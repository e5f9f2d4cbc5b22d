package com.questrail.mdoc.connectionmethod;

import com.questrail.mdoc.transport.ConnectionTimeoutException;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Asks an external party (typically a UI) to choose, and blocks for the answer.
 *
 * <p>The prompt function receives the candidate list and returns a stage that
 * completes with the choice. An answer that is not one of the candidates is
 * rejected.</p>
 */
public final class PromptingConnectionMethodSelector implements ConnectionMethodSelector
{
    private final Function<List<ConnectionMethod>, ? extends CompletionStage<ConnectionMethod>> prompt;
    private final Duration timeout;

    public PromptingConnectionMethodSelector(
            Function<List<ConnectionMethod>, ? extends CompletionStage<ConnectionMethod>> prompt,
            Duration timeout)
    {
        this.prompt = Objects.requireNonNull(prompt, "prompt");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public ConnectionMethod select(List<ConnectionMethod> methods) {
        if (methods.size() == 1) {
            return methods.get(0);
        }
        ConnectionMethod chosen;
        try {
            chosen = prompt.apply(List.copyOf(methods))
                    .toCompletableFuture()
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new ConnectionTimeoutException("No connection method chosen within " + timeout, e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Connection method prompt failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for connection method choice", e);
        }
        if (!methods.contains(chosen)) {
            throw new IllegalArgumentException("Chosen method " + chosen + " was not offered");
        }
        return chosen;
    }
}
