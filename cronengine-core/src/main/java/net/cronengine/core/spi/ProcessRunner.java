package net.cronengine.core.spi;

import net.cronengine.core.concurrent.CancellationToken;

import java.time.Duration;

/**
 * Executes a job's command. How the command is spawned, piped and killed on timeout
 * is the runner's business; the executor only sees the {@link Result}.
 */
public interface ProcessRunner {

    /**
     * @throws java.util.concurrent.CancellationException when {@code token} is cancelled
     */
    Result run(Request request, CancellationToken token) throws Exception;

    record Request(String command, String workingDir, Duration timeout) {}

    record Result(boolean success, String output, String error, boolean timedOut) {
        public static Result ok(String output) {
            return new Result(true, output, null, false);
        }

        public static Result failed(String output, String error) {
            return new Result(false, output, error, false);
        }

        public static Result timeout(String output, String error) {
            return new Result(false, output, error, true);
        }
    }
}
