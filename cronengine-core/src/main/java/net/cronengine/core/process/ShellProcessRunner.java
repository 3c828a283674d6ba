package net.cronengine.core.process;

import net.cronengine.core.concurrent.CancellationToken;
import net.cronengine.core.spi.ProcessRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;

/**
 * Runs a command through the platform shell ({@code sh -c}, or {@code cmd.exe /c} on Windows).
 * stdout and stderr are drained on their own threads so a chatty process never blocks on a full pipe.
 * Timeout and cancellation both kill the whole process tree.
 * Output is decoded as UTF-8 and only the last {@code maxCapturedBytes} of each stream are kept.
 */
public final class ShellProcessRunner implements ProcessRunner {
    private static final Logger log = LoggerFactory.getLogger(ShellProcessRunner.class);

    static final long POLL_MILLIS = 100;
    static final long DRAIN_JOIN_MILLIS = 2_000;
    public static final int DEFAULT_MAX_CAPTURED_BYTES = 1024 * 1024;

    private final Charset charset;
    private final boolean windows;
    private final int maxCapturedBytes;

    public ShellProcessRunner() {
        this(StandardCharsets.UTF_8, System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win"));
    }

    ShellProcessRunner(Charset charset, boolean windows) {
        this(charset, windows, DEFAULT_MAX_CAPTURED_BYTES);
    }

    ShellProcessRunner(Charset charset, boolean windows, int maxCapturedBytes) {
        if (maxCapturedBytes < 1) throw new IllegalArgumentException("maxCapturedBytes must be >= 1");
        this.charset = charset;
        this.windows = windows;
        this.maxCapturedBytes = maxCapturedBytes;
    }

    @Override
    public Result run(Request request, CancellationToken token) throws Exception {
        token.throwIfCancelled();
        log.debug("Executing: {}", request.command());

        ProcessBuilder pb = new ProcessBuilder(shellCommand(request.command()));
        if (request.workingDir() != null && !request.workingDir().isBlank()) {
            pb.directory(new File(request.workingDir()));
        }
        Process process = pb.start();
        process.getOutputStream().close();

        StreamDrain out = StreamDrain.start(process.getInputStream(), "stdout-" + process.pid(), maxCapturedBytes);
        StreamDrain err = StreamDrain.start(process.getErrorStream(), "stderr-" + process.pid(), maxCapturedBytes);

        long timeoutSeconds = request.timeout().toSeconds();
        long deadline = System.nanoTime() + request.timeout().toNanos();
        try {
            while (!process.waitFor(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                if (token.isCancelled()) {
                    kill(process);
                    throw new CancellationException("Cancelled: " + token.reason());
                }
                if (System.nanoTime() - deadline >= 0) {
                    log.warn("Timeout after {}s: {}", timeoutSeconds, request.command());
                    kill(process);
                    return Result.timeout(out.text(charset), "Timed out after " + timeoutSeconds + " seconds. " + err.text(charset));
                }
            }
        } catch (InterruptedException e) {
            kill(process);
            throw e;
        }

        String stdout = out.text(charset);
        String stderr = err.text(charset);
        int exit = process.exitValue();
        log.debug("Completed: exitCode={}, command={}", exit, request.command());
        return exit == 0 ? Result.ok(stdout) : Result.failed(stdout, "Exit code " + exit + ". " + stderr);
    }

    List<String> shellCommand(String command) {
        return windows ? List.of("cmd.exe", "/c", command) : List.of("sh", "-c", command);
    }

    private static void kill(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            process.waitFor(DRAIN_JOIN_MILLIS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /** Copies one stream into memory on a daemon thread, keeping at most the last {@code max} bytes. */
    private static final class StreamDrain implements Runnable {
        private final InputStream in;
        private final int max;
        private final ByteArrayOutputStream buf = new ByteArrayOutputStream();
        private final Thread thread;
        private long dropped;   // guarded by buf

        private StreamDrain(InputStream in, String name, int max) {
            this.in = in;
            this.max = max;
            this.thread = new Thread(this, "cronengine-drain-" + name);
            this.thread.setDaemon(true);
        }

        static StreamDrain start(InputStream in, String name, int max) {
            StreamDrain d = new StreamDrain(in, name, max);
            d.thread.start();
            return d;
        }

        @Override
        public void run() {
            byte[] chunk = new byte[8192];
            try (in) {
                int n;
                while ((n = in.read(chunk)) != -1) {
                    synchronized (buf) {
                        buf.write(chunk, 0, n);
                        // compact once the buffer holds twice the cap
                        if (buf.size() > 2L * max) {
                            byte[] all = buf.toByteArray();
                            dropped += all.length - max;
                            buf.reset();
                            buf.write(all, all.length - max, max);
                        }
                    }
                }
            } catch (IOException e) {
                // stream closed by a kill
                log.debug("Stream drain stopped: {}", e.getMessage());
            }
        }

        String text(Charset cs) throws InterruptedException {
            thread.join(DRAIN_JOIN_MILLIS);
            synchronized (buf) {
                byte[] all = buf.toByteArray();
                if (all.length <= max && dropped == 0) return new String(all, cs);
                int keep = Math.min(all.length, max);
                long total = dropped + (all.length - keep);
                return "...[truncated " + total + " bytes]\n" + new String(all, all.length - keep, keep, cs);
            }
        }
    }
}
