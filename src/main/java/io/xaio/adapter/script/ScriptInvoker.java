package io.xaio.adapter.script;

import com.fasterxml.jackson.databind.JsonNode;
import io.xaio.adapter.TransientStageException;
import io.xaio.adapter.ValidationStageException;
import io.xaio.security.SensitiveDataMasker;
import io.xaio.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs an external command with a JSON document on stdin and expects a JSON document on stdout. Exit code 0 is
 * success, {@value #EXIT_DATAERR} (EX_DATAERR) marks the input as unusable, anything else is transient.
 */
public final class ScriptInvoker {
    public static final int EXIT_DATAERR = 65;
    private static final Logger LOG = LoggerFactory.getLogger(ScriptInvoker.class);
    private static final int MAX_ERROR_CHARS = 512;

    private final List<String> command;
    private final long timeoutMs;

    public ScriptInvoker(List<String> command, long timeoutMs) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("script command cannot be empty");
        }
        this.command = List.copyOf(command);
        this.timeoutMs = Math.max(1L, timeoutMs);
    }

    public List<String> command() {
        return command;
    }

    public JsonNode invoke(List<String> extraArgs, JsonNode payload)
            throws TransientStageException, ValidationStageException {
        List<String> argv = new ArrayList<>(command);
        argv.addAll(extraArgs);
        ProcessBuilder pb = new ProcessBuilder(argv);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new TransientStageException("script spawn failed: " + e.getMessage(), e);
        }

        CompletableFuture<byte[]> stdout = drain(process.getInputStream());
        CompletableFuture<byte[]> stderr = drain(process.getErrorStream());
        try {
            byte[] input = payload == null
                    ? new byte[0]
                    : Jsons.mapper().writeValueAsBytes(payload);
            try (OutputStream in = process.getOutputStream()) {
                in.write(input);
                in.flush();
            } catch (IOException e) {
                // the script may exit without reading its input; its exit code decides the outcome
                LOG.debug("script closed stdin early: {}", e.getMessage());
            }

            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                throw new TransientStageException("script timeout after " + Duration.ofMillis(timeoutMs));
            }
            byte[] out = stdout.get(5, TimeUnit.SECONDS);
            String err = new String(stderr.get(5, TimeUnit.SECONDS), StandardCharsets.UTF_8);
            int exit = process.exitValue();
            if (exit == EXIT_DATAERR) {
                throw new ValidationStageException("script rejected input: " + truncate(err));
            }
            if (exit != 0) {
                throw new TransientStageException("script exit=" + exit + " stderr=" + truncate(err));
            }
            try {
                return Jsons.parse(out);
            } catch (IOException e) {
                throw new ValidationStageException("script output is not JSON: " + truncate(new String(out, StandardCharsets.UTF_8)), e);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new TransientStageException("script interrupted", e);
        } catch (ExecutionException | TimeoutException | IOException e) {
            process.destroyForcibly();
            throw new TransientStageException("script execution failed: " + e.getMessage(), e);
        }
    }

    private static CompletableFuture<byte[]> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = stream) {
                return in.readAllBytes();
            } catch (IOException e) {
                throw new IllegalStateException("Failed to read script output", e);
            }
        });
    }

    static String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = SensitiveDataMasker.maskText(raw.replace("\r", " ").replace("\n", " ").trim());
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
