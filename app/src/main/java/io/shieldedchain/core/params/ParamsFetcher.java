package io.shieldedchain.core.params;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * Downloads large setup files over HTTP and checks them against a known SHA-256.
 * Progress goes to the listener passed with each call; nothing is kept between calls.
 */
public final class ParamsFetcher {
    private static final Logger LOG = Logger.getLogger(ParamsFetcher.class.getName());
    private static final int BUFFER_SIZE = 64 * 1024;

    private final HttpClient http;

    public ParamsFetcher(HttpClient http) {
        this.http = http;
    }

    public ParamsFetcher() {
        this(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(30))
                .build());
    }

    /** Download {@code source} into {@code target}, replacing any existing file. */
    public void fetch(URI source, Path target, ProgressListener listener) throws IOException, InterruptedException {
        LOG.info("Downloading " + source + " -> " + target);
        HttpRequest request = HttpRequest.newBuilder(source).GET().build();
        HttpResponse<InputStream> response = http.send(request, HttpResponse.BodyHandlers.ofInputStream());
        if (response.statusCode() / 100 != 2) {
            response.body().close();
            throw new IOException("Download of " + source + " failed with HTTP " + response.statusCode());
        }
        long total = response.headers().firstValueAsLong("Content-Length").orElse(-1L);
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Progress progress = new Progress("Downloading " + target.getFileName(), total, listener);
        try (InputStream in = response.body(); OutputStream out = Files.newOutputStream(target)) {
            byte[] buf = new byte[BUFFER_SIZE];
            int n;
            while ((n = in.read(buf)) != -1) {
                checkInterrupted();
                out.write(buf, 0, n);
                progress.advance(n);
            }
        }
        progress.done();
    }

    /**
     * Hash {@code file} and compare with {@code expectedSha256} (hex, case-insensitive).
     * A mismatching file is deleted. Returns false if the file is missing or did not match.
     */
    public boolean verify(Path file, String expectedSha256, ProgressListener listener) throws IOException {
        if (!Files.isRegularFile(file)) {
            LOG.warning("Could not open file " + file);
            return false;
        }
        LOG.info("Verifying " + file);
        MessageDigest sha = sha256();
        Progress progress = new Progress("Verifying " + file.getFileName(), Files.size(file), listener);
        try (InputStream in = Files.newInputStream(file)) {
            byte[] buf = new byte[BUFFER_SIZE];
            int n;
            while ((n = in.read(buf)) != -1) {
                checkInterrupted();
                sha.update(buf, 0, n);
                progress.advance(n);
            }
        }
        String actual = HexFormat.of().formatHex(sha.digest());
        if (!actual.equals(expectedSha256.trim().toLowerCase(Locale.ROOT))) {
            Files.deleteIfExists(file);
            LOG.warning("sha256 checksum mismatch for " + file + ": " + actual);
            return false;
        }
        progress.done();
        return true;
    }

    /** Make sure {@code target} exists with the expected checksum, downloading it once if needed. */
    public boolean ensure(URI source, Path target, String expectedSha256, ProgressListener listener)
            throws IOException, InterruptedException {
        if (Files.isRegularFile(target) && verify(target, expectedSha256, listener)) {
            return true;
        }
        fetch(source, target, listener);
        return verify(target, expectedSha256, listener);
    }

    private static void checkInterrupted() throws InterruptedIOException {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedIOException("parameter transfer interrupted");
        }
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    /** Per-call progress state: reports each 10% step once, clamped to 1..99 until done. */
    private static final class Progress {
        private final String label;
        private final long total;
        private final ProgressListener listener;
        private long soFar;
        private int reportedStep;

        Progress(String label, long total, ProgressListener listener) {
            this.label = label;
            this.total = total;
            this.listener = listener != null ? listener : ProgressListener.NONE;
        }

        void advance(long bytes) {
            soFar += bytes;
            if (total <= 0) return;
            int percent = (int) Math.max(1, Math.min(99, soFar * 100 / total));
            if (reportedStep < percent / 10) {
                reportedStep = percent / 10;
                listener.onProgress(label, percent);
            }
        }

        void done() {
            listener.onProgress(label, 100);
        }
    }
}
