package fr.lapetina.mcs.loadbalancer.infrastructure.ratelimit;

import io.github.resilience4j.ratelimiter.RateLimiter;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;

/**
 * Input stream charging every byte read against a bandwidth limiter.
 *
 * Reads are capped to one refresh period worth of permits, and the read returns
 * only once its bytes have been granted, so the consumer is throttled to the rate.
 */
public final class RateLimitedInputStream extends FilterInputStream {

    private final RateLimiter limiter;
    private final int maxChunk;

    public RateLimitedInputStream(InputStream in, RateLimiter limiter) {
        super(in);
        this.limiter = limiter;
        this.maxChunk = limiter.getRateLimiterConfig().getLimitForPeriod();
    }

    @Override
    public int read() throws IOException {
        int b = super.read();
        if (b >= 0) {
            charge(1);
        }
        return b;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        int n = super.read(b, off, Math.min(len, maxChunk));
        if (n > 0) {
            charge(n);
        }
        return n;
    }

    @Override
    public long skip(long n) throws IOException {
        long skipped = super.skip(Math.min(n, maxChunk));
        if (skipped > 0) {
            charge((int) skipped);
        }
        return skipped;
    }

    private void charge(int bytes) throws IOException {
        while (!limiter.acquirePermission(bytes)) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedIOException("Interrupted while waiting for bandwidth");
            }
        }
    }
}
