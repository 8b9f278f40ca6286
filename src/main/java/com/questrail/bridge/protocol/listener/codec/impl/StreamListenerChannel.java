package com.questrail.bridge.protocol.listener.codec.impl;

import com.questrail.bridge.protocol.listener.codec.ListenerChannel;
import com.questrail.bridge.protocol.listener.codec.ListenerHeader;
import com.questrail.bridge.protocol.listener.codec.ListenerResult;
import com.questrail.bridge.protocol.listener.codec.ListenerTimeoutException;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * StreamListenerChannel
 * =============================================================================
 * {@link ListenerChannel} over a pair of byte streams, normally the process's
 * standard input and output.
 *
 * <h2>Idle-read timeout</h2>
 * With a zero timeout, reads block on the calling thread for as long as the
 * daemon takes. With a positive timeout, each read runs on a dedicated reader
 * thread and the caller waits at most that long. A blocked stream read cannot
 * be interrupted, so after a timeout the channel is marked broken and every
 * further read fails immediately.
 *
 * <h2>Threading</h2>
 * One caller at a time. The bridge loop is the only user.
 */
public final class StreamListenerChannel implements ListenerChannel
{
    @FunctionalInterface
    private interface IoCall<T> {
        T call() throws IOException;
    }

    private final InputStream in;
    private final OutputStream out;
    private final Duration idleTimeout;
    private final ExecutorService reader;

    private volatile boolean broken;

    public StreamListenerChannel(InputStream in, OutputStream out)
    {
        this(in, out, Duration.ZERO);
    }

    public StreamListenerChannel(InputStream in, OutputStream out, Duration idleTimeout)
    {
        Objects.requireNonNull(in, "in");
        this.in = in instanceof BufferedInputStream ? in : new BufferedInputStream(in);
        this.out = Objects.requireNonNull(out, "out");
        this.idleTimeout = Objects.requireNonNull(idleTimeout, "idleTimeout");
        if (idleTimeout.isNegative()) {
            throw new IllegalArgumentException("idleTimeout must be non-negative");
        }

        this.reader = idleTimeout.isZero()
                ? null
                : Executors.newSingleThreadExecutor(r -> {
                    Thread t = new Thread(r, "listener-channel-reader");
                    t.setDaemon(true);
                    return t;
                });
    }

    @Override
    public void signalReady() throws IOException
    {
        out.write(ListenerFraming.READY);
        out.flush();
    }

    @Override
    public ListenerHeader readHeader() throws IOException
    {
        String line = bounded("header", () -> ListenerFraming.readLine(in));
        return ListenerHeaderParser.parse(line);
    }

    @Override
    public byte[] readPayload(int length) throws IOException
    {
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative");
        }
        if (length == 0) {
            return new byte[0];
        }
        return bounded("payload", () -> ListenerFraming.readExactly(in, length));
    }

    @Override
    public void acknowledge(ListenerResult result) throws IOException
    {
        Objects.requireNonNull(result, "result");
        out.write(result.encode());
        out.flush();
    }

    @Override
    public void close()
    {
        if (reader != null) {
            reader.shutdownNow();
        }
    }

    private <T> T bounded(String what, IoCall<T> call) throws IOException
    {
        if (reader == null) {
            return call.call();
        }
        if (broken) {
            throw new IOException("Listener channel unusable after an idle-read timeout");
        }

        Future<T> pending = reader.submit(call::call);
        try {
            return pending.get(idleTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            broken = true;
            pending.cancel(true);
            throw new ListenerTimeoutException(
                    "No " + what + " received within " + idleTimeout.toMillis() + " ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while reading " + what);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new IOException("Failed reading " + what, cause);
        }
    }
}
