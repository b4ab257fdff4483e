package com.wscrape.capture;

import com.jcraft.jsch.Session;
import com.wscrape.config.ConfigurationException;
import com.wscrape.config.CredentialLoader;
import com.wscrape.config.Login;
import com.wscrape.config.WScrapeProperties;
import com.wscrape.model.CaptureStatistics;
import com.wscrape.model.LoginEntry;
import com.wscrape.parser.WOutputParser;
import com.wscrape.ssh.JschCommandExecutor;
import com.wscrape.ssh.RemoteCommandException;
import com.wscrape.ssh.RemoteCommandExecutor;
import com.wscrape.ssh.SshSessionFactory;
import com.wscrape.store.DuplicateLoginEntryException;
import com.wscrape.store.JdbcLoginEntrySink;
import com.wscrape.store.LoginEntrySink;
import com.wscrape.store.PersistenceException;
import com.wscrape.store.StoreDataSourceFactory;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Repeatedly runs {@code w} over SSH, parses the report and stores every row in the {@code LoginEntry}
 * table (see {@link JdbcLoginEntrySink} for the schema).
 *
 * <p>Both connections are opened by the constructor and stay open until {@link #dispose()}. Capturing
 * begins with {@link #start()} and ends with {@link #stop()}; a stopped scraper cannot be started again.
 * Captures run on a single daemon thread with a fixed delay between the end of one capture and the start
 * of the next, so two captures never overlap.
 *
 * <p>A capture that cannot reach the host is abandoned and retried after the normal delay. A row that
 * cannot be stored (typically a duplicate key) does not prevent the rest of the batch from being stored.
 */
public class WScrape {
    private static final Logger log = LoggerFactory.getLogger(WScrape.class);

    private final String sshHost;
    private final long captureIntervalMs;
    private final Session session;
    private final AutoCloseable store;
    private final RemoteCommandExecutor executor;
    private final WOutputParser parser;
    private final LoginEntrySink sink;
    private final CaptureObserver observer;
    private final ScheduledExecutorService scheduler;

    private final CaptureCounters counters = new CaptureCounters();

    private volatile CaptureState state = CaptureState.IDLE;
    private ScheduledFuture<?> scheduledTask;
    private volatile List<LoginEntry> latestBatch = List.of();

    /**
     * Connects to the store and the SSH host.
     *
     * @param properties connection settings
     * @param observer optional callback invoked after each capture, may be null
     * @throws ConfigurationException if credentials cannot be read or either connection fails
     */
    public WScrape(WScrapeProperties properties, CaptureObserver observer) {
        this(properties, observer, new CredentialLoader(), new StoreDataSourceFactory(), new SshSessionFactory());
    }

    WScrape(
            WScrapeProperties properties,
            CaptureObserver observer,
            CredentialLoader credentialLoader,
            StoreDataSourceFactory storeFactory,
            SshSessionFactory sshFactory
    ) {
        Objects.requireNonNull(properties, "properties");
        requirePositiveInterval(properties.getCaptureIntervalMs());

        Login sqlLogin = credentialLoader.load(properties.getSqlLoginFile());
        Login sshLogin = credentialLoader.load(properties.getSshLoginFile());

        HikariDataSource dataSource = storeFactory.open(properties.getSqlUrl(), sqlLogin);
        Session ssh;
        try {
            ssh = sshFactory.open(sshLogin, properties);
        } catch (RuntimeException e) {
            dataSource.close();
            throw e;
        }

        this.sshHost = properties.getSshHost();
        this.captureIntervalMs = properties.getCaptureIntervalMs();
        this.session = ssh;
        this.store = dataSource;
        this.executor = new JschCommandExecutor(ssh, properties.getSshConnectTimeoutMs(), properties.getCommandTimeoutMs());
        this.parser = new WOutputParser();
        this.sink = new JdbcLoginEntrySink(dataSource);
        this.observer = observer;
        this.scheduler = newScheduler(sshHost);
    }

    /**
     * Builds a scraper around connections that are already open. The scraper takes ownership of
     * {@code session} and {@code store} and releases them on {@link #dispose()}.
     *
     * @param sshHost host name, used for logging and the thread name
     * @param captureIntervalMs delay between captures
     * @param session connected SSH session
     * @param store store handle backing {@code sink}
     * @param executor runs the status command over {@code session}
     * @param parser report parser
     * @param sink entry writer
     * @param observer optional callback, may be null
     */
    public WScrape(
            String sshHost,
            long captureIntervalMs,
            Session session,
            AutoCloseable store,
            RemoteCommandExecutor executor,
            WOutputParser parser,
            LoginEntrySink sink,
            CaptureObserver observer
    ) {
        requirePositiveInterval(captureIntervalMs);
        this.sshHost = Objects.requireNonNull(sshHost, "sshHost");
        this.captureIntervalMs = captureIntervalMs;
        this.session = Objects.requireNonNull(session, "session");
        this.store = Objects.requireNonNull(store, "store");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.observer = observer;
        this.scheduler = newScheduler(sshHost);
    }

    /**
     * Starts capturing. Does nothing if already running.
     *
     * @throws IllegalStateException if the scraper was stopped or disposed
     */
    public synchronized void start() {
        if (state == CaptureState.RUNNING) {
            log.warn("Scraper already running: host={}", sshHost);
            return;
        }
        if (state != CaptureState.IDLE) {
            throw new IllegalStateException("Scraper for " + sshHost + " cannot be started from state " + state);
        }

        state = CaptureState.RUNNING;
        scheduledTask = scheduler.scheduleWithFixedDelay(this::captureOnce, 0, captureIntervalMs, TimeUnit.MILLISECONDS);
        log.info("Started scraper: host={}, interval_ms={}", sshHost, captureIntervalMs);
    }

    /**
     * Stops capturing. A capture already in progress is allowed to finish; no further capture is started.
     * Connections stay open until {@link #dispose()}. Does nothing unless running.
     */
    public synchronized void stop() {
        if (state != CaptureState.RUNNING) {
            return;
        }

        state = CaptureState.STOPPED;
        scheduledTask.cancel(false);
        log.info("Stopped scraper: host={}", sshHost);
    }

    /**
     * Stops capturing and closes the store and SSH connections. Safe to call more than once.
     */
    public synchronized void dispose() {
        if (state == CaptureState.DISPOSED) {
            return;
        }

        state = CaptureState.DISPOSED;
        if (scheduledTask != null) {
            scheduledTask.cancel(false);
        }
        scheduler.shutdown();

        try {
            store.close();
        } catch (Exception e) {
            log.warn("Failed to close store: host={}", sshHost, e);
        }
        session.disconnect();
        log.info("Disposed scraper: host={}", sshHost);
    }

    public CaptureState getState() {
        return state;
    }

    public boolean isRunning() {
        return state == CaptureState.RUNNING;
    }

    public String getSshHost() {
        return sshHost;
    }

    /**
     * Returns the batch from the most recent successful capture.
     *
     * @return latest batch, empty before the first capture
     */
    public List<LoginEntry> getLatestBatch() {
        return latestBatch;
    }

    public CaptureStatistics getStatistics() {
        return counters.snapshot();
    }

    void captureOnce() {
        if (state != CaptureState.RUNNING) {
            return;
        }

        long startedAt = System.nanoTime();
        try {
            String output = executor.execute();
            List<LoginEntry> batch = List.copyOf(parser.parse(output));

            if (!saveAll(batch)) {
                return;
            }
            latestBatch = batch;
            counters.cycleSucceeded(batch.size(), elapsedMs(startedAt));
            log.debug("Captured {} login entries: host={}", batch.size(), sshHost);

            notifyObserver(batch);
        } catch (RemoteCommandException e) {
            counters.cycleFailed(elapsedMs(startedAt));
            logCycleFailure("Failed to run status command", e);
        } catch (RuntimeException e) {
            counters.cycleFailed(elapsedMs(startedAt));
            logCycleFailure("Capture failed", e);
        }
    }

    /**
     * @return false if the scraper was disposed part way through; the rest of the batch is not offered
     */
    private boolean saveAll(List<LoginEntry> batch) {
        for (LoginEntry entry : batch) {
            if (state == CaptureState.DISPOSED) {
                log.debug("Scraper disposed during capture, abandoning batch: host={}", sshHost);
                return false;
            }
            try {
                sink.save(entry);
                counters.recordSaved();
            } catch (DuplicateLoginEntryException e) {
                counters.recordDuplicate();
                log.debug("Skipping duplicate: {}", e.getMessage());
            } catch (PersistenceException e) {
                counters.recordFailed();
                log.warn("Failed to store login entry: host={}", sshHost, e);
            }
        }
        return true;
    }

    private void notifyObserver(List<LoginEntry> batch) {
        if (observer == null) {
            return;
        }
        try {
            observer.onCapture(batch);
        } catch (RuntimeException e) {
            log.warn("Capture observer failed: host={}", sshHost, e);
        }
    }

    private void logCycleFailure(String message, Exception e) {
        // Failures after stop/dispose are expected: the connections may already be gone.
        if (state == CaptureState.RUNNING) {
            log.error("{}: host={}", message, sshHost, e);
        } else {
            log.debug("{} after shutdown: host={}", message, sshHost, e);
        }
    }

    private static long elapsedMs(long startedAtNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAtNanos);
    }

    private static void requirePositiveInterval(long captureIntervalMs) {
        if (captureIntervalMs <= 0) {
            throw new ConfigurationException("Capture interval must be positive: " + captureIntervalMs);
        }
    }

    private static ScheduledExecutorService newScheduler(String sshHost) {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "wscrape-capture-" + sshHost);
            t.setDaemon(true);
            return t;
        });
    }
}
