package cli;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryUsage;

/**
 * Batch progress reporter: a {@code [PROGRESS]} line every {@code logEvery} files and a
 * {@code [HEARTBEAT]} line every 30s while a single file takes long.
 *
 * <p>Close it (try-with-resources) to stop the heartbeat thread.</p>
 */
public final class CliProgressMonitor implements AutoCloseable {

    private static final long HEARTBEAT_MS = 30_000L;

    private final int total;
    private final int logEvery;
    private final long startNs = System.nanoTime();
    private final Thread heartbeat;

    private volatile int done;
    private volatile String currentFile = "";

    public CliProgressMonitor(int total, int logEvery) {
        this.total = total;
        this.logEvery = Math.max(1, logEvery);
        this.heartbeat = new Thread(this::beat, "mapper-format-heartbeat");
        this.heartbeat.setDaemon(true);
        this.heartbeat.start();
    }

    /** marks {@code file} as the one being processed */
    public void begin(String file) {
        currentFile = file == null ? "" : file;
    }

    /** one file finished; prints a progress line when due */
    public void finished(int changedFiles, int failedFiles) {
        int n = ++done;
        if (n % logEvery != 0 && n != total) return;

        MemoryUsage heap = ManagementFactory.getMemoryMXBean().getHeapMemoryUsage();
        System.out.printf("[PROGRESS] %d/%d changed=%d failed=%d elapsed=%dms heap=%d/%dMB last=%s%n",
                n, total, changedFiles, failedFiles, elapsedMs(),
                heap.getUsed() >> 20, heap.getMax() >> 20, currentFile);
    }

    public long elapsedMs() {
        return (System.nanoTime() - startNs) / 1_000_000L;
    }

    private void beat() {
        try {
            while (true) {
                Thread.sleep(HEARTBEAT_MS);
                System.out.println("[HEARTBEAT] " + done + "/" + total + " current=" + currentFile);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        heartbeat.interrupt();
    }
}
