package de.bsommerfeld.dbqueue.db;

import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteOpenMode;

import java.time.Duration;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Immutable configuration of a {@link DatabaseQueue}.
 *
 * <pre>{@code
 * DatabaseOptions options = DatabaseOptions.builder()
 *         .createIfMissing(false)
 *         .journalMode(SQLiteConfig.JournalMode.WAL)
 *         .build();
 * }</pre>
 *
 * Defaults: the file is created when missing, opened read-write, foreign keys
 * are enforced, a busy database is retried for five seconds, and 64 compiled
 * statements are cached.
 */
public final class DatabaseOptions {

    private static final DatabaseOptions DEFAULTS = builder().build();

    private final boolean createIfMissing;
    private final boolean readOnly;
    private final boolean foreignKeys;
    private final Duration busyTimeout;
    private final SQLiteConfig.JournalMode journalMode;
    private final int statementCacheSize;
    private final TransactionKind defaultTransactionKind;
    private final Duration closeTimeout;
    private final String threadName;

    private DatabaseOptions(Builder builder) {
        this.createIfMissing = builder.createIfMissing;
        this.readOnly = builder.readOnly;
        this.foreignKeys = builder.foreignKeys;
        this.busyTimeout = builder.busyTimeout;
        this.journalMode = builder.journalMode;
        this.statementCacheSize = builder.statementCacheSize;
        this.defaultTransactionKind = builder.defaultTransactionKind;
        this.closeTimeout = builder.closeTimeout;
        this.threadName = builder.threadName;
    }

    public static DatabaseOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .createIfMissing(createIfMissing)
                .readOnly(readOnly)
                .foreignKeys(foreignKeys)
                .busyTimeout(busyTimeout)
                .journalMode(journalMode)
                .statementCacheSize(statementCacheSize)
                .defaultTransactionKind(defaultTransactionKind)
                .closeTimeout(closeTimeout)
                .threadName(threadName);
    }

    public boolean createIfMissing() {
        return createIfMissing;
    }

    public boolean readOnly() {
        return readOnly;
    }

    public boolean foreignKeys() {
        return foreignKeys;
    }

    public Duration busyTimeout() {
        return busyTimeout;
    }

    /** {@code null} leaves the file's journal mode untouched. */
    public SQLiteConfig.JournalMode journalMode() {
        return journalMode;
    }

    public int statementCacheSize() {
        return statementCacheSize;
    }

    public TransactionKind defaultTransactionKind() {
        return defaultTransactionKind;
    }

    /** How long {@link DatabaseQueue#close()} waits for queued blocks. */
    public Duration closeTimeout() {
        return closeTimeout;
    }

    /** Name of the queue's thread, {@code null} to derive it from the file name. */
    public String threadName() {
        return threadName;
    }

    /**
     * Translates these options into the driver's configuration.
     */
    SQLiteConfig toSQLiteConfig() {
        SQLiteConfig config = new SQLiteConfig();
        config.setReadOnly(readOnly);
        if (!createIfMissing || readOnly)
            config.resetOpenMode(SQLiteOpenMode.CREATE);
        config.enforceForeignKeys(foreignKeys);
        config.setBusyTimeout((int) Math.min(Integer.MAX_VALUE, busyTimeout.toMillis()));
        if (journalMode != null)
            config.setJournalMode(journalMode);
        return config;
    }

    @Override
    public String toString() {
        return "DatabaseOptions{createIfMissing=" + createIfMissing
                + ", readOnly=" + readOnly
                + ", foreignKeys=" + foreignKeys
                + ", busyTimeout=" + busyTimeout
                + ", journalMode=" + journalMode
                + ", statementCacheSize=" + statementCacheSize
                + ", defaultTransactionKind=" + defaultTransactionKind
                + '}';
    }

    public static final class Builder {

        private boolean createIfMissing = true;
        private boolean readOnly = false;
        private boolean foreignKeys = true;
        private Duration busyTimeout = Duration.ofSeconds(5);
        private SQLiteConfig.JournalMode journalMode;
        private int statementCacheSize = 64;
        private TransactionKind defaultTransactionKind = TransactionKind.DEFERRED;
        private Duration closeTimeout = Duration.ofSeconds(30);
        private String threadName;

        private Builder() {
        }

        public Builder createIfMissing(boolean createIfMissing) {
            this.createIfMissing = createIfMissing;
            return this;
        }

        public Builder readOnly(boolean readOnly) {
            this.readOnly = readOnly;
            return this;
        }

        public Builder foreignKeys(boolean foreignKeys) {
            this.foreignKeys = foreignKeys;
            return this;
        }

        public Builder busyTimeout(Duration busyTimeout) {
            this.busyTimeout = Objects.requireNonNull(busyTimeout, "busyTimeout");
            return this;
        }

        public Builder journalMode(SQLiteConfig.JournalMode journalMode) {
            this.journalMode = journalMode;
            return this;
        }

        public Builder statementCacheSize(int statementCacheSize) {
            this.statementCacheSize = statementCacheSize;
            return this;
        }

        public Builder defaultTransactionKind(TransactionKind defaultTransactionKind) {
            this.defaultTransactionKind = Objects.requireNonNull(defaultTransactionKind, "defaultTransactionKind");
            return this;
        }

        public Builder closeTimeout(Duration closeTimeout) {
            this.closeTimeout = Objects.requireNonNull(closeTimeout, "closeTimeout");
            return this;
        }

        public Builder threadName(String threadName) {
            this.threadName = threadName;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a duration is negative or the
         *                                  cache size is negative
         */
        public DatabaseOptions build() {
            checkArgument(!busyTimeout.isNegative(), "busyTimeout must not be negative: %s", busyTimeout);
            checkArgument(!closeTimeout.isNegative(), "closeTimeout must not be negative: %s", closeTimeout);
            checkArgument(statementCacheSize >= 0, "statementCacheSize must not be negative: %s", statementCacheSize);
            return new DatabaseOptions(this);
        }
    }
}
