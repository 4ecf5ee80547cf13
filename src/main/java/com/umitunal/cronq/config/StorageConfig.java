package com.umitunal.cronq.config;

/**
 * Configuration for the RocksDB document store.
 */
public class StorageConfig {
    private final String dataDirectory;
    private final boolean durableWrites;
    private final int memoryBufferSizeMB;
    private final int maxMemoryBuffers;
    private final int backgroundThreads;
    private final int blockCacheSizeMB;
    private final int conflictRetries;

    private StorageConfig(Builder builder) {
        this.dataDirectory = builder.dataDirectory;
        this.durableWrites = builder.durableWrites;
        this.memoryBufferSizeMB = builder.memoryBufferSizeMB;
        this.maxMemoryBuffers = builder.maxMemoryBuffers;
        this.backgroundThreads = builder.backgroundThreads;
        this.blockCacheSizeMB = builder.blockCacheSizeMB;
        this.conflictRetries = builder.conflictRetries;
    }

    public String getDataDirectory() { return dataDirectory; }
    public boolean isDurableWrites() { return durableWrites; }
    public int getMemoryBufferSizeMB() { return memoryBufferSizeMB; }
    public int getMaxMemoryBuffers() { return maxMemoryBuffers; }
    public int getBackgroundThreads() { return backgroundThreads; }
    public int getBlockCacheSizeMB() { return blockCacheSizeMB; }
    public int getConflictRetries() { return conflictRetries; }

    public static Builder newBuilder(String dataDirectory) {
        return new Builder(dataDirectory);
    }

    public static class Builder {
        private final String dataDirectory;
        private boolean durableWrites = true;
        private int memoryBufferSizeMB = 16;
        private int maxMemoryBuffers = 3;
        private int backgroundThreads = 2;
        private int blockCacheSizeMB = 32;
        private int conflictRetries = 5;

        private Builder(String dataDirectory) {
            this.dataDirectory = dataDirectory;
        }

        /**
         * Sync the write-ahead log on every write.
         * Locks written without it can be lost on a machine crash, which only shortens them.
         * Default: true
         */
        public Builder withDurableWrites(boolean enable) {
            this.durableWrites = enable;
            return this;
        }

        /**
         * Memtable size in MB. Default: 16
         */
        public Builder withMemoryBufferSize(int sizeMB) {
            this.memoryBufferSizeMB = sizeMB;
            return this;
        }

        /**
         * Default: 3
         */
        public Builder withMaxMemoryBuffers(int count) {
            this.maxMemoryBuffers = count;
            return this;
        }

        /**
         * Flush and compaction threads. Default: 2
         */
        public Builder withBackgroundThreads(int count) {
            this.backgroundThreads = count;
            return this;
        }

        /**
         * Block cache size in MB. Default: 32
         */
        public Builder withBlockCacheSize(int sizeMB) {
            this.blockCacheSizeMB = sizeMB;
            return this;
        }

        /**
         * How many times a single-document update is retried after a write conflict. Default: 5
         */
        public Builder withConflictRetries(int retries) {
            this.conflictRetries = retries;
            return this;
        }

        public StorageConfig build() {
            if (dataDirectory == null || dataDirectory.isBlank()) {
                throw new IllegalArgumentException("dataDirectory must not be empty");
            }
            if (conflictRetries < 0) {
                throw new IllegalArgumentException("conflictRetries must not be negative");
            }
            return new StorageConfig(this);
        }
    }
}
