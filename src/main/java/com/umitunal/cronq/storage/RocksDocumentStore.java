package com.umitunal.cronq.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.umitunal.cronq.config.StorageConfig;
import com.umitunal.cronq.core.DocumentFilter;
import com.umitunal.cronq.core.DocumentStore;
import com.umitunal.cronq.core.DocumentUpdate;
import com.umitunal.cronq.core.StoreException;
import com.umitunal.cronq.serialization.DocumentCodec;
import com.umitunal.cronq.serialization.JsonDocumentCodec;
import org.rocksdb.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * RocksDB-backed document collection.
 *
 * Documents are keyed by their id and stored as encoded bytes. Claims run inside
 * optimistic transactions: the candidate is re-read with {@code getForUpdate},
 * checked against the filter again and written back; if another writer touched
 * it first the commit fails and the scan moves on to the next candidate.
 *
 * RocksDB locks its data directory to one process, so all workers sharing an
 * instance of this store live in the same JVM.
 */
public class RocksDocumentStore implements DocumentStore {
    private static final Logger log = LoggerFactory.getLogger(RocksDocumentStore.class);

    private final OptimisticTransactionDB transactionDB;
    private final DocumentCodec codec;
    private final WriteOptions writeOpts;
    private final OptimisticTransactionOptions txnOpts;
    private final ReadOptions readOpts;
    private final ReadOptions scanReadOpts;
    private final Options dbOptions;
    private final Cache blockCache;
    private final Filter bloomFilter;
    private final int conflictRetries;
    private final AtomicLong txnConflictCount = new AtomicLong(0);

    public RocksDocumentStore(StorageConfig config) throws StoreException {
        this(config, new JsonDocumentCodec());
    }

    public RocksDocumentStore(StorageConfig config, DocumentCodec codec) throws StoreException {
        this.codec = codec;
        this.conflictRetries = config.getConflictRetries();

        RocksDB.loadLibrary();

        this.blockCache = new LRUCache(config.getBlockCacheSizeMB() * 1024L * 1024L);
        this.bloomFilter = new BloomFilter(10, false);

        BlockBasedTableConfig tableConfig = new BlockBasedTableConfig()
                .setBlockCache(blockCache)
                .setFilterPolicy(bloomFilter)
                .setCacheIndexAndFilterBlocks(true)
                .setPinL0FilterAndIndexBlocksInCache(true);

        this.dbOptions = new Options()
                .setCreateIfMissing(true)
                .setCompressionType(CompressionType.LZ4_COMPRESSION)
                .setWriteBufferSize(config.getMemoryBufferSizeMB() * 1024L * 1024L)
                .setMaxWriteBufferNumber(config.getMaxMemoryBuffers())
                .setMaxBackgroundJobs(config.getBackgroundThreads())
                .setTableFormatConfig(tableConfig);

        try {
            this.transactionDB = OptimisticTransactionDB.open(dbOptions, config.getDataDirectory());
        } catch (RocksDBException e) {
            blockCache.close();
            bloomFilter.close();
            dbOptions.close();
            throw new StoreException("Failed to open document store at " + config.getDataDirectory(), e);
        }

        this.writeOpts = new WriteOptions()
                .setSync(config.isDurableWrites());

        // Snapshot at transaction start so any write after our read makes the commit fail
        this.txnOpts = new OptimisticTransactionOptions()
                .setSetSnapshot(true);

        this.readOpts = new ReadOptions();

        // Scans should not evict hot blocks
        this.scanReadOpts = new ReadOptions()
                .setFillCache(false);

        log.info("Opened document store at {}", config.getDataDirectory());
    }

    @Override
    public ObjectNode findOneAndUpdate(DocumentFilter filter, DocumentUpdate update) throws StoreException {
        try (final RocksIterator iter = transactionDB.newIterator(scanReadOpts)) {
            iter.seekToFirst();

            while (iter.isValid()) {
                byte[] key = iter.key();
                ObjectNode candidate = codec.decode(iter.value());

                if (filter.matches(candidate)) {
                    ObjectNode updated = tryAtomicUpdate(key, filter, update);
                    if (updated != null) {
                        return updated;
                    }
                }

                iter.next();
            }
            iter.status();
        } catch (RocksDBException e) {
            throw new StoreException("Failed to scan documents", e);
        } catch (IllegalArgumentException e) {
            throw new StoreException("Unreadable document in store", e);
        }
        return null;
    }

    @Override
    public boolean updateOne(String id, DocumentUpdate update) throws StoreException {
        byte[] key = id.getBytes(UTF_8);

        for (int attempt = 0; ; attempt++) {
            try (Transaction txn = transactionDB.beginTransaction(writeOpts, txnOpts)) {
                byte[] value = txn.getForUpdate(readOpts, key, true);
                if (value == null) {
                    return false;
                }

                ObjectNode document = codec.decode(value);
                update.applyTo(document);
                txn.put(key, codec.encode(document));
                txn.commit();
                return true;
            } catch (RocksDBException e) {
                if (!isConflict(e) || attempt >= conflictRetries) {
                    throw new StoreException("Failed to update document " + id, e);
                }
                txnConflictCount.incrementAndGet();
                log.debug("Write conflict on document {}, retrying ({}/{})", id, attempt + 1, conflictRetries);
            }
        }
    }

    @Override
    public boolean deleteOne(String id) throws StoreException {
        byte[] key = id.getBytes(UTF_8);

        try (Transaction txn = transactionDB.beginTransaction(writeOpts, txnOpts)) {
            if (txn.getForUpdate(readOpts, key, true) == null) {
                return false;
            }
            txn.delete(key);
            txn.commit();
            return true;
        } catch (RocksDBException e) {
            throw new StoreException("Failed to delete document " + id, e);
        }
    }

    @Override
    public String insert(ObjectNode document) throws StoreException {
        ObjectNode copy = document.deepCopy();
        JsonNode idNode = copy.get(ID_FIELD);
        String id;
        if (idNode == null || idNode.isNull()) {
            id = UUID.randomUUID().toString();
            copy.put(ID_FIELD, id);
        } else {
            id = idNode.asText();
            copy.put(ID_FIELD, id);
        }

        try {
            transactionDB.put(writeOpts, id.getBytes(UTF_8), codec.encode(copy));
        } catch (RocksDBException e) {
            throw new StoreException("Failed to insert document " + id, e);
        }
        return id;
    }

    @Override
    public ObjectNode findById(String id) throws StoreException {
        try {
            byte[] value = transactionDB.get(readOpts, id.getBytes(UTF_8));
            return value == null ? null : codec.decode(value);
        } catch (RocksDBException e) {
            throw new StoreException("Failed to read document " + id, e);
        }
    }

    @Override
    public long count() throws StoreException {
        long total = 0;
        try (final RocksIterator iter = transactionDB.newIterator(scanReadOpts)) {
            for (iter.seekToFirst(); iter.isValid(); iter.next()) {
                total++;
            }
            iter.status();
        } catch (RocksDBException e) {
            throw new StoreException("Failed to count documents", e);
        }
        return total;
    }

    /**
     * Number of transactions that lost a race against another writer.
     * Useful for monitoring contention between workers.
     */
    public long getTransactionConflictCount() {
        return txnConflictCount.get();
    }

    @Override
    public void close() {
        scanReadOpts.close();
        readOpts.close();
        txnOpts.close();
        writeOpts.close();
        transactionDB.close();
        dbOptions.close();
        blockCache.close();
        bloomFilter.close();
        log.info("Closed document store");
    }

    /**
     * Re-check and update one candidate inside a transaction.
     *
     * @return the updated document, or null if it no longer matches or another writer won
     */
    private ObjectNode tryAtomicUpdate(byte[] key, DocumentFilter filter, DocumentUpdate update)
            throws RocksDBException {
        try (Transaction txn = transactionDB.beginTransaction(writeOpts, txnOpts)) {
            byte[] currentValue = txn.getForUpdate(readOpts, key, true);
            if (currentValue == null) {
                return null;
            }

            ObjectNode current = codec.decode(currentValue);
            if (!filter.matches(current)) {
                return null;
            }

            update.applyTo(current);
            txn.put(key, codec.encode(current));
            txn.commit();
            return current;
        } catch (RocksDBException e) {
            if (!isConflict(e)) {
                throw e;
            }
            txnConflictCount.incrementAndGet();
            log.debug("Lost claim race on document {}", new String(key, UTF_8));
            return null;
        }
    }

    private static boolean isConflict(RocksDBException e) {
        Status status = e.getStatus();
        return status != null
                && (status.getCode() == Status.Code.Busy || status.getCode() == Status.Code.TryAgain);
    }
}
