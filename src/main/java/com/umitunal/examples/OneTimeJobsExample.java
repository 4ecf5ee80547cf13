package com.umitunal.examples;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.umitunal.cronq.config.CronConfig;
import com.umitunal.cronq.config.StorageConfig;
import com.umitunal.cronq.core.DocumentStore;
import com.umitunal.cronq.storage.RocksDocumentStore;
import com.umitunal.cronq.worker.CronWorker;
import com.umitunal.cronq.worker.JobProcessor;

import java.time.Instant;

/**
 * One-time jobs example - immediate, delayed and auto-removed jobs.
 */
public class OneTimeJobsExample {

    public static void main(String[] args) {
        System.out.println("=== One-Time Jobs Example ===\n");

        StorageConfig storage = StorageConfig.newBuilder("/tmp/cronq-one-time")
                .build();

        try (DocumentStore store = new RocksDocumentStore(storage)) {

            ObjectNode immediate = JsonNodeFactory.instance.objectNode()
                    .put("_id", "send-welcome-mail")
                    .putNull("sleepUntil");
            store.insert(immediate);

            ObjectNode delayed = JsonNodeFactory.instance.objectNode()
                    .put("_id", "send-reminder")
                    .put("sleepUntil", Instant.now().plusSeconds(2).toEpochMilli());
            store.insert(delayed);

            ObjectNode disposable = JsonNodeFactory.instance.objectNode()
                    .put("_id", "clear-cache")
                    .put("autoRemove", true)
                    .putNull("sleepUntil");
            store.insert(disposable);

            System.out.println("Inserted 3 jobs, documents in store: " + store.count());

            JobProcessor processor = job -> {
                System.out.println("  Processing " + job.getId());
                return JobProcessor.ProcessingResult.success();
            };

            CronConfig config = CronConfig.newBuilder()
                    .withIdleDelay(200)
                    .build();

            try (CronWorker worker = CronWorker.builder("one-time", store, processor)
                    .withConfig(config)
                    .build()) {
                worker.start().join();
                Thread.sleep(3000);
            }

            System.out.println("\nDocuments left: " + store.count());
            System.out.println("send-welcome-mail: " + store.findById("send-welcome-mail"));
            System.out.println("clear-cache: " + store.findById("clear-cache"));

        } catch (Exception e) {
            e.printStackTrace();
        }
    }
}
