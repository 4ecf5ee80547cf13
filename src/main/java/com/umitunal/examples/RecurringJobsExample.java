package com.umitunal.examples;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.umitunal.cronq.config.CronConfig;
import com.umitunal.cronq.config.StorageConfig;
import com.umitunal.cronq.core.DocumentStore;
import com.umitunal.cronq.core.JobDocument;
import com.umitunal.cronq.storage.RocksDocumentStore;
import com.umitunal.cronq.worker.CronListener;
import com.umitunal.cronq.worker.CronWorker;
import com.umitunal.cronq.worker.JobProcessor;

import java.time.Instant;

/**
 * Recurring jobs example - two workers sharing a job that runs every second for five seconds.
 */
public class RecurringJobsExample {

    public static void main(String[] args) {
        System.out.println("=== Recurring Jobs Example ===\n");

        StorageConfig storage = StorageConfig.newBuilder("/tmp/cronq-recurring")
                .build();

        try (DocumentStore store = new RocksDocumentStore(storage)) {

            ObjectNode heartbeat = JsonNodeFactory.instance.objectNode()
                    .put("_id", "heartbeat")
                    .put("interval", "* * * * * *")
                    .put("repeatUntil", Instant.now().plusSeconds(5).toString())
                    .putNull("sleepUntil");
            store.insert(heartbeat);

            JobProcessor processor = job -> {
                System.out.println("  " + Thread.currentThread().getName() + " ran " + job.getId()
                        + " at " + job.getLockedAt());
                return JobProcessor.ProcessingResult.success();
            };

            CronListener listener = new CronListener() {
                @Override
                public void onError(Throwable error, JobDocument job, CronWorker worker) {
                    System.err.println("  " + worker.getWorkerId() + " error: " + error.getMessage());
                }
            };

            CronConfig config = CronConfig.newBuilder()
                    .withLockDuration(10_000)
                    .withIdleDelay(100)
                    .build();

            CronWorker worker1 = CronWorker.builder("worker-1", store, processor)
                    .withConfig(config)
                    .withListener(listener)
                    .build();
            CronWorker worker2 = CronWorker.builder("worker-2", store, processor)
                    .withConfig(config)
                    .withListener(listener)
                    .build();

            worker1.start();
            worker2.start();

            Thread.sleep(7000);

            worker1.stop().join();
            worker2.stop().join();

            System.out.println("\nWorker 1 processed: " + worker1.getProcessedCount());
            System.out.println("Worker 2 processed: " + worker2.getProcessedCount());
            System.out.println("Expired job: " + store.findById("heartbeat"));

        } catch (Exception e) {
            e.printStackTrace();
        }
    }
}
