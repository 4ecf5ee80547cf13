package com.umitunal.cronq.storage;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.umitunal.cronq.core.DocumentFilter;
import com.umitunal.cronq.core.DocumentUpdate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;

import static org.assertj.core.api.Assertions.*;

class InMemoryDocumentStoreTest {

    private final InMemoryDocumentStore store = new InMemoryDocumentStore();

    @Test
    @DisplayName("Returned documents are copies of the stored ones")
    void testCopies() {
        ObjectNode original = JsonNodeFactory.instance.objectNode().put("_id", "a").put("value", 1);
        store.insert(original);
        original.put("value", 2);

        ObjectNode read = store.findById("a");
        read.put("value", 3);

        assertThat(store.findById("a").get("value").asInt()).isEqualTo(1);
    }

    @Test
    @DisplayName("Selects matching documents in insertion order")
    void testInsertionOrder() {
        store.insert(JsonNodeFactory.instance.objectNode().put("_id", "z").put("ready", true));
        store.insert(JsonNodeFactory.instance.objectNode().put("_id", "a").put("ready", true));

        ObjectNode first = store.findOneAndUpdate(DocumentFilter.exists("ready"), DocumentUpdate.unset("ready"));

        assertThat(first.get("_id").asText()).isEqualTo("z");
    }

    @Test
    @DisplayName("Concurrent findOneAndUpdate hands a document to one caller only")
    void testAtomicClaim() throws Exception {
        store.insert(JsonNodeFactory.instance.objectNode().put("_id", "only").put("state", "open"));
        DocumentFilter open = DocumentFilter.equalTo("state", TextNode.valueOf("open"));
        DocumentUpdate take = DocumentUpdate.set("state", TextNode.valueOf("taken"));

        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<ObjectNode>> results = new ArrayList<>();
        try {
            for (int i = 0; i < 8; i++) {
                results.add(executor.submit(() -> {
                    go.await();
                    return store.findOneAndUpdate(open, take);
                }));
            }
            go.countDown();

            long winners = 0;
            for (Future<ObjectNode> result : results) {
                if (result.get(5, TimeUnit.SECONDS) != null) {
                    winners++;
                }
            }
            assertThat(winners).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }
}
