package com.agentgate.core.audit;

import com.agentgate.api.audit.AuditEvent;
import com.agentgate.api.audit.AuditSink;
import com.agentgate.api.security.Decision;
import com.agentgate.api.security.ResourceKind;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AuditSinkDecoratorsTest {

    private static AuditEvent event(String name) {
        return AuditEvent.builder()
                .timestamp(Instant.now())
                .userId("u")
                .resourceType(ResourceKind.TABLE)
                .resourceName(name)
                .action("read")
                .decision(Decision.ALLOW)
                .build();
    }

    @Test
    void testCompositeIsolatesFailingSink() {
        InMemoryAuditSink first = new InMemoryAuditSink();
        InMemoryAuditSink last = new InMemoryAuditSink();
        AuditSink broken = e -> {
            throw new IllegalStateException("boom");
        };
        CompositeAuditSink composite = new CompositeAuditSink(List.of(first, broken, last));

        assertDoesNotThrow(() -> composite.record(event("product")));

        assertEquals(1, first.size());
        assertEquals(1, last.size());
    }

    @Test
    void testAsyncSinkPreservesOrder() throws InterruptedException {
        InMemoryAuditSink target = new InMemoryAuditSink();
        CountDownLatch done = new CountDownLatch(3);
        AsyncAuditSink async = new AsyncAuditSink(e -> {
            target.record(e);
            done.countDown();
        }, 16);
        try {
            async.record(event("a"));
            async.record(event("b"));
            async.record(event("c"));

            assertTrue(done.await(5, TimeUnit.SECONDS));
            assertEquals(List.of("a", "b", "c"),
                    target.events().stream().map(AuditEvent::getResourceName).toList());
        } finally {
            async.shutdown();
        }
    }

    @Test
    void testAsyncSinkDropsAfterShutdown() {
        InMemoryAuditSink target = new InMemoryAuditSink();
        AsyncAuditSink async = new AsyncAuditSink(target, 4);
        async.shutdown();

        assertDoesNotThrow(() -> async.record(event("late")));
        assertEquals(0, target.size());
    }

    @Test
    void testRecorderSwallowsSinkFailure() {
        AuditRecorder recorder = new AuditRecorder(e -> {
            throw new IllegalStateException("unavailable");
        });

        assertDoesNotThrow(() -> recorder.record(event("product")));
    }
}
