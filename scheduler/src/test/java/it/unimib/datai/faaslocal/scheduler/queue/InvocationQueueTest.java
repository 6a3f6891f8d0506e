package it.unimib.datai.faaslocal.scheduler.queue;

import it.unimib.datai.faaslocal.common.model.Invocation;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InvocationQueueTest {

    @Test
    void popReturnsInvocationsInPushOrder() {
        InvocationQueue queue = new InvocationQueue("orders");
        queue.push(Invocation.create("orders", "r1", null));
        queue.push(Invocation.create("orders", "r2", null));

        assertThat(queue.pop()).map(Invocation::requestId).contains("r1");
        assertThat(queue.pop()).map(Invocation::requestId).contains("r2");
        assertThat(queue.pop()).isEmpty();
    }

    @Test
    void popOnEmptyQueue_returnsEmptyWithoutBlocking() {
        InvocationQueue queue = new InvocationQueue("orders");

        assertThat(queue.pop()).isEmpty();
        assertThat(queue.size()).isZero();
    }

    @Test
    void drain_removesEverythingOldestFirst() {
        InvocationQueue queue = new InvocationQueue("orders");
        queue.push(Invocation.create("orders", "r1", null));
        queue.push(Invocation.create("orders", "r2", null));

        assertThat(queue.drain()).extracting(Invocation::requestId).containsExactly("r1", "r2");
        assertThat(queue.size()).isZero();
        assertThat(queue.pop()).isEmpty();
    }
}
