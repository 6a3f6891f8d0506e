package it.unimib.datai.faaslocal.scheduler.response;

import it.unimib.datai.faaslocal.common.model.InvocationResponse;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseRegistryTest {

    private final ResponseRegistry registry = new ResponseRegistry();

    @Test
    void resolve_deliversOnlyTheFirstResponse() {
        CompletableFuture<InvocationResponse> completion = new CompletableFuture<>();
        registry.push("r1", completion);

        InvocationResponse first = InvocationResponse.ok("first");
        InvocationResponse second = InvocationResponse.ok("second");

        assertThat(registry.resolve("r1", first)).isTrue();
        assertThat(registry.resolve("r1", second)).isFalse();
        assertThat(completion).isCompletedWithValue(first);
        assertThat(registry.size()).isZero();
    }

    @Test
    void resolve_unknownId_hasNoEffect() {
        CompletableFuture<InvocationResponse> completion = new CompletableFuture<>();
        registry.push("r1", completion);

        assertThat(registry.resolve("nonexistent", InvocationResponse.ok("x"))).isFalse();
        assertThat(completion).isNotDone();
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void pop_removesHandle() {
        CompletableFuture<InvocationResponse> completion = new CompletableFuture<>();
        registry.push("r1", completion);

        assertThat(registry.pop("r1")).containsSame(completion);
        assertThat(registry.pop("r1")).isEmpty();
    }

    @Test
    void push_sameIdTwice_keepsLatestHandle() {
        CompletableFuture<InvocationResponse> stale = new CompletableFuture<>();
        CompletableFuture<InvocationResponse> latest = new CompletableFuture<>();
        registry.push("r1", stale);
        registry.push("r1", latest);

        registry.resolve("r1", InvocationResponse.ok("done"));

        assertThat(latest).isDone();
        assertThat(stale).isNotDone();
    }
}
