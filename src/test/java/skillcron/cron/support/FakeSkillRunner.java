package skillcron.cron.support;

import skillcron.cron.runner.AbortSignal;
import skillcron.cron.runner.SkillEvent;
import skillcron.cron.runner.SkillRunner;
import skillcron.cron.runner.Target;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Scriptable skill runner. By default every invocation succeeds.
 */
public final class FakeSkillRunner implements SkillRunner {

    public interface Behaviour {
        void run(Target target, Consumer<SkillEvent> onEvent) throws Exception;
    }

    private final AtomicInteger invocations = new AtomicInteger();
    private final List<String> sessionIds = new CopyOnWriteArrayList<>();
    private volatile Behaviour behaviour = (target, onEvent) -> onEvent.accept(SkillEvent.text("ok"));
    private volatile CountDownLatch gate;
    private final CountDownLatch entered = new CountDownLatch(1);

    public static FakeSkillRunner succeeding() {
        return new FakeSkillRunner();
    }

    public static FakeSkillRunner throwing(String message) {
        FakeSkillRunner runner = new FakeSkillRunner();
        runner.behaviour = (target, onEvent) -> {
            throw new IllegalStateException(message);
        };
        return runner;
    }

    public static FakeSkillRunner emittingErrors(String... errors) {
        FakeSkillRunner runner = new FakeSkillRunner();
        runner.behaviour = (target, onEvent) -> {
            onEvent.accept(SkillEvent.text("working"));
            for (String error : errors) {
                onEvent.accept(SkillEvent.error(error));
            }
        };
        return runner;
    }

    public FakeSkillRunner behaving(Behaviour behaviour) {
        this.behaviour = behaviour;
        return this;
    }

    /**
     * Make every invocation block until {@link #release()} is called.
     */
    public FakeSkillRunner blocking() {
        this.gate = new CountDownLatch(1);
        return this;
    }

    public void release() {
        CountDownLatch g = gate;
        if (g != null) {
            g.countDown();
        }
    }

    public boolean awaitEntered(long timeout, TimeUnit unit) throws InterruptedException {
        return entered.await(timeout, unit);
    }

    @Override
    public void execute(Target target, String query, String profileId, String sessionId,
            AbortSignal signal, Consumer<SkillEvent> onEvent) throws Exception {
        invocations.incrementAndGet();
        sessionIds.add(sessionId);
        entered.countDown();

        CountDownLatch g = gate;
        if (g != null && !g.await(10, TimeUnit.SECONDS)) {
            throw new IllegalStateException("fake runner was never released");
        }
        behaviour.run(target, onEvent);
    }

    public int invocations() {
        return invocations.get();
    }

    public List<String> sessionIds() {
        return sessionIds;
    }
}
